package dev.scriptorium.cli;

import dev.scriptorium.ingestion.IngestionConfig;
import dev.scriptorium.ingestion.IngestionException;
import dev.scriptorium.ingestion.IngestionOutcome;
import dev.scriptorium.ingestion.IngestionPipeline;
import dev.scriptorium.ingestion.IngestionProperties;
import dev.scriptorium.ingestion.SourceResult;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command line entry: {@code scriptorium <url> [--collection=..] [--db-dir=..]
 * [--embedding-model=..] [--chunk-size=..] [--max-depth=..] [--max-concurrent=..]
 * [--batch-size=..]}.
 *
 * <p>Options reach {@link IngestionProperties} through the placeholders in {@code application.yml}.
 * The process exit code reports the result:
 *
 * <ul>
 *   <li>{@value #EXIT_OK}: chunks were inserted
 *   <li>{@value #EXIT_NO_DOCUMENTS}: nothing was produced, including an empty sitemap
 *   <li>{@value #EXIT_USAGE}: missing URL or invalid option
 *   <li>{@value #EXIT_INDEX_FAILURE}: a vector index write failed
 * </ul>
 */
@Component
public class IngestCommand implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(IngestCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_NO_DOCUMENTS = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INDEX_FAILURE = 3;

    static final String USAGE =
            "Usage: scriptorium <url> [--collection=docs] [--db-dir=./vector_db]"
                    + " [--embedding-model=all-MiniLM-L6-v2] [--chunk-size=1000] [--max-depth=3]"
                    + " [--max-concurrent=10] [--batch-size=100]";

    private final IngestionPipeline pipeline;
    private final IngestionProperties properties;

    private int exitCode = EXIT_OK;

    public IngestCommand(IngestionPipeline pipeline, IngestionProperties properties) {
        this.pipeline = pipeline;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getNonOptionArgs());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(List<String> positional) {
        if (positional.isEmpty() || positional.get(0).isBlank()) {
            log.error("No URL given. {}", USAGE);
            return EXIT_USAGE;
        }
        if (positional.size() > 1) {
            log.warn("Ignoring extra arguments {}", positional.subList(1, positional.size()));
        }
        String url = positional.get(0);

        IngestionConfig config;
        try {
            config = properties.toConfig();
        } catch (IllegalArgumentException e) {
            log.error("Invalid option: {}. {}", e.getMessage(), USAGE);
            return EXIT_USAGE;
        }

        IngestionOutcome outcome;
        try {
            outcome = pipeline.ingest(url, config);
        } catch (IllegalArgumentException e) {
            log.error("Invalid option: {}", e.getMessage());
            return EXIT_USAGE;
        } catch (IngestionException e) {
            IngestionOutcome partial = e.partialOutcome();
            log.error(
                    "{}: {} of {} chunks were inserted into '{}' before the failure",
                    e.getMessage(),
                    partial.totalChunksInserted(),
                    partial.totalChunksProduced(),
                    config.collection(),
                    e);
            return EXIT_INDEX_FAILURE;
        }

        report(outcome);
        if (!outcome.hasChunks()) {
            log.warn("No documents found at {}", url);
            return EXIT_NO_DOCUMENTS;
        }
        log.info(
                "Successfully ingested {} chunks into collection '{}'",
                outcome.totalChunksInserted(),
                config.collection());
        return EXIT_OK;
    }

    private static void report(IngestionOutcome outcome) {
        for (SourceResult source : outcome.perSourceResults()) {
            if (source.failed()) {
                log.warn("  {} failed: {}", source.url(), source.error());
            } else {
                log.info("  {} -> {} chunks", source.url(), source.chunkCount());
            }
        }
        if (outcome.failedSources() > 0) {
            log.warn("{} of {} sources failed", outcome.failedSources(), outcome.perSourceResults().size());
        }
    }
}
