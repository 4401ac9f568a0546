package dev.scriptorium.ingestion;

import java.time.Duration;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Run settings bound from {@code scriptorium.ingest.*}. Values are checked when converted with
 * {@link #toConfig()}, so an invalid command line option is reported instead of failing startup.
 */
@ConfigurationProperties(prefix = "scriptorium.ingest")
public record IngestionProperties(
        @Nullable String collection,
        @Nullable String embeddingModel,
        @Nullable Integer maxDepth,
        @Nullable Integer chunkSize,
        @Nullable Integer maxConcurrent,
        @Nullable Integer batchSize,
        @Nullable Duration fetchTimeout) {

    /**
     * Applies defaults to unset values and validates the result.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public IngestionConfig toConfig() {
        return new IngestionConfig(
                collection != null ? collection : IngestionConfig.DEFAULT_COLLECTION,
                embeddingModel != null ? embeddingModel : IngestionConfig.DEFAULT_EMBEDDING_MODEL,
                maxDepth != null ? maxDepth : IngestionConfig.DEFAULT_MAX_DEPTH,
                chunkSize != null ? chunkSize : IngestionConfig.DEFAULT_CHUNK_SIZE,
                maxConcurrent != null ? maxConcurrent : IngestionConfig.DEFAULT_MAX_CONCURRENT,
                batchSize != null ? batchSize : IngestionConfig.DEFAULT_BATCH_SIZE,
                fetchTimeout != null ? fetchTimeout : IngestionConfig.DEFAULT_FETCH_TIMEOUT);
    }
}
