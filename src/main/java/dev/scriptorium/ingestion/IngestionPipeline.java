package dev.scriptorium.ingestion;

import dev.scriptorium.crawl.FetchOrchestrator;
import dev.scriptorium.crawl.FetchResult;
import dev.scriptorium.crawl.FetchStrategy;
import dev.scriptorium.crawl.SitemapResolver;
import dev.scriptorium.crawl.SourceClassifier;
import dev.scriptorium.crawl.SourceType;
import dev.scriptorium.index.CollectionHandle;
import dev.scriptorium.index.VectorIndex;
import dev.scriptorium.index.VectorIndexException;
import dev.scriptorium.ingestion.chunking.Chunk;
import dev.scriptorium.ingestion.chunking.ChunkMetadata;
import dev.scriptorium.ingestion.chunking.MarkdownChunker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one ingestion: classify the URL -> fetch -> chunk -> analyze -> write to the vector index.
 *
 * <p>Sitemaps are resolved and their URLs fetched as one batch, {@code .txt} resources are fetched
 * alone, and any other page is crawled breadth-first up to {@code maxDepth} levels. Chunk ids
 * ({@code chunk-<n>}) are numbered across the whole run in fetch order.
 *
 * <p>Writes are best-effort: chunks go to the index in batches of {@code batchSize}, and a failing
 * batch stops the run with an {@link IngestionException} that reports how many chunks earlier
 * batches wrote. Those are not rolled back.
 */
@Service
public class IngestionPipeline {

    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final SitemapResolver sitemapResolver;
    private final FetchOrchestrator fetchOrchestrator;
    private final MarkdownChunker chunker;
    private final VectorIndex vectorIndex;

    public IngestionPipeline(SitemapResolver sitemapResolver,
                             FetchOrchestrator fetchOrchestrator,
                             MarkdownChunker chunker,
                             VectorIndex vectorIndex) {
        this.sitemapResolver = sitemapResolver;
        this.fetchOrchestrator = fetchOrchestrator;
        this.chunker = chunker;
        this.vectorIndex = vectorIndex;
    }

    /**
     * Ingest everything reachable from {@code url}.
     *
     * @param url    sitemap, text resource or page URL
     * @param config run settings
     * @return chunk counts per source and in total
     * @throws IllegalArgumentException if the URL is blank, the collection name is invalid or the
     *                                  embedding model is unknown; checked before anything is fetched
     * @throws IngestionException       if the collection cannot be opened or a vector index write fails
     */
    public IngestionOutcome ingest(String url, IngestionConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        vectorIndex.validateCollection(config.collection(), config.embeddingModel());

        List<FetchResult> fetched = fetch(url.strip(), config);

        List<Chunk> chunks = new ArrayList<>();
        List<SourceResult> sources = new ArrayList<>(fetched.size());
        for (FetchResult result : fetched) {
            if (result instanceof FetchResult.Success success) {
                int before = chunks.size();
                for (String text : chunker.chunk(success.markdown(), config.chunkSize())) {
                    chunks.add(new Chunk(chunks.size(), text, success.url()));
                }
                int produced = chunks.size() - before;
                log.debug("{} -> {} chunks", success.url(), produced);
                sources.add(SourceResult.chunked(success.url(), produced));
            } else if (result instanceof FetchResult.Failure failure) {
                sources.add(SourceResult.failed(failure.url(), failure.errorMessage()));
            }
        }

        if (chunks.isEmpty()) {
            log.info("No chunks produced from {} ({} sources fetched)", url, sources.size());
            return new IngestionOutcome(0, 0, sources);
        }

        int inserted = store(chunks, sources, config);
        log.info("Ingested {} chunks from {} sources into collection '{}'",
                inserted, sources.size(), config.collection());
        return new IngestionOutcome(inserted, chunks.size(), sources);
    }

    private List<FetchResult> fetch(String url, IngestionConfig config) {
        SourceType type = SourceClassifier.classify(url);
        log.info("Ingesting {} as {}", url, type);
        switch (type) {
            case SITEMAP: {
                List<String> urls = sitemapResolver.resolve(url);
                if (urls.isEmpty()) {
                    log.warn("Sitemap {} listed no URLs", url);
                    return List.of();
                }
                log.info("Sitemap {} lists {} URLs", url, urls.size());
                return fetchOrchestrator.fetch(urls, FetchStrategy.batch(),
                        config.maxConcurrent(), config.fetchTimeout());
            }
            case TEXT_RESOURCE:
                return fetchOrchestrator.fetch(List.of(url), FetchStrategy.single(),
                        config.maxConcurrent(), config.fetchTimeout());
            case GENERIC_PAGE:
            default:
                return fetchOrchestrator.fetch(List.of(url), FetchStrategy.recursive(config.maxDepth()),
                        config.maxConcurrent(), config.fetchTimeout());
        }
    }

    private int store(List<Chunk> chunks, List<SourceResult> sources, IngestionConfig config) {
        CollectionHandle handle;
        try {
            handle = vectorIndex.openOrCreateCollection(config.collection(), config.embeddingModel());
        } catch (VectorIndexException | IllegalStateException e) {
            log.error("Could not open collection '{}': {}", config.collection(), e.getMessage());
            throw new IngestionException("Could not open collection '" + config.collection() + "'",
                    new IngestionOutcome(0, chunks.size(), sources), e);
        }

        int inserted = 0;
        for (int start = 0; start < chunks.size(); start += config.batchSize()) {
            List<Chunk> batch = chunks.subList(start, Math.min(start + config.batchSize(), chunks.size()));
            List<String> ids = new ArrayList<>(batch.size());
            List<String> texts = new ArrayList<>(batch.size());
            List<Map<String, Object>> metadatas = new ArrayList<>(batch.size());
            for (Chunk chunk : batch) {
                ids.add(chunk.id());
                texts.add(chunk.text());
                metadatas.add(ChunkMetadata.of(chunk).toMap());
            }
            try {
                vectorIndex.upsertBatch(handle, ids, texts, metadatas);
            } catch (VectorIndexException e) {
                log.error("Write of chunks {}..{} failed after {} chunks were inserted",
                        start, start + batch.size() - 1, inserted);
                throw new IngestionException("Vector index write failed after " + inserted + " chunks",
                        new IngestionOutcome(inserted, chunks.size(), sources), e);
            }
            inserted += batch.size();
            log.debug("Inserted {}/{} chunks", inserted, chunks.size());
        }
        return inserted;
    }
}
