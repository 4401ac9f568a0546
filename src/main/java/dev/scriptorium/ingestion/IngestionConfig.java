package dev.scriptorium.ingestion;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of one ingestion run. Validated on construction so a bad value fails before any I/O.
 *
 * @param collection     target collection name
 * @param embeddingModel embedding function the collection is created with
 * @param maxDepth       link levels followed for generic pages
 * @param chunkSize      maximum chunk length in characters
 * @param maxConcurrent  maximum page fetches in flight
 * @param batchSize      chunks per vector index write
 * @param fetchTimeout   deadline of each page fetch
 */
public record IngestionConfig(
        String collection,
        String embeddingModel,
        int maxDepth,
        int chunkSize,
        int maxConcurrent,
        int batchSize,
        Duration fetchTimeout) {

    public static final String DEFAULT_COLLECTION = "docs";
    public static final String DEFAULT_EMBEDDING_MODEL = "all-MiniLM-L6-v2";
    public static final int DEFAULT_MAX_DEPTH = 3;
    public static final int DEFAULT_CHUNK_SIZE = 1000;
    public static final int DEFAULT_MAX_CONCURRENT = 10;
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(60);

    public IngestionConfig {
        requireNotBlank(collection, "collection");
        requireNotBlank(embeddingModel, "embeddingModel");
        requirePositive(maxDepth, "maxDepth");
        requirePositive(chunkSize, "chunkSize");
        requirePositive(maxConcurrent, "maxConcurrent");
        requirePositive(batchSize, "batchSize");
        Objects.requireNonNull(fetchTimeout, "fetchTimeout must not be null");
        if (fetchTimeout.isZero() || fetchTimeout.isNegative()) {
            throw new IllegalArgumentException("fetchTimeout must be positive, got " + fetchTimeout);
        }
    }

    /** Defaults matching the command line defaults. */
    public static IngestionConfig defaults() {
        return new IngestionConfig(DEFAULT_COLLECTION, DEFAULT_EMBEDDING_MODEL, DEFAULT_MAX_DEPTH,
                DEFAULT_CHUNK_SIZE, DEFAULT_MAX_CONCURRENT, DEFAULT_BATCH_SIZE, DEFAULT_FETCH_TIMEOUT);
    }

    private static void requireNotBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }
}
