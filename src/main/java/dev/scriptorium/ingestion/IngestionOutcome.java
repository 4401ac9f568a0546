package dev.scriptorium.ingestion;

import java.util.List;

/**
 * Result of an ingestion run.
 *
 * @param totalChunksInserted chunks written to the vector index
 * @param totalChunksProduced chunks produced by chunking; differs from inserted only after a failed write
 * @param perSourceResults    one entry per fetched source, in fetch order
 */
public record IngestionOutcome(int totalChunksInserted, int totalChunksProduced,
                               List<SourceResult> perSourceResults) {

    public IngestionOutcome {
        perSourceResults = perSourceResults == null ? List.of() : List.copyOf(perSourceResults);
    }

    /** A run that fetched nothing. */
    public static IngestionOutcome empty() {
        return new IngestionOutcome(0, 0, List.of());
    }

    /** True when every produced chunk was written. */
    public boolean isComplete() {
        return totalChunksInserted == totalChunksProduced;
    }

    public boolean hasChunks() {
        return totalChunksInserted > 0;
    }

    public long failedSources() {
        return perSourceResults.stream().filter(SourceResult::failed).count();
    }
}
