package dev.scriptorium.ingestion;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * What one fetched source contributed to a run.
 *
 * @param url        source URL
 * @param chunkCount chunks produced from it
 * @param error      fetch error, or {@code null} when the fetch succeeded
 */
public record SourceResult(String url, int chunkCount, @Nullable String error) {

    public SourceResult {
        Objects.requireNonNull(url, "url must not be null");
    }

    public static SourceResult chunked(String url, int chunkCount) {
        return new SourceResult(url, chunkCount, null);
    }

    public static SourceResult failed(String url, String error) {
        return new SourceResult(url, 0, error);
    }

    public boolean failed() {
        return error != null;
    }
}
