package dev.scriptorium.ingestion.chunking;

import java.util.Objects;

/**
 * One chunk of a fetched document.
 *
 * @param index run-wide position of the chunk, starting at 0
 * @param text chunk body
 * @param sourceUrl URL of the document the chunk came from
 */
public record Chunk(int index, String text, String sourceUrl) {
    public Chunk {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(sourceUrl, "sourceUrl must not be null");
    }

    /** Identifier used as the vector index key: {@code chunk-<index>}. */
    public String id() {
        return "chunk-" + index;
    }
}
