package dev.scriptorium.index;

import java.util.Map;

/**
 * One similarity search hit.
 *
 * @param id       entry id as given to {@code upsertBatch}
 * @param text     stored text
 * @param score    relevance score, higher is better
 * @param metadata stored metadata
 */
public record IndexMatch(String id, String text, double score, Map<String, Object> metadata) {
    public IndexMatch {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
