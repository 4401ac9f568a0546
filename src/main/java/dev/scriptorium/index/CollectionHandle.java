package dev.scriptorium.index;

import java.util.Objects;

/**
 * Reference to an opened collection.
 *
 * @param name               collection name
 * @param embeddingModelName embedding function the collection was opened with
 */
public record CollectionHandle(String name, String embeddingModelName) {
    public CollectionHandle {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(embeddingModelName, "embeddingModelName must not be null");
    }
}
