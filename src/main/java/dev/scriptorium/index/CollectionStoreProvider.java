package dev.scriptorium.index;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;

/**
 * Supplies the langchain4j {@link EmbeddingStore} behind each named collection.
 */
public interface CollectionStoreProvider {

    /**
     * Open the store of a collection, creating it when missing.
     *
     * @param collection         validated collection name
     * @param embeddingModelName embedding function the collection is used with
     * @param dimension          embedding dimension of that function
     * @return the collection's store
     */
    EmbeddingStore<TextSegment> open(String collection, String embeddingModelName, int dimension);

    /**
     * Map a caller id to the id stored in the backend. Identity unless the backend restricts ids.
     */
    default String entryId(String collection, String id) {
        return id;
    }

    /**
     * Called after each successful write; backends that keep state in memory flush it here.
     */
    default void persist(String collection, EmbeddingStore<TextSegment> store) {
    }
}
