package dev.scriptorium.index;

import java.util.List;
import java.util.Map;

/**
 * Named collections of embedded text.
 *
 * <p>A failed {@link #upsertBatch} leaves an unknown subset of the batch written; callers that need
 * certainty must re-run the batch, which is safe because entries are keyed by id.
 */
public interface VectorIndex {

    /**
     * Check a collection name and embedding model without touching the backing store.
     *
     * @param name               collection name
     * @param embeddingModelName name of the embedding function the collection would use
     * @throws IllegalArgumentException if the name is not a valid collection name or the model is unknown
     */
    void validateCollection(String name, String embeddingModelName);

    /**
     * Open a collection, creating it if it does not exist.
     *
     * @param name               collection name
     * @param embeddingModelName name of the embedding function the collection uses
     * @return a handle for subsequent calls
     * @throws IllegalArgumentException if the name or embedding model is invalid
     * @throws IllegalStateException    if the collection exists with another embedding model
     * @throws VectorIndexException     if the backing store cannot be opened
     */
    CollectionHandle openOrCreateCollection(String name, String embeddingModelName);

    /**
     * Embed and write a batch, replacing entries that already have the same ids.
     *
     * @param handle    target collection
     * @param ids       entry ids
     * @param texts     entry texts, same length as {@code ids}
     * @param metadatas entry metadata, same length as {@code ids}
     * @throws IllegalArgumentException if the list lengths differ
     * @throws VectorIndexException     if embedding or writing fails
     */
    void upsertBatch(CollectionHandle handle, List<String> ids, List<String> texts,
                     List<Map<String, Object>> metadatas);

    /**
     * Similarity search.
     *
     * @param handle    collection to search
     * @param queryText query text, embedded with the collection's model
     * @param topK      maximum number of matches
     * @return matches ranked by descending score
     */
    List<IndexMatch> query(CollectionHandle handle, String queryText, int topK);
}
