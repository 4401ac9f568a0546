package dev.scriptorium.index;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link VectorIndex} over langchain4j embedding stores.
 *
 * <p>Texts are embedded in-process with the collection's {@link EmbeddingModel} and written to the
 * store supplied by a {@link CollectionStoreProvider}. The caller id of each entry is kept in the
 * {@value #CHUNK_ID_KEY} metadata field so queries report it even when the backend rewrites ids.
 * Writes to one collection are serialized.
 */
public class EmbeddingStoreVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingStoreVectorIndex.class);

    static final String CHUNK_ID_KEY = "chunk_id";

    private static final Pattern COLLECTION_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    private final CollectionStoreProvider storeProvider;
    private final EmbeddingModelRegistry models;
    private final Map<String, OpenCollection> collections = new ConcurrentHashMap<>();

    public EmbeddingStoreVectorIndex(CollectionStoreProvider storeProvider, EmbeddingModelRegistry models) {
        this.storeProvider = storeProvider;
        this.models = models;
    }

    @Override
    public void validateCollection(String name, String embeddingModelName) {
        if (name == null || !COLLECTION_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid collection name: '" + name + "'");
        }
        models.requireKnown(embeddingModelName);
    }

    @Override
    public CollectionHandle openOrCreateCollection(String name, String embeddingModelName) {
        validateCollection(name, embeddingModelName);
        EmbeddingModel model = models.resolve(embeddingModelName);
        OpenCollection collection = collections.compute(name, (key, existing) -> {
            if (existing != null) {
                if (!existing.modelName().equalsIgnoreCase(embeddingModelName)) {
                    throw new IllegalStateException("Collection '" + name + "' is open with embedding model '"
                            + existing.modelName() + "', not '" + embeddingModelName + "'");
                }
                return existing;
            }
            try {
                EmbeddingStore<TextSegment> store = storeProvider.open(name, embeddingModelName, model.dimension());
                return new OpenCollection(embeddingModelName, model, store);
            } catch (IllegalArgumentException | IllegalStateException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new VectorIndexException("Could not open collection '" + name + "'", e);
            }
        });
        return new CollectionHandle(name, collection.modelName());
    }

    @Override
    public void upsertBatch(CollectionHandle handle, List<String> ids, List<String> texts,
                            List<Map<String, Object>> metadatas) {
        if (ids.size() != texts.size() || ids.size() != metadatas.size()) {
            throw new IllegalArgumentException("ids, texts and metadatas differ in length: "
                    + ids.size() + "/" + texts.size() + "/" + metadatas.size());
        }
        if (ids.isEmpty()) {
            return;
        }
        OpenCollection collection = require(handle);

        List<String> entryIds = new ArrayList<>(ids.size());
        List<TextSegment> segments = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            Map<String, Object> metadata = new LinkedHashMap<>(metadatas.get(i));
            metadata.put(CHUNK_ID_KEY, ids.get(i));
            entryIds.add(storeProvider.entryId(handle.name(), ids.get(i)));
            segments.add(TextSegment.from(texts.get(i), Metadata.from(metadata)));
        }

        synchronized (collection) {
            try {
                List<Embedding> embeddings = collection.model().embedAll(segments).content();
                collection.store().removeAll(entryIds);
                collection.store().addAll(entryIds, embeddings, segments);
                storeProvider.persist(handle.name(), collection.store());
            } catch (RuntimeException e) {
                throw new VectorIndexException("Failed to upsert " + ids.size()
                        + " entries into collection '" + handle.name() + "'", e);
            }
        }
        log.debug("Upserted {} entries into collection '{}'", ids.size(), handle.name());
    }

    @Override
    public List<IndexMatch> query(CollectionHandle handle, String queryText, int topK) {
        if (topK <= 0) {
            return List.of();
        }
        OpenCollection collection = require(handle);
        try {
            Embedding queryEmbedding = collection.model().embed(queryText).content();
            EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                    .queryEmbedding(queryEmbedding)
                    .maxResults(topK)
                    .build();
            List<IndexMatch> matches = new ArrayList<>();
            for (EmbeddingMatch<TextSegment> match : collection.store().search(request).matches()) {
                matches.add(toIndexMatch(match));
            }
            return matches;
        } catch (RuntimeException e) {
            throw new VectorIndexException("Query failed on collection '" + handle.name() + "'", e);
        }
    }

    private static IndexMatch toIndexMatch(EmbeddingMatch<TextSegment> match) {
        TextSegment segment = match.embedded();
        Map<String, Object> metadata = segment == null ? Map.of() : new LinkedHashMap<>(segment.metadata().toMap());
        Object chunkId = metadata.remove(CHUNK_ID_KEY);
        String id = chunkId != null ? chunkId.toString() : match.embeddingId();
        String text = segment == null ? "" : segment.text();
        return new IndexMatch(id, text, match.score(), metadata);
    }

    private OpenCollection require(CollectionHandle handle) {
        OpenCollection collection = collections.get(handle.name());
        if (collection == null) {
            throw new IllegalStateException("Collection '" + handle.name() + "' has not been opened");
        }
        return collection;
    }

    private record OpenCollection(String modelName, EmbeddingModel model, EmbeddingStore<TextSegment> store) {
    }
}
