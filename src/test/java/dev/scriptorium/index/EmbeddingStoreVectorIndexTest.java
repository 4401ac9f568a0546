package dev.scriptorium.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.scriptorium.fixture.HashingEmbeddingModel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EmbeddingStoreVectorIndexTest {

    private static final String MODEL = "hashing";

    @TempDir
    Path dbDir;

    private HashingEmbeddingModel embeddingModel;
    private EmbeddingModelRegistry registry;
    private EmbeddingStoreVectorIndex index;

    @BeforeEach
    void setUp() {
        embeddingModel = new HashingEmbeddingModel();
        Supplier<EmbeddingModel> hashing = () -> embeddingModel;
        Supplier<EmbeddingModel> other = HashingEmbeddingModel::new;
        registry = new EmbeddingModelRegistry(Map.of(MODEL, hashing, "other", other));
        index = newIndex();
    }

    private EmbeddingStoreVectorIndex newIndex() {
        return new EmbeddingStoreVectorIndex(new LocalCollectionStoreProvider(dbDir, new ObjectMapper()), registry);
    }

    private static Map<String, Object> meta(String source, int chunkIndex) {
        return Map.of("source", source, "chunk_index", chunkIndex);
    }

    @Test
    void upsertedEntriesAreFoundByQuery() {
        CollectionHandle handle = index.openOrCreateCollection("docs", MODEL);
        index.upsertBatch(handle,
                List.of("chunk-0", "chunk-1"),
                List.of("Install the crawler with docker", "Configure the vector index backend"),
                List.of(meta("https://docs.example.com/install", 0), meta("https://docs.example.com/config", 1)));

        List<IndexMatch> matches = index.query(handle, "vector index backend", 1);

        assertThat(matches).singleElement().satisfies(match -> {
            assertThat(match.id()).isEqualTo("chunk-1");
            assertThat(match.text()).isEqualTo("Configure the vector index backend");
            assertThat(match.metadata()).containsEntry("source", "https://docs.example.com/config");
            assertThat(match.metadata()).doesNotContainKey(EmbeddingStoreVectorIndex.CHUNK_ID_KEY);
        });
    }

    @Test
    void upsertReplacesEntriesWithTheSameId() {
        CollectionHandle handle = index.openOrCreateCollection("docs", MODEL);
        index.upsertBatch(handle, List.of("chunk-0", "chunk-1"), List.of("old zero", "old one"),
                List.of(meta("a", 0), meta("a", 1)));

        index.upsertBatch(handle, List.of("chunk-1"), List.of("new one"), List.of(meta("b", 1)));

        List<IndexMatch> matches = index.query(handle, "one", 10);
        assertThat(matches).extracting(IndexMatch::id).containsExactlyInAnyOrder("chunk-0", "chunk-1");
        assertThat(matches).extracting(IndexMatch::text).contains("new one").doesNotContain("old one");
    }

    @Test
    void collectionSurvivesReopening() {
        CollectionHandle handle = index.openOrCreateCollection("docs", MODEL);
        index.upsertBatch(handle, List.of("chunk-0"), List.of("persisted text"), List.of(meta("a", 0)));

        EmbeddingStoreVectorIndex reopened = newIndex();
        CollectionHandle again = reopened.openOrCreateCollection("docs", MODEL);

        assertThat(reopened.query(again, "persisted text", 5))
                .extracting(IndexMatch::id)
                .containsExactly("chunk-0");
        assertThat(dbDir.resolve("docs").resolve(LocalCollectionStoreProvider.MANIFEST_FILE)).exists();
        assertThat(dbDir.resolve("docs").resolve(LocalCollectionStoreProvider.STORE_FILE)).exists();
    }

    @Test
    void reopeningWithAnotherModelFails() {
        index.openOrCreateCollection("docs", MODEL);

        assertThatThrownBy(() -> newIndex().openOrCreateCollection("docs", "other"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(MODEL);
        assertThatThrownBy(() -> index.openOrCreateCollection("docs", "other"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void unknownModelIsRejected() {
        assertThatThrownBy(() -> index.openOrCreateCollection("docs", "no-such-model"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no-such-model");
        assertThat(Files.exists(dbDir.resolve("docs"))).isFalse();
    }

    @Test
    void validateCollectionTouchesNothingOnDisk() {
        index.validateCollection("docs", MODEL);

        assertThatThrownBy(() -> index.validateCollection("docs", "no-such-model"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> index.validateCollection("../escape", MODEL))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(Files.exists(dbDir.resolve("docs"))).isFalse();
        assertThat(embeddingModel.embedCalls()).isZero();
    }

    @Test
    void invalidCollectionNameIsRejected() {
        assertThatThrownBy(() -> index.openOrCreateCollection("../escape", MODEL))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> index.openOrCreateCollection(" ", MODEL))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mismatchedBatchListsAreRejected() {
        CollectionHandle handle = index.openOrCreateCollection("docs", MODEL);

        assertThatThrownBy(() -> index.upsertBatch(handle, List.of("chunk-0", "chunk-1"), List.of("only one"),
                List.of(meta("a", 0), meta("a", 1))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyBatchIsANoOp() {
        CollectionHandle handle = index.openOrCreateCollection("docs", MODEL);

        index.upsertBatch(handle, List.of(), List.of(), List.of());

        assertThat(embeddingModel.embedCalls()).isZero();
    }

    @Test
    void storeFailureIsWrappedInVectorIndexException() {
        CollectionStoreProvider failingPersist = new CollectionStoreProvider() {
            private final LocalCollectionStoreProvider delegate = new LocalCollectionStoreProvider(dbDir, new ObjectMapper());

            @Override
            public EmbeddingStore<TextSegment> open(String collection, String embeddingModelName, int dimension) {
                return delegate.open(collection, embeddingModelName, dimension);
            }

            @Override
            public void persist(String collection, EmbeddingStore<TextSegment> store) {
                throw new IllegalStateException("disk full");
            }
        };
        EmbeddingStoreVectorIndex failing = new EmbeddingStoreVectorIndex(failingPersist, registry);
        CollectionHandle handle = failing.openOrCreateCollection("docs", MODEL);

        assertThatThrownBy(() -> failing.upsertBatch(handle, List.of("chunk-0"), List.of("text"), List.of(meta("a", 0))))
                .isInstanceOf(VectorIndexException.class)
                .hasMessageContaining("docs")
                .hasRootCauseMessage("disk full");
    }

    @Test
    void batchesWrittenBeforeAFailingOneStayOnDisk() {
        CollectionStoreProvider failsOnSecondPersist = new CollectionStoreProvider() {
            private final LocalCollectionStoreProvider delegate = new LocalCollectionStoreProvider(dbDir, new ObjectMapper());
            private int persists;

            @Override
            public EmbeddingStore<TextSegment> open(String collection, String embeddingModelName, int dimension) {
                return delegate.open(collection, embeddingModelName, dimension);
            }

            @Override
            public void persist(String collection, EmbeddingStore<TextSegment> store) {
                if (++persists > 1) {
                    throw new IllegalStateException("disk full");
                }
                delegate.persist(collection, store);
            }
        };
        EmbeddingStoreVectorIndex failing = new EmbeddingStoreVectorIndex(failsOnSecondPersist, registry);
        CollectionHandle handle = failing.openOrCreateCollection("docs", MODEL);
        failing.upsertBatch(handle, List.of("chunk-0"), List.of("first batch"), List.of(meta("a", 0)));

        assertThatThrownBy(() -> failing.upsertBatch(handle, List.of("chunk-1"), List.of("second batch"),
                List.of(meta("a", 1))))
                .isInstanceOf(VectorIndexException.class);

        EmbeddingStoreVectorIndex reopened = newIndex();
        CollectionHandle again = reopened.openOrCreateCollection("docs", MODEL);
        assertThat(reopened.query(again, "batch", 5))
                .extracting(IndexMatch::id)
                .containsExactly("chunk-0");
    }

    @Test
    void queryWithNonPositiveTopKIsEmpty() {
        CollectionHandle handle = index.openOrCreateCollection("docs", MODEL);
        index.upsertBatch(handle, List.of("chunk-0"), List.of("text"), List.of(meta("a", 0)));

        assertThat(index.query(handle, "text", 0)).isEmpty();
    }

    @Test
    void queryOnUnopenedCollectionFails() {
        assertThatThrownBy(() -> index.query(new CollectionHandle("never-opened", MODEL), "text", 3))
                .isInstanceOf(IllegalStateException.class);
    }
}
