package dev.scriptorium.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps each collection as a langchain4j {@link InMemoryEmbeddingStore} persisted under
 * {@code <dbDir>/<collection>/}: {@code manifest.json} records the embedding model and
 * {@code embeddings.json} holds the entries.
 *
 * <p>{@link #persist} rewrites the whole {@code embeddings.json} after every batch, so batches written
 * before a failure stay on disk. A run of n batches therefore writes O(n²) bytes in total; for
 * collections too large for that, use the pgvector backend.
 */
public class LocalCollectionStoreProvider implements CollectionStoreProvider {

    private static final Logger log = LoggerFactory.getLogger(LocalCollectionStoreProvider.class);

    static final String MANIFEST_FILE = "manifest.json";
    static final String STORE_FILE = "embeddings.json";

    private final Path dbDir;
    private final ObjectMapper objectMapper;

    public LocalCollectionStoreProvider(Path dbDir, ObjectMapper objectMapper) {
        this.dbDir = dbDir;
        this.objectMapper = objectMapper;
    }

    @Override
    public EmbeddingStore<TextSegment> open(String collection, String embeddingModelName, int dimension) {
        Path dir = dbDir.resolve(collection);
        Path manifestFile = dir.resolve(MANIFEST_FILE);
        Path storeFile = dir.resolve(STORE_FILE);
        try {
            if (Files.exists(manifestFile)) {
                CollectionManifest manifest =
                        objectMapper.readValue(manifestFile.toFile(), CollectionManifest.class);
                if (!manifest.embeddingModel().equalsIgnoreCase(embeddingModelName)) {
                    throw new IllegalStateException("Collection '" + collection + "' was created with embedding model '"
                            + manifest.embeddingModel() + "', not '" + embeddingModelName + "'");
                }
                if (Files.exists(storeFile)) {
                    log.info("Opening existing collection '{}' at {}", collection, dir);
                    return InMemoryEmbeddingStore.fromFile(storeFile);
                }
                return new InMemoryEmbeddingStore<>();
            }

            Files.createDirectories(dir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(manifestFile.toFile(),
                    new CollectionManifest(collection, embeddingModelName, dimension));
            log.info("Created collection '{}' at {} (model {})", collection, dir, embeddingModelName);
            return new InMemoryEmbeddingStore<>();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not open collection directory " + dir, e);
        }
    }

    @Override
    public void persist(String collection, EmbeddingStore<TextSegment> store) {
        if (!(store instanceof InMemoryEmbeddingStore<TextSegment> inMemory)) {
            throw new IllegalArgumentException("Local collections are backed by InMemoryEmbeddingStore");
        }
        Path dir = dbDir.resolve(collection);
        Path target = dir.resolve(STORE_FILE);
        Path staging = dir.resolve(STORE_FILE + ".tmp");
        inMemory.serializeToFile(staging);
        try {
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not persist collection " + collection, e);
        }
    }
}
