package dev.scriptorium.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.scriptorium.index.CollectionStoreProvider;
import dev.scriptorium.index.EmbeddingModelRegistry;
import dev.scriptorium.index.EmbeddingStoreVectorIndex;
import dev.scriptorium.index.IndexProperties;
import dev.scriptorium.index.LocalCollectionStoreProvider;
import dev.scriptorium.index.PgVectorCollectionStoreProvider;
import dev.scriptorium.index.VectorIndex;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding models and the vector index backend.
 *
 * <p>Embedding models run in-process (ONNX); no external embedding API is called. The backend is
 * selected by {@code scriptorium.index.type}: {@code local} keeps collections as files under
 * {@code scriptorium.index.db-dir}, {@code pgvector} keeps one table per collection.
 *
 * @see EmbeddingStoreVectorIndex
 */
@Configuration
public class VectorIndexConfig {

    private static final Logger log = LoggerFactory.getLogger(VectorIndexConfig.class);

    /**
     * Named embedding functions a collection can be created with. Models are loaded on first use.
     */
    @Bean
    public EmbeddingModelRegistry embeddingModelRegistry() {
        return EmbeddingModelRegistry.withDefaults();
    }

    /**
     * Storage for collections, chosen by the configured index type.
     *
     * @param properties   index settings
     * @param objectMapper Boot's mapper, used for local collection manifests
     * @return the provider of per-collection embedding stores
     */
    @Bean
    public CollectionStoreProvider collectionStoreProvider(IndexProperties properties, ObjectMapper objectMapper) {
        switch (properties.type()) {
            case PGVECTOR:
                if (properties.pgvector() == null) {
                    throw new IllegalStateException("scriptorium.index.pgvector.* must be set for the pgvector index");
                }
                log.info("Vector index backend: pgvector at {}:{}/{}",
                        properties.pgvector().host(), properties.pgvector().port(), properties.pgvector().database());
                return new PgVectorCollectionStoreProvider(properties.pgvector());
            case LOCAL:
            default:
                Path dbDir = Path.of(properties.dbDir() == null ? "./vector_db" : properties.dbDir());
                log.info("Vector index backend: local store in {}", dbDir.toAbsolutePath());
                return new LocalCollectionStoreProvider(dbDir, objectMapper);
        }
    }

    @Bean
    public VectorIndex vectorIndex(CollectionStoreProvider collectionStoreProvider,
                                   EmbeddingModelRegistry embeddingModelRegistry) {
        return new EmbeddingStoreVectorIndex(collectionStoreProvider, embeddingModelRegistry);
    }
}
