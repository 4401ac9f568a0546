package dev.scriptorium.index;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps each collection in its own pgvector table named {@code <tablePrefix><collection>}.
 *
 * <p>pgvector keys entries by UUID, so caller ids are mapped to name-based UUIDs scoped by
 * collection. The mapping is deterministic, which keeps re-ingestion an upsert.
 */
public class PgVectorCollectionStoreProvider implements CollectionStoreProvider {

    private static final Logger log = LoggerFactory.getLogger(PgVectorCollectionStoreProvider.class);

    private final IndexProperties.Pgvector settings;

    public PgVectorCollectionStoreProvider(IndexProperties.Pgvector settings) {
        this.settings = settings;
    }

    @Override
    public EmbeddingStore<TextSegment> open(String collection, String embeddingModelName, int dimension) {
        String table = tableName(collection);
        log.info("Opening pgvector table {} on {}:{}/{} (model {}, dimension {})",
                table, settings.host(), settings.port(), settings.database(), embeddingModelName, dimension);
        return PgVectorEmbeddingStore.builder()
                .host(settings.host())
                .port(settings.port())
                .database(settings.database())
                .user(settings.user())
                .password(settings.password())
                .table(table)
                .dimension(dimension)
                .createTable(true)
                .build();
    }

    @Override
    public String entryId(String collection, String id) {
        return UUID.nameUUIDFromBytes((collection + ":" + id).getBytes(StandardCharsets.UTF_8)).toString();
    }

    String tableName(String collection) {
        return settings.tablePrefix() + collection.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
    }
}
