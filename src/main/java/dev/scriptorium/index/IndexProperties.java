package dev.scriptorium.index;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Vector index backend settings.
 *
 * @param type     which backend holds the collections
 * @param dbDir    root directory of local collections
 * @param pgvector connection settings for the pgvector backend
 */
@ConfigurationProperties(prefix = "scriptorium.index")
public record IndexProperties(Type type, String dbDir, Pgvector pgvector) {

    public IndexProperties {
        type = type == null ? Type.LOCAL : type;
    }

    public enum Type {
        /** One persisted in-memory store per collection under {@code dbDir} */
        LOCAL,
        /** One PostgreSQL/pgvector table per collection */
        PGVECTOR
    }

    public record Pgvector(String host, int port, String database, String user, String password,
                           String tablePrefix) {
        public Pgvector {
            tablePrefix = tablePrefix == null ? "" : tablePrefix;
        }
    }
}
