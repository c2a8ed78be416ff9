package ch.so.arp.nexa.index;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Selection and settings of the vector index backend.
 */
@ConfigurationProperties(prefix = "rag.index")
public class IndexProperties {

    /**
     * Either {@code in-memory} or {@code postgres}.
     */
    private String backend = "in-memory";

    private final Postgres postgres = new Postgres();

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public Postgres getPostgres() {
        return postgres;
    }

    public static class Postgres {

        /**
         * Create the pgvector extension and the index tables on startup.
         */
        private boolean initializeSchema = true;

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }
    }
}
