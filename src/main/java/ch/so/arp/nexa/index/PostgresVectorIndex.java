package ch.so.arp.nexa.index;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.support.TransactionTemplate;

import ch.so.arp.nexa.error.IndexIncompatibleException;
import ch.so.arp.nexa.ingest.Chunk;

/**
 * {@link VectorIndex} stored in PostgreSQL with the pgvector extension. Rows
 * carry the generation they belong to and searches only read the generation
 * named in the meta row, so flipping that row publishes a rebuilt generation
 * in one step. Writers hold a shared lock on the meta row, rebuild and clear
 * an exclusive one.
 */
class PostgresVectorIndex implements VectorIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresVectorIndex.class);

    static final String BACKEND = "postgres";

    private static final String SCHEMA_SQL = """
            CREATE EXTENSION IF NOT EXISTS vector;
            CREATE TABLE IF NOT EXISTS rag_index_meta (
              id INT PRIMARY KEY,
              dimension INT NOT NULL,
              generation BIGINT NOT NULL,
              built_at TIMESTAMPTZ NOT NULL
            );
            CREATE TABLE IF NOT EXISTS rag_vector_entries (
              seq BIGSERIAL PRIMARY KEY,
              generation BIGINT NOT NULL,
              chunk_id TEXT NOT NULL,
              document_id TEXT NOT NULL,
              source TEXT,
              ordinal INT NOT NULL,
              content TEXT NOT NULL,
              start_offset INT NOT NULL,
              end_offset INT NOT NULL,
              embedding vector(%d) NOT NULL,
              deleted BOOLEAN NOT NULL DEFAULT FALSE
            );
            CREATE INDEX IF NOT EXISTS rag_vector_entries_generation_idx
              ON rag_vector_entries (generation, document_id);
            """;

    private static final String INIT_META_SQL = """
            INSERT INTO rag_index_meta (id, dimension, generation, built_at)
            VALUES (1, :dimension, 0, now())
            ON CONFLICT (id) DO NOTHING
            """;

    private static final String LOCK_META_SHARED_SQL = "SELECT generation FROM rag_index_meta WHERE id = 1 FOR SHARE";

    private static final String LOCK_META_EXCLUSIVE_SQL = "SELECT generation FROM rag_index_meta WHERE id = 1 FOR UPDATE";

    private static final String INSERT_SQL = """
            INSERT INTO rag_vector_entries
              (generation, chunk_id, document_id, source, ordinal, content, start_offset, end_offset, embedding)
            VALUES
              (:generation, :chunkId, :documentId, :source, :ordinal, :content, :startOffset, :endOffset,
               :embedding::vector)
            """;

    private static final String SEARCH_SQL = """
            SELECT
              e.chunk_id, e.document_id, e.source, e.ordinal, e.content, e.start_offset, e.end_offset,
              (1.0 - (e.embedding <=> :embedding::vector)) AS score
            FROM rag_vector_entries e
            WHERE e.generation = (SELECT m.generation FROM rag_index_meta m WHERE m.id = 1)
              AND NOT e.deleted
            ORDER BY e.embedding <=> :embedding::vector, e.seq
            LIMIT :limit
            """;

    private static final String REMOVE_SQL = """
            UPDATE rag_vector_entries SET deleted = TRUE
            WHERE generation = :generation AND document_id = :documentId AND NOT deleted
            """;

    private static final String COPY_LIVE_SQL = """
            INSERT INTO rag_vector_entries
              (generation, chunk_id, document_id, source, ordinal, content, start_offset, end_offset, embedding)
            SELECT :next, chunk_id, document_id, source, ordinal, content, start_offset, end_offset, embedding
            FROM rag_vector_entries
            WHERE generation = :current AND NOT deleted
            ORDER BY seq
            """;

    private static final String FLIP_META_SQL = "UPDATE rag_index_meta SET generation = :next, built_at = now() WHERE id = 1";

    private static final String STATS_SQL = """
            SELECT m.dimension, m.generation, m.built_at,
              (SELECT count(*) FROM rag_vector_entries e WHERE e.generation = m.generation AND NOT e.deleted)
                AS entry_count
            FROM rag_index_meta m
            WHERE m.id = 1
            """;

    private final JdbcClient jdbcClient;
    private final TransactionTemplate transactionTemplate;
    private volatile int dimension;

    PostgresVectorIndex(JdbcClient jdbcClient, TransactionTemplate transactionTemplate, int dimension) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
        this.dimension = dimension;
    }

    /**
     * Create the tables when missing. An existing index keeps the dimension it
     * was created with.
     */
    void initializeSchema() {
        transactionTemplate.executeWithoutResult(status -> {
            for (String statement : SCHEMA_SQL.formatted(dimension).split(";")) {
                if (!statement.isBlank()) {
                    jdbcClient.sql(statement).update();
                }
            }
            jdbcClient.sql(INIT_META_SQL).param("dimension", dimension).update();
        });
        int stored = jdbcClient.sql("SELECT dimension FROM rag_index_meta WHERE id = 1").query(Integer.class).single();
        if (stored != dimension) {
            LOGGER.warn("Stored index has dimension {} but {} is configured; drop the index tables to re-create it",
                    stored, dimension);
            dimension = stored;
        }
        LOGGER.info("PostgreSQL vector index ready (dimension={})", dimension);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public void add(List<VectorEntry> entries) {
        for (VectorEntry entry : entries) {
            requireDimension(entry.vector());
        }
        if (entries.isEmpty()) {
            return;
        }
        transactionTemplate.executeWithoutResult(status -> {
            long generation = jdbcClient.sql(LOCK_META_SHARED_SQL).query(Long.class).single();
            for (VectorEntry entry : entries) {
                Chunk chunk = entry.chunk();
                jdbcClient.sql(INSERT_SQL)
                        .param("generation", generation)
                        .param("chunkId", chunk.id())
                        .param("documentId", chunk.documentId())
                        .param("source", chunk.source())
                        .param("ordinal", chunk.ordinal())
                        .param("content", chunk.text())
                        .param("startOffset", chunk.startOffset())
                        .param("endOffset", chunk.endOffset())
                        .param("embedding", toPgVectorLiteral(entry.vector()))
                        .update();
            }
        });
        LOGGER.debug("Inserted {} entries", entries.size());
    }

    @Override
    public List<SearchHit> search(float[] query, int k) {
        requireDimension(query);
        if (k <= 0) {
            return List.of();
        }
        return jdbcClient.sql(SEARCH_SQL)
                .param("embedding", toPgVectorLiteral(query))
                .param("limit", k)
                .query(SearchHitMapper.INSTANCE)
                .list();
    }

    @Override
    public int remove(String documentId) {
        Integer removed = transactionTemplate.execute(status -> {
            long generation = jdbcClient.sql(LOCK_META_SHARED_SQL).query(Long.class).single();
            return jdbcClient.sql(REMOVE_SQL)
                    .param("generation", generation)
                    .param("documentId", documentId)
                    .update();
        });
        return removed == null ? 0 : removed;
    }

    @Override
    public IndexStats rebuild() {
        transactionTemplate.executeWithoutResult(status -> {
            long generation = jdbcClient.sql(LOCK_META_EXCLUSIVE_SQL).query(Long.class).single();
            int copied = jdbcClient.sql(COPY_LIVE_SQL)
                    .param("next", generation + 1)
                    .param("current", generation)
                    .update();
            jdbcClient.sql(FLIP_META_SQL).param("next", generation + 1).update();
            jdbcClient.sql("DELETE FROM rag_vector_entries WHERE generation = :current")
                    .param("current", generation)
                    .update();
            LOGGER.info("Published index generation {} with {} live entries", generation + 1, copied);
        });
        return stats();
    }

    @Override
    public void clear() {
        transactionTemplate.executeWithoutResult(status -> {
            long generation = jdbcClient.sql(LOCK_META_EXCLUSIVE_SQL).query(Long.class).single();
            jdbcClient.sql("DELETE FROM rag_vector_entries").update();
            jdbcClient.sql(FLIP_META_SQL).param("next", generation + 1).update();
            LOGGER.info("Cleared index, now at generation {}", generation + 1);
        });
    }

    @Override
    public IndexStats stats() {
        return jdbcClient.sql(STATS_SQL)
                .query((rs, rowNum) -> new IndexStats(BACKEND, rs.getLong("entry_count"), rs.getInt("dimension"),
                        rs.getLong("generation"), toInstant(rs.getTimestamp("built_at"))))
                .single();
    }

    private void requireDimension(float[] vector) {
        if (vector.length != dimension) {
            throw new IndexIncompatibleException(dimension, vector.length);
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    static String toPgVectorLiteral(float[] embedding) {
        StringBuilder builder = new StringBuilder();
        builder.append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(String.format(Locale.ROOT, "%f", embedding[i]));
        }
        builder.append(']');
        return builder.toString();
    }

    private enum SearchHitMapper implements RowMapper<SearchHit> {
        INSTANCE;

        @Override
        public SearchHit mapRow(ResultSet rs, int rowNum) throws SQLException {
            Chunk chunk = new Chunk(
                    rs.getString("chunk_id"),
                    rs.getString("document_id"),
                    rs.getString("source"),
                    rs.getInt("ordinal"),
                    rs.getString("content"),
                    rs.getInt("start_offset"),
                    rs.getInt("end_offset"));
            double score = Math.max(-1.0d, Math.min(1.0d, rs.getDouble("score")));
            return new SearchHit(chunk, score);
        }
    }
}
