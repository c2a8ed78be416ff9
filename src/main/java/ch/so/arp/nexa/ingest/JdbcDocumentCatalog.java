package ch.so.arp.nexa.ingest;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link DocumentCatalog} stored in the same database as the PostgreSQL
 * vector index, so checksums and document ids survive a restart together
 * with the index entries they describe.
 */
public class JdbcDocumentCatalog implements DocumentCatalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcDocumentCatalog.class);

    private static final String SCHEMA_SQL = """
            CREATE TABLE IF NOT EXISTS rag_documents (
              id VARCHAR(64) PRIMARY KEY,
              source VARCHAR NOT NULL,
              version VARCHAR,
              ingested_at TIMESTAMP WITH TIME ZONE NOT NULL,
              checksum VARCHAR(64) NOT NULL,
              live BOOLEAN NOT NULL,
              deleted BOOLEAN NOT NULL
            );
            CREATE INDEX IF NOT EXISTS rag_documents_source_idx ON rag_documents (source);
            CREATE TABLE IF NOT EXISTS rag_document_tags (
              document_id VARCHAR(64) NOT NULL,
              ordinal INT NOT NULL,
              tag VARCHAR NOT NULL,
              PRIMARY KEY (document_id, ordinal)
            );
            CREATE TABLE IF NOT EXISTS rag_document_chunks (
              id VARCHAR PRIMARY KEY,
              document_id VARCHAR(64) NOT NULL,
              source VARCHAR,
              ordinal INT NOT NULL,
              content VARCHAR NOT NULL,
              start_offset INT NOT NULL,
              end_offset INT NOT NULL
            );
            CREATE INDEX IF NOT EXISTS rag_document_chunks_document_idx ON rag_document_chunks (document_id)
            """;

    private static final String DOCUMENT_COLUMNS = "id, source, version, ingested_at, checksum, deleted";

    private static final String FIND_SQL = "SELECT " + DOCUMENT_COLUMNS + " FROM rag_documents WHERE id = :id";

    private static final String FIND_LIVE_SQL = "SELECT " + DOCUMENT_COLUMNS
            + " FROM rag_documents WHERE source = :source AND live AND NOT deleted";

    private static final String LIVE_DOCUMENTS_SQL = "SELECT " + DOCUMENT_COLUMNS
            + " FROM rag_documents WHERE NOT deleted ORDER BY source, ingested_at";

    private static final String INSERT_DOCUMENT_SQL = """
            INSERT INTO rag_documents (id, source, version, ingested_at, checksum, live, deleted)
            VALUES (:id, :source, :version, :ingestedAt, :checksum, TRUE, FALSE)
            """;

    private static final String INSERT_TAG_SQL = """
            INSERT INTO rag_document_tags (document_id, ordinal, tag) VALUES (:documentId, :ordinal, :tag)
            """;

    private static final String INSERT_CHUNK_SQL = """
            INSERT INTO rag_document_chunks (id, document_id, source, ordinal, content, start_offset, end_offset)
            VALUES (:id, :documentId, :source, :ordinal, :content, :startOffset, :endOffset)
            """;

    private static final String TAGS_SQL = """
            SELECT document_id, tag FROM rag_document_tags
            WHERE document_id IN (:ids)
            ORDER BY document_id, ordinal
            """;

    private final JdbcClient jdbcClient;
    private final TransactionTemplate transactionTemplate;

    public JdbcDocumentCatalog(JdbcClient jdbcClient, TransactionTemplate transactionTemplate) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
    }

    public void initializeSchema() {
        transactionTemplate.executeWithoutResult(status -> {
            for (String statement : SCHEMA_SQL.split(";")) {
                if (!statement.isBlank()) {
                    jdbcClient.sql(statement).update();
                }
            }
        });
        LOGGER.info("Document catalog tables ready");
    }

    @Override
    public Optional<Document> findLive(String source) {
        return withTags(jdbcClient.sql(FIND_LIVE_SQL).param("source", source).query(DocumentMapper.INSTANCE).list())
                .stream()
                .findFirst();
    }

    @Override
    public Optional<Document> find(String documentId) {
        return withTags(jdbcClient.sql(FIND_SQL).param("id", documentId).query(DocumentMapper.INSTANCE).list())
                .stream()
                .findFirst();
    }

    @Override
    public Optional<Document> register(Document document, List<Chunk> chunks) {
        return transactionTemplate.execute(status -> {
            Optional<Document> previous = findLive(document.source())
                    .filter(found -> !found.id().equals(document.id()));
            jdbcClient.sql("UPDATE rag_documents SET live = FALSE WHERE source = :source AND live")
                    .param("source", document.source())
                    .update();
            jdbcClient.sql(INSERT_DOCUMENT_SQL)
                    .param("id", document.id())
                    .param("source", document.source())
                    .param("version", document.version())
                    .param("ingestedAt", Timestamp.from(document.ingestedAt()))
                    .param("checksum", document.checksum())
                    .update();
            for (int i = 0; i < document.tags().size(); i++) {
                jdbcClient.sql(INSERT_TAG_SQL)
                        .param("documentId", document.id())
                        .param("ordinal", i)
                        .param("tag", document.tags().get(i))
                        .update();
            }
            for (Chunk chunk : chunks) {
                jdbcClient.sql(INSERT_CHUNK_SQL)
                        .param("id", chunk.id())
                        .param("documentId", chunk.documentId())
                        .param("source", chunk.source())
                        .param("ordinal", chunk.ordinal())
                        .param("content", chunk.text())
                        .param("startOffset", chunk.startOffset())
                        .param("endOffset", chunk.endOffset())
                        .update();
            }
            return previous;
        });
    }

    @Override
    public Optional<Document> tombstone(String documentId) {
        return transactionTemplate.execute(status -> {
            Optional<Document> document = find(documentId).filter(found -> !found.deleted());
            if (document.isEmpty()) {
                return Optional.<Document>empty();
            }
            int updated = jdbcClient.sql("UPDATE rag_documents SET deleted = TRUE, live = FALSE WHERE id = :id AND NOT deleted")
                    .param("id", documentId)
                    .update();
            if (updated == 0) {
                return Optional.<Document>empty();
            }
            jdbcClient.sql("DELETE FROM rag_document_chunks WHERE document_id = :id").param("id", documentId).update();
            return Optional.of(document.get().withDeleted());
        });
    }

    @Override
    public int tombstoneAll() {
        Integer tombstoned = transactionTemplate.execute(status -> {
            int updated = jdbcClient.sql("UPDATE rag_documents SET deleted = TRUE, live = FALSE WHERE NOT deleted")
                    .update();
            jdbcClient.sql("DELETE FROM rag_document_chunks").update();
            return updated;
        });
        return tombstoned == null ? 0 : tombstoned;
    }

    @Override
    public List<Document> liveDocuments() {
        return withTags(jdbcClient.sql(LIVE_DOCUMENTS_SQL).query(DocumentMapper.INSTANCE).list());
    }

    @Override
    public List<Chunk> chunks(String documentId) {
        return jdbcClient.sql("""
                SELECT id, document_id, source, ordinal, content, start_offset, end_offset
                FROM rag_document_chunks WHERE document_id = :documentId ORDER BY ordinal
                """)
                .param("documentId", documentId)
                .query((rs, rowNum) -> new Chunk(
                        rs.getString("id"),
                        rs.getString("document_id"),
                        rs.getString("source"),
                        rs.getInt("ordinal"),
                        rs.getString("content"),
                        rs.getInt("start_offset"),
                        rs.getInt("end_offset")))
                .list();
    }

    private List<Document> withTags(List<Document> documents) {
        if (documents.isEmpty()) {
            return documents;
        }
        Map<String, List<String>> tags = jdbcClient.sql(TAGS_SQL)
                .param("ids", documents.stream().map(Document::id).toList())
                .query((rs, rowNum) -> Map.entry(rs.getString("document_id"), rs.getString("tag")))
                .list()
                .stream()
                .collect(Collectors.groupingBy(Map.Entry::getKey,
                        Collectors.mapping(Map.Entry::getValue, Collectors.toList())));
        List<Document> tagged = new ArrayList<>(documents.size());
        for (Document document : documents) {
            tagged.add(new Document(document.id(), document.source(), document.version(),
                    tags.getOrDefault(document.id(), List.of()), document.ingestedAt(), document.checksum(),
                    document.deleted()));
        }
        return tagged;
    }

    private enum DocumentMapper implements RowMapper<Document> {
        INSTANCE;

        @Override
        public Document mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Document(
                    rs.getString("id"),
                    rs.getString("source"),
                    rs.getString("version"),
                    List.of(),
                    rs.getTimestamp("ingested_at").toInstant(),
                    rs.getString("checksum"),
                    rs.getBoolean("deleted"));
        }
    }
}
