package ch.so.arp.nexa.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;

class JdbcDocumentCatalogTest {

    private static final Instant INGESTED_AT = Instant.parse("2026-03-01T08:00:00Z");

    private DriverManagerDataSource dataSource;
    private JdbcDocumentCatalog catalog;

    @BeforeEach
    void setUp() {
        dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.h2.Driver");
        dataSource.setUrl("jdbc:h2:mem:catalog-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        dataSource.setUsername("sa");
        dataSource.setPassword("");
        catalog = newCatalog();
        catalog.initializeSchema();
    }

    @Test
    void documentsAndChecksumsSurviveANewCatalogInstance() {
        Document document = document("doc-1", "/docs/deploy.txt", "checksum-1", List.of("release", "v2"));
        catalog.register(document, List.of(chunk("doc-1", "/docs/deploy.txt", 0, "Deploy by running ./deploy.sh.")));

        JdbcDocumentCatalog restarted = newCatalog();
        restarted.initializeSchema();

        assertThat(restarted.findLive("/docs/deploy.txt")).hasValue(document);
        assertThat(restarted.liveDocuments()).containsExactly(document);
        assertThat(restarted.chunks("doc-1")).extracting(Chunk::text).containsExactly("Deploy by running ./deploy.sh.");
    }

    @Test
    void registeringNewVersionReturnsPreviousLiveVersion() {
        Document first = document("doc-1", "/docs/deploy.txt", "checksum-1", List.of());
        Document second = document("doc-2", "/docs/deploy.txt", "checksum-2", List.of());

        assertThat(catalog.register(first, List.of())).isEmpty();
        assertThat(catalog.register(second, List.of())).hasValue(first);

        assertThat(catalog.findLive("/docs/deploy.txt")).hasValue(second);
        assertThat(catalog.tombstone("doc-1")).hasValueSatisfying(old -> assertThat(old.deleted()).isTrue());
        assertThat(catalog.liveDocuments()).extracting(Document::id).containsExactly("doc-2");
    }

    @Test
    void tombstoneDropsChunksAndIsNotRepeated() {
        catalog.register(document("doc-1", "/docs/a.txt", "checksum-1", List.of("ops")),
                List.of(chunk("doc-1", "/docs/a.txt", 0, "alpha"), chunk("doc-1", "/docs/a.txt", 1, "beta")));

        assertThat(catalog.tombstone("doc-1")).hasValueSatisfying(deleted -> {
            assertThat(deleted.deleted()).isTrue();
            assertThat(deleted.tags()).containsExactly("ops");
        });

        assertThat(catalog.tombstone("doc-1")).isEmpty();
        assertThat(catalog.tombstone("unknown")).isEmpty();
        assertThat(catalog.chunks("doc-1")).isEmpty();
        assertThat(catalog.findLive("/docs/a.txt")).isEmpty();
        assertThat(catalog.find("doc-1")).hasValueSatisfying(found -> assertThat(found.deleted()).isTrue());
    }

    @Test
    void tombstoneAllForgetsEveryLiveDocument() {
        catalog.register(document("doc-1", "/docs/b.txt", "checksum-1", List.of()), List.of());
        catalog.register(document("doc-2", "/docs/a.txt", "checksum-2", List.of()), List.of());

        assertThat(catalog.liveDocuments()).extracting(Document::source).containsExactly("/docs/a.txt", "/docs/b.txt");
        assertThat(catalog.tombstoneAll()).isEqualTo(2);
        assertThat(catalog.liveDocuments()).isEmpty();
        assertThat(catalog.tombstoneAll()).isZero();
    }

    private JdbcDocumentCatalog newCatalog() {
        return new JdbcDocumentCatalog(JdbcClient.create(dataSource),
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
    }

    private static Document document(String id, String source, String checksum, List<String> tags) {
        return new Document(id, source, "1.0", tags, INGESTED_AT, checksum, false);
    }

    private static Chunk chunk(String documentId, String source, int ordinal, String text) {
        return new Chunk(Chunk.idFor(documentId, ordinal), documentId, source, ordinal, text, 0, text.length());
    }
}
