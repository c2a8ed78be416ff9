package ch.so.arp.nexa.ingest;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import ch.so.arp.nexa.embedding.EmbeddingService;
import ch.so.arp.nexa.index.IndexProperties;
import ch.so.arp.nexa.index.VectorIndex;

/**
 * Ingestion wiring. The document catalog lives next to the vector index: in
 * memory for the in-memory backend, in the database for the postgres one.
 */
@Configuration
@EnableConfigurationProperties({ IngestionProperties.class, IndexProperties.class })
public class IngestionConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Chunker chunker(IngestionProperties properties) {
        return new Chunker(properties.getChunkSize(), properties.getChunkOverlap());
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentLoader documentLoader() {
        return new FileDocumentLoader();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.index.backend", havingValue = "in-memory", matchIfMissing = true)
    @ConditionalOnMissingBean(DocumentCatalog.class)
    public DocumentCatalog inMemoryDocumentCatalog() {
        return new InMemoryDocumentCatalog();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.index.backend", havingValue = "postgres")
    @ConditionalOnMissingBean(DocumentCatalog.class)
    public DocumentCatalog jdbcDocumentCatalog(JdbcClient jdbcClient, PlatformTransactionManager transactionManager,
            IndexProperties indexProperties) {
        JdbcDocumentCatalog catalog = new JdbcDocumentCatalog(jdbcClient, new TransactionTemplate(transactionManager));
        if (indexProperties.getPostgres().isInitializeSchema()) {
            catalog.initializeSchema();
        }
        return catalog;
    }

    @Bean
    @ConditionalOnMissingBean
    public IndexWriteGuard indexWriteGuard() {
        return new IndexWriteGuard();
    }

    @Bean
    @ConditionalOnMissingBean
    public IngestionService ingestionService(DocumentLoader documentLoader, Chunker chunker,
            EmbeddingService embeddingService, VectorIndex vectorIndex, DocumentCatalog documentCatalog,
            IndexWriteGuard indexWriteGuard) {
        return new IngestionService(documentLoader, chunker, embeddingService, vectorIndex, documentCatalog,
                indexWriteGuard, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public IndexManagementService indexManagementService(VectorIndex vectorIndex, DocumentCatalog documentCatalog,
            IndexWriteGuard indexWriteGuard) {
        return new IndexManagementService(vectorIndex, documentCatalog, indexWriteGuard);
    }
}
