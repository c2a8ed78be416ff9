package ch.so.arp.nexa.index;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import ch.so.arp.nexa.embedding.EmbeddingProperties;

/**
 * Chooses the vector index backend. The index dimension follows the
 * configured embedding dimension.
 */
@Configuration
@EnableConfigurationProperties({ IndexProperties.class, EmbeddingProperties.class })
public class IndexConfiguration {

    @Bean
    @ConditionalOnProperty(name = "rag.index.backend", havingValue = "in-memory", matchIfMissing = true)
    public VectorIndex inMemoryVectorIndex(EmbeddingProperties embeddingProperties) {
        return new InMemoryVectorIndex(embeddingProperties.getDimension());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.index.backend", havingValue = "postgres")
    public VectorIndex postgresVectorIndex(JdbcClient jdbcClient, PlatformTransactionManager transactionManager,
            IndexProperties properties, EmbeddingProperties embeddingProperties) {
        PostgresVectorIndex index = new PostgresVectorIndex(jdbcClient, new TransactionTemplate(transactionManager),
                embeddingProperties.getDimension());
        if (properties.getPostgres().isInitializeSchema()) {
            index.initializeSchema();
        }
        return index;
    }
}
