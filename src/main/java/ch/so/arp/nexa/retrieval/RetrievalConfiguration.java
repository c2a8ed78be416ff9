package ch.so.arp.nexa.retrieval;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import ch.so.arp.nexa.embedding.EmbeddingService;
import ch.so.arp.nexa.index.VectorIndex;

@Configuration
@EnableConfigurationProperties(RetrievalProperties.class)
public class RetrievalConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public TokenCounter tokenCounter() {
        return new TokenCounter();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetrievalPipeline retrievalPipeline(EmbeddingService embeddingService, VectorIndex vectorIndex,
            TokenCounter tokenCounter, RetrievalProperties properties) {
        return new RetrievalPipeline(embeddingService, vectorIndex,
                new ContextAssembler(tokenCounter, properties.getMaxContextTokens()),
                properties.getTopK(), properties.getRelevanceThreshold());
    }
}
