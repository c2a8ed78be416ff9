package ch.so.arp.nexa.embedding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import ch.so.arp.nexa.index.VectorIndex;

/**
 * Selects the embedding backend with {@code rag.embedding.provider} and wraps
 * it into the {@link EmbeddingService} checked against the active index.
 */
@Configuration
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddingConfiguration.class);

    @Bean
    @ConditionalOnProperty(name = "rag.embedding.provider", havingValue = "hashing", matchIfMissing = true)
    public EmbeddingProvider hashingEmbeddingProvider(EmbeddingProperties properties) {
        return new HashingEmbeddingProvider(properties.getDimension());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.embedding.provider", havingValue = "openai")
    public EmbeddingProvider openAiEmbeddingProvider(EmbeddingProperties properties,
            ObjectProvider<WebClient.Builder> webClientBuilder) {
        WebClient.Builder builder = webClientBuilder.getIfAvailable(WebClient::builder)
                .baseUrl(properties.getBaseUrl());
        if (StringUtils.hasText(properties.getApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey());
        }
        LOGGER.info("Using remote embeddings from {} with model {}", properties.getBaseUrl(), properties.getModel());
        return new OpenAiEmbeddingProvider(builder.build(), properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingService embeddingService(EmbeddingProvider embeddingProvider, EmbeddingProperties properties,
            VectorIndex vectorIndex) {
        if (embeddingProvider.dimension() != vectorIndex.dimension()) {
            LOGGER.warn("Embedding dimension {} differs from index dimension {}; rebuild the index for this model",
                    embeddingProvider.dimension(), vectorIndex.dimension());
        }
        return new EmbeddingService(embeddingProvider, properties.getBatchSize(), vectorIndex::dimension);
    }
}
