package ch.so.arp.nexa.llm;

import java.util.List;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Wires both language model backends behind the {@link ProviderRouter}. The
 * active one is chosen per call from the configuration store, so both are
 * always registered.
 */
@Configuration
@EnableConfigurationProperties(LlmProperties.class)
public class LlmConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ProviderConfigurationStore providerConfigurationStore(LlmProperties properties) {
        return new InMemoryProviderConfigurationStore(properties.toConfiguration());
    }

    @Bean
    public LlmBackend ollamaBackend(ObjectProvider<WebClient.Builder> webClientBuilder) {
        return new OllamaBackend(webClientBuilder.getIfAvailable(WebClient::builder).build());
    }

    @Bean
    public LlmBackend cloudBackend(ObjectProvider<WebClient.Builder> webClientBuilder) {
        return new CloudBackend(webClientBuilder.getIfAvailable(WebClient::builder).build());
    }

    @Bean
    @ConditionalOnMissingBean
    public ProviderRouter providerRouter(ProviderConfigurationStore providerConfigurationStore,
            List<LlmBackend> backends, LlmProperties properties) {
        return new ProviderRouter(providerConfigurationStore, backends, properties.getTimeout(),
                properties.getRetryBackoff());
    }
}
