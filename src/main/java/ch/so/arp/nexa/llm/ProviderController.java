package ch.so.arp.nexa.llm;

import java.util.List;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints to inspect and switch the language model provider. API keys
 * only ever leave the service masked.
 */
@RestController
@RequestMapping(path = "/api/llm", produces = MediaType.APPLICATION_JSON_VALUE)
public class ProviderController {

    private final ProviderRouter providerRouter;
    private final ProviderConfigurationStore configurationStore;

    public ProviderController(ProviderRouter providerRouter, ProviderConfigurationStore configurationStore) {
        this.providerRouter = providerRouter;
        this.configurationStore = configurationStore;
    }

    @GetMapping("/status")
    public ProviderStatus status() {
        return providerRouter.status();
    }

    @GetMapping("/models")
    public List<String> models() {
        return providerRouter.listModels();
    }

    @GetMapping("/config")
    public ConfigurationView configuration() {
        return ConfigurationView.of(configurationStore.current());
    }

    @PatchMapping(path = "/config", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ConfigurationView update(@RequestBody ProviderConfigurationUpdate update) {
        return ConfigurationView.of(configurationStore.update(update));
    }

    public record ConfigurationView(
            long version,
            ProviderId provider,
            String ollamaBaseUrl,
            String ollamaModel,
            boolean ollamaUseChatApi,
            String cloudBaseUrl,
            String cloudModel,
            String cloudApiKey,
            double temperature,
            double topP,
            int maxTokens) {

        static ConfigurationView of(ProviderConfiguration configuration) {
            return new ConfigurationView(
                    configuration.version(),
                    configuration.activeProvider(),
                    configuration.ollama().baseUrl(),
                    configuration.ollama().model(),
                    configuration.ollama().useChatApi(),
                    configuration.cloud().baseUrl(),
                    configuration.cloud().model(),
                    configuration.cloud().maskedApiKey(),
                    configuration.parameters().temperature(),
                    configuration.parameters().topP(),
                    configuration.parameters().maxTokens());
        }
    }
}
