package ch.so.arp.nexa.llm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.JsonNode;

import ch.so.arp.nexa.error.ConfigurationException;
import ch.so.arp.nexa.error.GenerationFailedException;
import ch.so.arp.nexa.llm.ProviderConfiguration.CloudSettings;
import reactor.core.publisher.Mono;

/**
 * Remote model behind an OpenAI-compatible chat completions API.
 */
class CloudBackend implements LlmBackend {

    private static final Logger LOGGER = LoggerFactory.getLogger(CloudBackend.class);

    private final WebClient webClient;

    CloudBackend(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public ProviderId id() {
        return ProviderId.CLOUD;
    }

    @Override
    public Mono<String> generate(GenerationRequest request, ProviderConfiguration configuration) {
        CloudSettings settings = configuration.cloud();
        if (!settings.hasApiKey()) {
            return Mono.error(new ConfigurationException("No API key configured for the cloud provider"));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", settings.model());
        payload.put("messages", ChatMessages.of(request));
        payload.put("temperature", configuration.parameters().temperature());
        payload.put("top_p", configuration.parameters().topP());
        payload.put("max_tokens", configuration.parameters().maxTokens());
        LOGGER.debug("Calling {} with model {} (key {})", settings.baseUrl(), settings.model(),
                settings.maskedApiKey());
        return webClient.post()
                .uri(ChatMessages.join(settings.baseUrl(), "/chat/completions"))
                .headers(headers -> headers.setBearerAuth(settings.apiKey()))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(CloudBackend::text);
    }

    @Override
    public Mono<List<String>> listModels(ProviderConfiguration configuration) {
        CloudSettings settings = configuration.cloud();
        if (!settings.hasApiKey()) {
            return Mono.error(new ConfigurationException("No API key configured for the cloud provider"));
        }
        return webClient.get()
                .uri(ChatMessages.join(settings.baseUrl(), "/models"))
                .headers(headers -> headers.setBearerAuth(settings.apiKey()))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> {
                    List<String> ids = new ArrayList<>();
                    response.path("data").forEach(model -> ids.add(model.path("id").asText()));
                    return ids;
                });
    }

    private static String text(JsonNode response) {
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new GenerationFailedException(ProviderId.CLOUD.id(), "Completion response contained no text", null);
        }
        return content.asText().strip();
    }
}
