package ch.so.arp.nexa.llm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.JsonNode;

import ch.so.arp.nexa.error.GenerationFailedException;
import ch.so.arp.nexa.llm.ProviderConfiguration.GenerationParameters;
import ch.so.arp.nexa.llm.ProviderConfiguration.OllamaSettings;
import reactor.core.publisher.Mono;

/**
 * Local model server speaking the Ollama HTTP API. Uses the message based
 * {@code /api/chat} endpoint unless the configuration falls back to the raw
 * prompt {@code /api/generate} endpoint.
 */
class OllamaBackend implements LlmBackend {

    private static final Logger LOGGER = LoggerFactory.getLogger(OllamaBackend.class);

    private final WebClient webClient;

    OllamaBackend(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public ProviderId id() {
        return ProviderId.OLLAMA;
    }

    @Override
    public Mono<String> generate(GenerationRequest request, ProviderConfiguration configuration) {
        OllamaSettings settings = configuration.ollama();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", settings.model());
        payload.put("stream", false);
        payload.put("options", options(configuration.parameters()));
        String endpoint;
        if (settings.useChatApi()) {
            endpoint = "/api/chat";
            payload.put("messages", ChatMessages.of(request));
        } else {
            endpoint = "/api/generate";
            payload.put("prompt", request.prompt());
            if (StringUtils.hasText(request.systemPrompt())) {
                payload.put("system", request.systemPrompt());
            }
        }
        LOGGER.debug("Calling Ollama {} with model {}", endpoint, settings.model());
        return webClient.post()
                .uri(ChatMessages.join(settings.baseUrl(), endpoint))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> settings.useChatApi()
                        ? text(response.path("message").path("content"))
                        : text(response.path("response")));
    }

    @Override
    public Mono<List<String>> listModels(ProviderConfiguration configuration) {
        return webClient.get()
                .uri(ChatMessages.join(configuration.ollama().baseUrl(), "/api/tags"))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> {
                    List<String> names = new ArrayList<>();
                    response.path("models").forEach(model -> names.add(model.path("name").asText()));
                    return names;
                });
    }

    private static Map<String, Object> options(GenerationParameters parameters) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("temperature", parameters.temperature());
        options.put("top_p", parameters.topP());
        options.put("num_predict", parameters.maxTokens());
        return options;
    }

    private static String text(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            throw new GenerationFailedException(ProviderId.OLLAMA.id(), "Ollama response contained no text", null);
        }
        return node.asText().strip();
    }
}
