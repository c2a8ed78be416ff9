package ch.so.arp.nexa.embedding;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.JsonNode;

import ch.so.arp.nexa.error.EmbeddingUnavailableException;
import ch.so.arp.nexa.error.IndexIncompatibleException;
import ch.so.arp.nexa.error.TransientFailures;
import reactor.core.Exceptions;
import reactor.util.retry.Retry;

/**
 * Embedding provider calling an OpenAI-compatible {@code /embeddings}
 * endpoint. One request is sent per batch; a timed out or transport-level
 * failed request is retried once with backoff before the provider gives up
 * with {@link EmbeddingUnavailableException}.
 */
class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    private final WebClient webClient;
    private final String model;
    private final int dimension;
    private final Duration timeout;
    private final Duration retryBackoff;

    OpenAiEmbeddingProvider(WebClient webClient, EmbeddingProperties properties) {
        this.webClient = webClient;
        this.model = properties.getModel();
        this.dimension = properties.getDimension();
        this.timeout = properties.getTimeout();
        this.retryBackoff = properties.getRetryBackoff();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public float[] embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        LOGGER.debug("Requesting {} embeddings from model {}", texts.size(), model);
        JsonNode response;
        try {
            response = webClient.post()
                    .uri("/embeddings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("model", model, "input", texts))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .retryWhen(Retry.backoff(1, retryBackoff)
                            .filter(TransientFailures::isTransient)
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .block();
        } catch (RuntimeException ex) {
            Throwable cause = Exceptions.unwrap(ex);
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Embedding request interrupted");
            }
            throw new EmbeddingUnavailableException(
                    "Embedding request to model '" + model + "' failed: " + cause.getMessage(), cause);
        }
        return parseVectors(response, texts.size());
    }

    private List<float[]> parseVectors(JsonNode response, int expected) {
        JsonNode data = response == null ? null : response.get("data");
        if (data == null || !data.isArray() || data.size() != expected) {
            throw new EmbeddingUnavailableException("Embedding response for model '" + model
                    + "' did not contain " + expected + " vectors", null);
        }
        List<JsonNode> items = new ArrayList<>();
        data.forEach(items::add);
        items.sort(Comparator.comparingInt(item -> item.path("index").asInt()));
        List<float[]> vectors = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            JsonNode embedding = item.get("embedding");
            if (embedding == null || !embedding.isArray()) {
                throw new EmbeddingUnavailableException("Embedding response item without vector", null);
            }
            if (embedding.size() != dimension) {
                throw new IndexIncompatibleException(dimension, embedding.size());
            }
            float[] vector = new float[embedding.size()];
            for (int i = 0; i < embedding.size(); i++) {
                vector[i] = (float) embedding.get(i).asDouble();
            }
            vectors.add(vector);
        }
        return vectors;
    }
}
