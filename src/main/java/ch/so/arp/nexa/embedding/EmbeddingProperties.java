package ch.so.arp.nexa.embedding;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the embedding backend.
 */
@ConfigurationProperties(prefix = "rag.embedding")
public class EmbeddingProperties {

    /**
     * Embedding backend, either {@code hashing} (local, deterministic) or
     * {@code openai} (any OpenAI-compatible embeddings endpoint).
     */
    private String provider = "hashing";

    /**
     * Length of the produced vectors. Must match the vector index.
     */
    private int dimension = 384;

    /**
     * Number of texts sent to the backend per request.
     */
    private int batchSize = 32;

    private String baseUrl = "https://api.openai.com/v1";

    private String model = "text-embedding-3-small";

    private String apiKey;

    /**
     * Upper bound for a single embedding request.
     */
    private Duration timeout = Duration.ofSeconds(30);

    /**
     * Delay before the single retry of a failed request.
     */
    private Duration retryBackoff = Duration.ofMillis(500);

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public int getDimension() {
        return dimension;
    }

    public void setDimension(int dimension) {
        this.dimension = dimension;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }
}
