package ch.so.arp.nexa.llm;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import ch.so.arp.nexa.llm.ProviderConfiguration.CloudSettings;
import ch.so.arp.nexa.llm.ProviderConfiguration.GenerationParameters;
import ch.so.arp.nexa.llm.ProviderConfiguration.OllamaSettings;

/**
 * Initial language model settings. They seed the provider configuration
 * store; later changes go through the store and are not written back.
 */
@ConfigurationProperties(prefix = "rag.llm")
public class LlmProperties {

    /**
     * Provider used at startup, {@code ollama} or {@code cloud}.
     */
    private ProviderId provider = ProviderId.OLLAMA;

    private final Ollama ollama = new Ollama();

    private final Cloud cloud = new Cloud();

    private double temperature = 0.2d;

    private double topP = 0.9d;

    private int maxTokens = 512;

    /**
     * Upper bound for a single attempt of a backend call.
     */
    private Duration timeout = Duration.ofSeconds(60);

    /**
     * Delay before the single retry of a failed backend call.
     */
    private Duration retryBackoff = Duration.ofMillis(500);

    public ProviderConfiguration toConfiguration() {
        return new ProviderConfiguration(1L, provider,
                new OllamaSettings(ollama.getBaseUrl(), ollama.getModel(), ollama.isUseChatApi()),
                new CloudSettings(cloud.getBaseUrl(), cloud.getModel(), cloud.getApiKey()),
                new GenerationParameters(temperature, topP, maxTokens));
    }

    public ProviderId getProvider() {
        return provider;
    }

    public void setProvider(ProviderId provider) {
        this.provider = provider;
    }

    public Ollama getOllama() {
        return ollama;
    }

    public Cloud getCloud() {
        return cloud;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public double getTopP() {
        return topP;
    }

    public void setTopP(double topP) {
        this.topP = topP;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
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

    public static class Ollama {

        private String baseUrl = "http://localhost:11434";

        private String model = "mistral";

        /**
         * Use {@code /api/chat} instead of {@code /api/generate}.
         */
        private boolean useChatApi = true;

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

        public boolean isUseChatApi() {
            return useChatApi;
        }

        public void setUseChatApi(boolean useChatApi) {
            this.useChatApi = useChatApi;
        }
    }

    public static class Cloud {

        private String baseUrl = "https://api.openai.com/v1";

        private String model = "gpt-4";

        /**
         * API key that authorises requests against the cloud endpoint.
         */
        private String apiKey;

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
    }
}
