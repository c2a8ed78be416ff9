package ch.so.arp.nexa.llm;

import java.util.Objects;

import org.springframework.util.StringUtils;

import ch.so.arp.nexa.error.ConfigurationException;

/**
 * Immutable, versioned snapshot of the language model settings. A new
 * snapshot with a higher version replaces the old one on every update; a
 * call keeps using the snapshot it was dispatched with.
 */
public record ProviderConfiguration(
        long version,
        ProviderId activeProvider,
        OllamaSettings ollama,
        CloudSettings cloud,
        GenerationParameters parameters) {

    public ProviderConfiguration {
        Objects.requireNonNull(activeProvider, "activeProvider");
        Objects.requireNonNull(ollama, "ollama");
        Objects.requireNonNull(cloud, "cloud");
        Objects.requireNonNull(parameters, "parameters");
    }

    public String activeModel() {
        return activeProvider == ProviderId.OLLAMA ? ollama.model() : cloud.model();
    }

    public String activeBaseUrl() {
        return activeProvider == ProviderId.OLLAMA ? ollama.baseUrl() : cloud.baseUrl();
    }

    /**
     * Same snapshot, same version, with different generation parameters.
     * Used for per-call overrides.
     */
    public ProviderConfiguration withParameters(GenerationParameters overrides) {
        overrides.validate();
        return new ProviderConfiguration(version, activeProvider, ollama, cloud, overrides);
    }

    /**
     * Apply a partial update. Fields the update leaves {@code null} keep their
     * current value; the result carries the next version.
     *
     * @throws ConfigurationException if the merged settings are invalid
     */
    public ProviderConfiguration merge(ProviderConfigurationUpdate update) {
        OllamaSettings mergedOllama = new OllamaSettings(
                pick(update.ollamaBaseUrl(), ollama.baseUrl()),
                pick(update.ollamaModel(), ollama.model()),
                pick(update.ollamaUseChatApi(), ollama.useChatApi()));
        CloudSettings mergedCloud = new CloudSettings(
                pick(update.cloudBaseUrl(), cloud.baseUrl()),
                pick(update.cloudModel(), cloud.model()),
                pick(update.cloudApiKey(), cloud.apiKey()));
        GenerationParameters mergedParameters = new GenerationParameters(
                pick(update.temperature(), parameters.temperature()),
                pick(update.topP(), parameters.topP()),
                pick(update.maxTokens(), parameters.maxTokens()));
        ProviderConfiguration merged = new ProviderConfiguration(version + 1,
                pick(update.provider(), activeProvider), mergedOllama, mergedCloud, mergedParameters);
        merged.validate();
        return merged;
    }

    public void validate() {
        requireText(ollama.baseUrl(), "Ollama base URL");
        requireText(ollama.model(), "Ollama model");
        requireText(cloud.baseUrl(), "cloud base URL");
        requireText(cloud.model(), "cloud model");
        parameters.validate();
    }

    private static <T> T pick(T update, T current) {
        return update != null ? update : current;
    }

    private static void requireText(String value, String name) {
        if (!StringUtils.hasText(value)) {
            throw new ConfigurationException(name + " must not be blank");
        }
    }

    public record OllamaSettings(String baseUrl, String model, boolean useChatApi) {
    }

    public record CloudSettings(String baseUrl, String model, String apiKey) {

        public boolean hasApiKey() {
            return StringUtils.hasText(apiKey);
        }

        public String maskedApiKey() {
            return mask(apiKey);
        }

        @Override
        public String toString() {
            return "CloudSettings[baseUrl=" + baseUrl + ", model=" + model + ", apiKey=" + maskedApiKey() + "]";
        }

        static String mask(String apiKey) {
            if (!StringUtils.hasText(apiKey)) {
                return "";
            }
            if (apiKey.length() < 8) {
                return "***";
            }
            return "***" + apiKey.substring(apiKey.length() - 4);
        }
    }

    /**
     * Sampling settings sent with every generation request.
     */
    public record GenerationParameters(double temperature, double topP, int maxTokens) {

        public void validate() {
            if (Double.isNaN(temperature) || temperature < 0.0d || temperature > 2.0d) {
                throw new ConfigurationException("temperature must be within [0, 2], was " + temperature);
            }
            if (Double.isNaN(topP) || topP <= 0.0d || topP > 1.0d) {
                throw new ConfigurationException("top-p must be within (0, 1], was " + topP);
            }
            if (maxTokens <= 0) {
                throw new ConfigurationException("max tokens must be positive, was " + maxTokens);
            }
        }
    }
}
