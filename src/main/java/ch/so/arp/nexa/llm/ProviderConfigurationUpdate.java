package ch.so.arp.nexa.llm;

/**
 * Partial change of the provider configuration. {@code null} means keep the
 * current value.
 */
public record ProviderConfigurationUpdate(
        ProviderId provider,
        String ollamaBaseUrl,
        String ollamaModel,
        Boolean ollamaUseChatApi,
        String cloudBaseUrl,
        String cloudModel,
        String cloudApiKey,
        Double temperature,
        Double topP,
        Integer maxTokens) {

    public static ProviderConfigurationUpdate provider(ProviderId provider) {
        return new ProviderConfigurationUpdate(provider, null, null, null, null, null, null, null, null, null);
    }

    public static ProviderConfigurationUpdate model(ProviderId provider, String model) {
        return provider == ProviderId.OLLAMA
                ? new ProviderConfigurationUpdate(null, null, model, null, null, null, null, null, null, null)
                : new ProviderConfigurationUpdate(null, null, null, null, null, model, null, null, null, null);
    }
}
