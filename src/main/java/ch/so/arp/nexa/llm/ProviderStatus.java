package ch.so.arp.nexa.llm;

/**
 * Readiness of the active backend as seen by an on-demand health check.
 *
 * @param detail failure description when not ready, otherwise {@code null}
 */
public record ProviderStatus(
        ProviderId provider,
        String model,
        String baseUrl,
        boolean ready,
        int availableModels,
        String detail) {
}
