package ch.so.arp.nexa.llm;

import java.util.List;

import reactor.core.publisher.Mono;

/**
 * One language model backend. Implementations translate the neutral request
 * into their native protocol; timeouts, retries and error mapping are applied
 * by the {@link ProviderRouter} so that they are the same for every backend.
 */
public interface LlmBackend {

    ProviderId id();

    /**
     * @param configuration the snapshot captured when the call was dispatched
     * @return the generated text, trimmed
     */
    Mono<String> generate(GenerationRequest request, ProviderConfiguration configuration);

    /**
     * Names of the models the backend offers. Doubles as health check.
     */
    Mono<List<String>> listModels(ProviderConfiguration configuration);
}
