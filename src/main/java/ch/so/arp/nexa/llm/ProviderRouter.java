package ch.so.arp.nexa.llm;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.nexa.error.ConfigurationException;
import ch.so.arp.nexa.error.GenerationFailedException;
import ch.so.arp.nexa.error.TransientFailures;
import ch.so.arp.nexa.llm.ProviderConfiguration.GenerationParameters;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Dispatches generation requests to the backend of the active provider.
 * <p>
 * Each call captures the current {@link ProviderConfiguration} once and uses
 * it to the end, so switching provider or model only affects later calls.
 * Every backend gets the same policy: a bounded wait per attempt and one
 * retry with backoff for timeouts, transport errors, server errors and rate
 * limiting. Anything else fails right away. Interrupting the calling thread
 * cancels the in-flight request.
 */
public class ProviderRouter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProviderRouter.class);

    private final ProviderConfigurationStore configurationStore;
    private final Map<ProviderId, LlmBackend> backends = new EnumMap<>(ProviderId.class);
    private final Duration timeout;
    private final Duration retryBackoff;

    public ProviderRouter(ProviderConfigurationStore configurationStore, List<LlmBackend> backends,
            Duration timeout, Duration retryBackoff) {
        this.configurationStore = Objects.requireNonNull(configurationStore, "configurationStore");
        backends.forEach(backend -> this.backends.put(backend.id(), backend));
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.retryBackoff = Objects.requireNonNull(retryBackoff, "retryBackoff");
    }

    public Generation generate(GenerationRequest request) {
        return dispatch(request, configurationStore.current());
    }

    /**
     * Generate with the current provider but different sampling parameters.
     */
    public Generation generate(GenerationRequest request, GenerationParameters overrides) {
        ProviderConfiguration configuration = configurationStore.current();
        return dispatch(request, overrides == null ? configuration : configuration.withParameters(overrides));
    }

    /**
     * Ask the active backend for its models. Never throws; an unreachable or
     * misconfigured backend is reported as not ready.
     */
    public ProviderStatus status() {
        ProviderConfiguration configuration = configurationStore.current();
        ProviderId provider = configuration.activeProvider();
        try {
            List<String> models = fetchModels(configuration);
            return new ProviderStatus(provider, configuration.activeModel(), configuration.activeBaseUrl(), true,
                    models.size(), null);
        } catch (GenerationFailedException | ConfigurationException ex) {
            LOGGER.debug("Provider {} not ready: {}", provider.id(), ex.getMessage());
            return new ProviderStatus(provider, configuration.activeModel(), configuration.activeBaseUrl(), false,
                    0, ex.getMessage());
        }
    }

    public List<String> listModels() {
        return fetchModels(configurationStore.current());
    }

    public ProviderConfiguration switchProvider(ProviderId provider) {
        return configurationStore.update(ProviderConfigurationUpdate.provider(provider));
    }

    /**
     * Change the model of the currently active provider.
     */
    public ProviderConfiguration switchModel(String model) {
        ProviderId provider = configurationStore.current().activeProvider();
        return configurationStore.update(ProviderConfigurationUpdate.model(provider, model));
    }

    public ProviderConfiguration configuration() {
        return configurationStore.current();
    }

    private Generation dispatch(GenerationRequest request, ProviderConfiguration configuration) {
        ProviderId provider = configuration.activeProvider();
        String model = configuration.activeModel();
        LlmBackend backend = backendFor(provider);
        LOGGER.debug("Dispatching generation to {} / {} (configuration version {})", provider.id(), model,
                configuration.version());
        String text = await(backend.generate(request, configuration), provider, "generation");
        if (text == null) {
            throw new GenerationFailedException(provider.id(), "Provider returned no response", null);
        }
        return new Generation(text, provider, model, configuration.version());
    }

    private List<String> fetchModels(ProviderConfiguration configuration) {
        ProviderId provider = configuration.activeProvider();
        List<String> models = await(backendFor(provider).listModels(configuration), provider, "model listing");
        return models == null ? List.of() : models;
    }

    private <T> T await(Mono<T> call, ProviderId provider, String operation) {
        try {
            return call.timeout(timeout)
                    .retryWhen(Retry.backoff(1, retryBackoff)
                            .filter(TransientFailures::isTransient)
                            .doBeforeRetry(signal -> LOGGER.warn("Retrying {} on {} after: {}", operation,
                                    provider.id(), signal.failure().toString()))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .block();
        } catch (RuntimeException ex) {
            Throwable cause = Exceptions.unwrap(ex);
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new CancellationException(operation + " on " + provider.id() + " cancelled");
            }
            if (cause instanceof ConfigurationException configurationException) {
                throw configurationException;
            }
            if (cause instanceof GenerationFailedException generationFailed) {
                throw generationFailed;
            }
            LOGGER.error("{} on {} failed: {}", operation, provider.id(), cause.toString());
            throw new GenerationFailedException(provider.id(),
                    "Provider '" + provider.id() + "' failed during " + operation + ": " + describe(cause), cause);
        }
    }

    private LlmBackend backendFor(ProviderId provider) {
        LlmBackend backend = backends.get(provider);
        if (backend == null) {
            throw new ConfigurationException("No backend registered for provider '" + provider.id() + "'");
        }
        return backend;
    }

    private static String describe(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return "no response in time";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
