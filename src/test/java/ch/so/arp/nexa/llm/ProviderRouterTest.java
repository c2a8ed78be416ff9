package ch.so.arp.nexa.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;
import java.util.function.Function;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import ch.so.arp.nexa.error.ConfigurationException;
import ch.so.arp.nexa.error.GenerationFailedException;
import ch.so.arp.nexa.llm.ProviderConfiguration.CloudSettings;
import ch.so.arp.nexa.llm.ProviderConfiguration.GenerationParameters;
import ch.so.arp.nexa.llm.ProviderConfiguration.OllamaSettings;
import reactor.core.publisher.Mono;

class ProviderRouterTest {

    private static final GenerationRequest REQUEST = new GenerationRequest("system", "How do I deploy?");

    private final InMemoryProviderConfigurationStore store = new InMemoryProviderConfigurationStore(
            new ProviderConfiguration(1, ProviderId.OLLAMA,
                    new OllamaSettings("http://localhost:11434", "mistral", true),
                    new CloudSettings("https://api.openai.com/v1", "gpt-4", "sk-test-1234567890"),
                    new GenerationParameters(0.2, 0.9, 512)));
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void dispatchesToActiveProvider() {
        FakeBackend ollama = new FakeBackend(ProviderId.OLLAMA, (request, configuration) -> Mono.just("from ollama"));
        FakeBackend cloud = new FakeBackend(ProviderId.CLOUD, (request, configuration) -> Mono.just("from cloud"));
        ProviderRouter router = router(ollama, cloud);

        Generation generation = router.generate(REQUEST);

        assertThat(generation.text()).isEqualTo("from ollama");
        assertThat(generation.provider()).isEqualTo(ProviderId.OLLAMA);
        assertThat(generation.model()).isEqualTo("mistral");
        assertThat(generation.configurationVersion()).isEqualTo(1);

        router.switchProvider(ProviderId.CLOUD);

        assertThat(router.generate(REQUEST).text()).isEqualTo("from cloud");
        assertThat(cloud.calls).hasValue(1);
    }

    @Test
    void retriesServerErrorOnce() {
        FakeBackend ollama = new FakeBackend(ProviderId.OLLAMA, (request, configuration) -> Mono.error(
                WebClientResponseException.create(503, "Service Unavailable", HttpHeaders.EMPTY, new byte[0],
                        StandardCharsets.UTF_8)));
        ProviderRouter router = router(ollama);

        assertThatThrownBy(() -> router.generate(REQUEST))
                .isInstanceOfSatisfying(GenerationFailedException.class,
                        ex -> assertThat(ex.getMessage()).contains("ollama"));
        assertThat(ollama.calls).hasValue(2);
    }

    @Test
    void succeedsWhenRetrySucceeds() {
        AtomicInteger attempts = new AtomicInteger();
        FakeBackend ollama = new FakeBackend(ProviderId.OLLAMA, (request, configuration) -> attempts
                .incrementAndGet() == 1
                        ? Mono.error(WebClientResponseException.create(429, "Too Many Requests", HttpHeaders.EMPTY,
                                new byte[0], StandardCharsets.UTF_8))
                        : Mono.just("second time lucky"));
        ProviderRouter router = router(ollama);

        assertThat(router.generate(REQUEST).text()).isEqualTo("second time lucky");
        assertThat(ollama.calls).hasValue(2);
    }

    @Test
    void doesNotRetryClientError() {
        FakeBackend ollama = new FakeBackend(ProviderId.OLLAMA, (request, configuration) -> Mono.error(
                WebClientResponseException.create(400, "Bad Request", HttpHeaders.EMPTY, new byte[0],
                        StandardCharsets.UTF_8)));
        ProviderRouter router = router(ollama);

        assertThatThrownBy(() -> router.generate(REQUEST)).isInstanceOf(GenerationFailedException.class);
        assertThat(ollama.calls).hasValue(1);
    }

    @Test
    void timesOutEachAttempt() {
        FakeBackend ollama = new FakeBackend(ProviderId.OLLAMA, (request, configuration) -> Mono.never());
        ProviderRouter router = new ProviderRouter(store, List.of(ollama), Duration.ofMillis(50),
                Duration.ofMillis(10));

        assertThatThrownBy(() -> router.generate(REQUEST))
                .isInstanceOf(GenerationFailedException.class)
                .hasMessageContaining("no response in time");
        assertThat(ollama.calls).hasValue(2);
    }

    @Test
    void passesConfigurationErrorsThrough() {
        FakeBackend cloud = new FakeBackend(ProviderId.CLOUD, (request, configuration) -> Mono.error(
                new ConfigurationException("No API key configured for the cloud provider")));
        ProviderRouter router = router(cloud);
        router.switchProvider(ProviderId.CLOUD);

        assertThatThrownBy(() -> router.generate(REQUEST)).isInstanceOf(ConfigurationException.class);
        assertThat(cloud.calls).hasValue(1);
    }

    @Test
    void failsWhenActiveProviderHasNoBackend() {
        ProviderRouter router = router(new FakeBackend(ProviderId.OLLAMA, (request, configuration) -> Mono.just("x")));
        router.switchProvider(ProviderId.CLOUD);

        assertThatThrownBy(() -> router.generate(REQUEST)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void inFlightCallKeepsConfigurationItStartedWith() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<ProviderConfiguration> seen = new AtomicReference<>();
        FakeBackend ollama = new FakeBackend(ProviderId.OLLAMA, (request, configuration) -> Mono.fromCallable(() -> {
            seen.set(configuration);
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "slow answer";
        }));
        FakeBackend cloud = new FakeBackend(ProviderId.CLOUD, (request, configuration) -> Mono.just("fast answer"));
        ProviderRouter router = router(ollama, cloud);

        Future<Generation> inFlight = executor.submit(() -> router.generate(REQUEST));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        ProviderConfiguration switched = router.switchProvider(ProviderId.CLOUD);
        release.countDown();

        Generation generation = inFlight.get(5, TimeUnit.SECONDS);
        assertThat(generation.provider()).isEqualTo(ProviderId.OLLAMA);
        assertThat(generation.configurationVersion()).isEqualTo(1);
        assertThat(seen.get().version()).isEqualTo(1);
        assertThat(switched.version()).isEqualTo(2);

        Generation next = router.generate(REQUEST);
        assertThat(next.provider()).isEqualTo(ProviderId.CLOUD);
        assertThat(next.configurationVersion()).isEqualTo(2);
    }

    @Test
    void overridesParametersForSingleCall() {
        AtomicReference<ProviderConfiguration> seen = new AtomicReference<>();
        FakeBackend ollama = new FakeBackend(ProviderId.OLLAMA, (request, configuration) -> {
            seen.set(configuration);
            return Mono.just("ok");
        });
        ProviderRouter router = router(ollama);

        router.generate(REQUEST, new GenerationParameters(0.0, 1.0, 64));

        assertThat(seen.get().parameters().maxTokens()).isEqualTo(64);
        assertThat(router.configuration().parameters().maxTokens()).isEqualTo(512);
        assertThatThrownBy(() -> router.generate(REQUEST, new GenerationParameters(3.0, 1.0, 64)))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void interruptingCallerCancelsRequest() throws Exception {
        CountDownLatch subscribed = new CountDownLatch(1);
        CountDownLatch cancelled = new CountDownLatch(1);
        FakeBackend ollama = new FakeBackend(ProviderId.OLLAMA, (request, configuration) -> Mono.<String>never()
                .doOnSubscribe(subscription -> subscribed.countDown())
                .doOnCancel(cancelled::countDown));
        ProviderRouter router = router(ollama);

        Future<Generation> call = executor.submit(() -> router.generate(REQUEST));
        assertThat(subscribed.await(5, TimeUnit.SECONDS)).isTrue();
        call.cancel(true);

        assertThat(cancelled.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(ollama.calls).hasValue(1);
    }

    @Test
    void reportsStatusOfActiveBackend() {
        FakeBackend ollama = new FakeBackend(ProviderId.OLLAMA, (request, configuration) -> Mono.just("x"),
                configuration -> Mono.just(List.of("mistral:latest", "llama3:8b")));
        FakeBackend cloud = new FakeBackend(ProviderId.CLOUD, (request, configuration) -> Mono.just("x"),
                configuration -> Mono.error(new IllegalStateException("Connection refused")));
        ProviderRouter router = router(ollama, cloud);

        ProviderStatus ready = router.status();
        assertThat(ready.ready()).isTrue();
        assertThat(ready.availableModels()).isEqualTo(2);
        assertThat(ready.detail()).isNull();

        router.switchProvider(ProviderId.CLOUD);
        ProviderStatus unreachable = router.status();
        assertThat(unreachable.ready()).isFalse();
        assertThat(unreachable.provider()).isEqualTo(ProviderId.CLOUD);
        assertThat(unreachable.detail()).contains("Connection refused");
    }

    @Test
    void switchesModelOfActiveProvider() {
        ProviderRouter router = router(new FakeBackend(ProviderId.OLLAMA, (request, configuration) -> Mono.just("x")));

        ProviderConfiguration updated = router.switchModel("llama3:8b");

        assertThat(updated.ollama().model()).isEqualTo("llama3:8b");
        assertThat(updated.cloud().model()).isEqualTo("gpt-4");
        assertThat(router.generate(REQUEST).model()).isEqualTo("llama3:8b");
    }

    private ProviderRouter router(LlmBackend... backends) {
        return new ProviderRouter(store, List.of(backends), Duration.ofSeconds(5), Duration.ofMillis(10));
    }

    private static final class FakeBackend implements LlmBackend {

        private final ProviderId id;
        private final BiFunction<GenerationRequest, ProviderConfiguration, Mono<String>> generator;
        private final Function<ProviderConfiguration, Mono<List<String>>> models;
        private final AtomicInteger calls = new AtomicInteger();

        FakeBackend(ProviderId id, BiFunction<GenerationRequest, ProviderConfiguration, Mono<String>> generator) {
            this(id, generator, configuration -> Mono.just(List.of()));
        }

        FakeBackend(ProviderId id, BiFunction<GenerationRequest, ProviderConfiguration, Mono<String>> generator,
                Function<ProviderConfiguration, Mono<List<String>>> models) {
            this.id = id;
            this.generator = generator;
            this.models = models;
        }

        @Override
        public ProviderId id() {
            return id;
        }

        @Override
        public Mono<String> generate(GenerationRequest request, ProviderConfiguration configuration) {
            return Mono.defer(() -> {
                calls.incrementAndGet();
                return generator.apply(request, configuration);
            });
        }

        @Override
        public Mono<List<String>> listModels(ProviderConfiguration configuration) {
            return Mono.defer(() -> models.apply(configuration));
        }
    }
}
