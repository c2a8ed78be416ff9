package ch.so.arp.nexa.llm;

import static ch.so.arp.nexa.llm.StubExchange.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;

import ch.so.arp.nexa.error.GenerationFailedException;
import ch.so.arp.nexa.llm.ProviderConfiguration.CloudSettings;
import ch.so.arp.nexa.llm.ProviderConfiguration.GenerationParameters;
import ch.so.arp.nexa.llm.ProviderConfiguration.OllamaSettings;

class OllamaBackendTest {

    private static final GenerationRequest REQUEST = new GenerationRequest("Be brief.", "How do I deploy?");

    @Test
    void sendsMessagesToChatEndpoint() {
        StubExchange exchange = StubExchange.answering(request -> json("""
                {"model": "mistral", "message": {"role": "assistant", "content": "  Run ./deploy.sh.\\n"}, "done": true}
                """));
        OllamaBackend backend = new OllamaBackend(exchange.webClient());

        String answer = backend.generate(REQUEST, configuration(true)).block();

        assertThat(answer).isEqualTo("Run ./deploy.sh.");
        StubExchange.Recorded request = exchange.last();
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url()).isEqualTo("http://localhost:11434/api/chat");
        assertThat(request.body().path("model").asText()).isEqualTo("mistral");
        assertThat(request.body().path("stream").asBoolean(true)).isFalse();
        assertThat(request.body().path("messages").get(0).path("role").asText()).isEqualTo("system");
        assertThat(request.body().path("messages").get(1).path("content").asText()).isEqualTo("How do I deploy?");
        assertThat(request.body().path("options").path("temperature").asDouble()).isEqualTo(0.2);
        assertThat(request.body().path("options").path("top_p").asDouble()).isEqualTo(0.9);
        assertThat(request.body().path("options").path("num_predict").asInt()).isEqualTo(512);
    }

    @Test
    void fallsBackToGenerateEndpoint() {
        StubExchange exchange = StubExchange.answering(request -> json("{\"response\": \"Run ./deploy.sh.\"}"));
        OllamaBackend backend = new OllamaBackend(exchange.webClient());

        assertThat(backend.generate(REQUEST, configuration(false)).block()).isEqualTo("Run ./deploy.sh.");
        assertThat(exchange.last().url()).isEqualTo("http://localhost:11434/api/generate");
        assertThat(exchange.last().body().path("prompt").asText()).isEqualTo("How do I deploy?");
        assertThat(exchange.last().body().path("system").asText()).isEqualTo("Be brief.");
    }

    @Test
    void failsWhenResponseHasNoText() {
        StubExchange exchange = StubExchange.answering(request -> json("{\"done\": true}"));
        OllamaBackend backend = new OllamaBackend(exchange.webClient());

        assertThatThrownBy(() -> backend.generate(REQUEST, configuration(true)).block())
                .isInstanceOf(GenerationFailedException.class);
    }

    @Test
    void listsInstalledModels() {
        StubExchange exchange = StubExchange.answering(request -> json("""
                {"models": [{"name": "mistral:latest"}, {"name": "llama3:8b"}]}
                """));
        OllamaBackend backend = new OllamaBackend(exchange.webClient());

        assertThat(backend.listModels(configuration(true)).block()).containsExactly("mistral:latest", "llama3:8b");
        assertThat(exchange.last().method()).isEqualTo(HttpMethod.GET);
        assertThat(exchange.last().url()).isEqualTo("http://localhost:11434/api/tags");
    }

    private static ProviderConfiguration configuration(boolean useChatApi) {
        return new ProviderConfiguration(1, ProviderId.OLLAMA,
                new OllamaSettings("http://localhost:11434/", "mistral", useChatApi),
                new CloudSettings("https://api.openai.com/v1", "gpt-4", ""),
                new GenerationParameters(0.2, 0.9, 512));
    }
}
