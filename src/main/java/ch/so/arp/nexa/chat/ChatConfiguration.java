package ch.so.arp.nexa.chat;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import ch.so.arp.nexa.error.ConfigurationException;
import ch.so.arp.nexa.llm.ProviderRouter;
import ch.so.arp.nexa.retrieval.RetrievalPipeline;
import ch.so.arp.nexa.session.SessionStore;

/**
 * Wires the chat orchestration: the bounded worker pool, the prompt
 * templates and the {@link ChatService}.
 */
@Configuration
@EnableConfigurationProperties(ChatProperties.class)
public class ChatConfiguration {

    @Bean(destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "chatExecutor")
    public ExecutorService chatExecutor(ChatProperties properties) {
        if (properties.getExecutorThreads() <= 0 || properties.getQueueCapacity() <= 0) {
            throw new ConfigurationException("rag.chat.executor-threads and rag.chat.queue-capacity must be positive");
        }
        return new ThreadPoolExecutor(properties.getExecutorThreads(), properties.getExecutorThreads(),
                0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(properties.getQueueCapacity()),
                new CustomizableThreadFactory("chat-"));
    }

    @Bean
    @ConditionalOnMissingBean
    public PromptBuilder promptBuilder(ChatProperties properties) {
        return new PromptBuilder(read(properties.getSystemPrompt()), read(properties.getRagPrompt()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ChatService chatService(RetrievalPipeline retrievalPipeline, ProviderRouter providerRouter,
            PromptBuilder promptBuilder, SessionStore sessionStore, ExecutorService chatExecutor,
            ChatProperties properties) {
        return new ChatService(retrievalPipeline, providerRouter, promptBuilder, sessionStore, chatExecutor,
                properties.getRefusalText());
    }

    private static String read(Resource resource) {
        try {
            return resource.getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read prompt template " + resource.getDescription(), ex);
        }
    }
}
