package ch.so.arp.nexa.chat;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

@ConfigurationProperties(prefix = "rag.chat")
public class ChatProperties {

    /**
     * Worker threads answering chat requests.
     */
    private int executorThreads = 4;

    /**
     * Requests waiting for a worker before new ones are rejected.
     */
    private int queueCapacity = 100;

    /**
     * Answer returned when no relevant context is found.
     */
    private String refusalText = "I can only help with questions related to Nexa. "
            + "This information is not available in the documentation.";

    private Resource systemPrompt = new ClassPathResource("prompts/system.txt");

    /**
     * Template wrapping context and question, with {@code {context}} and
     * {@code {question}} placeholders.
     */
    private Resource ragPrompt = new ClassPathResource("prompts/rag_addon.txt");

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public String getRefusalText() {
        return refusalText;
    }

    public void setRefusalText(String refusalText) {
        this.refusalText = refusalText;
    }

    public Resource getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(Resource systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public Resource getRagPrompt() {
        return ragPrompt;
    }

    public void setRagPrompt(Resource ragPrompt) {
        this.ragPrompt = ragPrompt;
    }
}
