package ch.so.arp.nexa.chat;

import java.util.Objects;

import ch.so.arp.nexa.error.ConfigurationException;

/**
 * The system prompt and the RAG prompt. The RAG prompt must reference
 * {@code {question}}; {@code {context}} is optional.
 */
public record PromptTemplates(String systemPrompt, String ragPrompt) {

    public PromptTemplates {
        Objects.requireNonNull(systemPrompt, "systemPrompt");
        Objects.requireNonNull(ragPrompt, "ragPrompt");
        if (!ragPrompt.contains(PromptBuilder.QUESTION_PLACEHOLDER)) {
            throw new ConfigurationException("RAG prompt must contain " + PromptBuilder.QUESTION_PLACEHOLDER);
        }
    }

    PromptTemplates merge(Update update) {
        return new PromptTemplates(
                update.systemPrompt() != null ? update.systemPrompt() : systemPrompt,
                update.ragPrompt() != null ? update.ragPrompt() : ragPrompt);
    }

    /**
     * Partial change of the templates. {@code null} means keep the current
     * template.
     */
    public record Update(String systemPrompt, String ragPrompt) {
    }
}
