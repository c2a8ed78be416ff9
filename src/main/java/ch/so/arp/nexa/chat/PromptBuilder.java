package ch.so.arp.nexa.chat;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.nexa.llm.GenerationRequest;
import ch.so.arp.nexa.retrieval.RetrievalResult;

/**
 * Builds the generation request from the system template and the RAG
 * template. The RAG template may reference {@code {context}} and
 * {@code {question}}; both are substituted in one pass, so text inside the
 * context or question is never treated as a placeholder.
 * <p>
 * Templates can be replaced at runtime. Every request is built from one
 * consistent pair of templates.
 */
public class PromptBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(PromptBuilder.class);

    static final String QUESTION_PLACEHOLDER = "{question}";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(context|question)\\}");

    private final AtomicReference<PromptTemplates> templates;

    public PromptBuilder(String systemTemplate, String ragTemplate) {
        this.templates = new AtomicReference<>(new PromptTemplates(systemTemplate, ragTemplate));
    }

    public PromptTemplates templates() {
        return templates.get();
    }

    /**
     * @throws ch.so.arp.nexa.error.ConfigurationException if the resulting
     *         RAG template lacks the question placeholder; the current
     *         templates are kept then
     */
    public PromptTemplates update(PromptTemplates.Update update) {
        Objects.requireNonNull(update, "update");
        PromptTemplates updated = templates.updateAndGet(current -> current.merge(update));
        LOGGER.info("Prompt templates updated (system {} chars, RAG {} chars)", updated.systemPrompt().length(),
                updated.ragPrompt().length());
        return updated;
    }

    public GenerationRequest build(RetrievalResult retrieval, String question) {
        PromptTemplates current = templates.get();
        Matcher matcher = PLACEHOLDER.matcher(current.ragPrompt());
        StringBuilder prompt = new StringBuilder();
        while (matcher.find()) {
            String value = "context".equals(matcher.group(1)) ? retrieval.context() : question;
            matcher.appendReplacement(prompt, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(prompt);
        return new GenerationRequest(current.systemPrompt().strip(), prompt.toString().strip());
    }
}
