package ch.so.arp.nexa.llm;

/**
 * Backend-neutral generation input.
 *
 * @param systemPrompt instructions for the model, may be empty
 * @param prompt       the user turn
 */
public record GenerationRequest(String systemPrompt, String prompt) {
}
