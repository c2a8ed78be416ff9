package ch.so.arp.nexa.llm;

/**
 * Text produced by a language model together with the configuration that
 * produced it.
 */
public record Generation(String text, ProviderId provider, String model, long configurationVersion) {
}
