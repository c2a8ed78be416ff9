package ch.so.arp.nexa.llm;

import java.util.Arrays;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import ch.so.arp.nexa.error.ConfigurationException;

/**
 * The language model backends the router can dispatch to.
 */
public enum ProviderId {

    OLLAMA("ollama"),
    CLOUD("cloud");

    private final String id;

    ProviderId(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static ProviderId fromId(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(provider -> provider.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException(
                        "Unknown provider '" + value + "', expected 'ollama' or 'cloud'"));
    }
}
