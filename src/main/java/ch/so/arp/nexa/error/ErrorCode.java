package ch.so.arp.nexa.error;

/**
 * Stable identifiers for the failure categories of the engine. The code is
 * exposed to API clients, the message is the fallback when an exception does
 * not carry its own.
 */
public enum ErrorCode {

    CONFIGURATION_INVALID("RAG-400", "Invalid configuration or request parameters"),
    UNSUPPORTED_FORMAT("RAG-415", "Unsupported document format"),
    INDEX_INCOMPATIBLE("RAG-409", "Vector index is incompatible with the embedding model"),
    EMBEDDING_UNAVAILABLE("RAG-503-EMB", "Embedding backend unavailable"),
    GENERATION_FAILED("RAG-503-LLM", "Language model generation failed");

    private final String code;
    private final String message;

    ErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String code() {
        return code;
    }

    public String message() {
        return message;
    }
}
