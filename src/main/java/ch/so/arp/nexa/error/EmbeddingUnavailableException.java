package ch.so.arp.nexa.error;

/**
 * The embedding backend could not be reached or answered with an error after
 * the retry budget was spent.
 */
public class EmbeddingUnavailableException extends RagException {

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(ErrorCode.EMBEDDING_UNAVAILABLE, message, cause);
    }
}
