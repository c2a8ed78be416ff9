package ch.so.arp.nexa.error;

/**
 * A language model call failed after the retry budget was spent, or failed
 * with an error that is not worth retrying.
 */
public class GenerationFailedException extends RagException {

    private final String provider;

    public GenerationFailedException(String provider, String message, Throwable cause) {
        super(ErrorCode.GENERATION_FAILED, message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
