package ch.so.arp.nexa.error;

import java.util.Objects;

/**
 * Base class of all failures raised by the retrieval-augmented-generation
 * engine. Subclasses fix the {@link ErrorCode}.
 */
public abstract class RagException extends RuntimeException {

    private final ErrorCode errorCode;

    protected RagException(ErrorCode errorCode, String message, Throwable cause) {
        super(message != null ? message : errorCode.message(), cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
