package ch.so.arp.nexa.error;

/**
 * Raised by document loaders for files they cannot read. Batch ingestion
 * records it against the document and moves on.
 */
public class UnsupportedFormatException extends RagException {

    private final String source;

    public UnsupportedFormatException(String source, String extension) {
        super(ErrorCode.UNSUPPORTED_FORMAT, "Unsupported file type '" + extension + "': " + source, null);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
