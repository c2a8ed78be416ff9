package ch.so.arp.nexa.ingest;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns the raw bytes of a source file into plain text.
 */
public interface DocumentLoader {

    /**
     * @return whether {@link #load(Path, byte[])} understands the file type
     */
    boolean supports(Path path);

    /**
     * @param path    the source file, used to detect the format
     * @param content the bytes read from {@code path}
     * @return the extracted text
     * @throws ch.so.arp.nexa.error.UnsupportedFormatException for file types
     *         the loader cannot read
     * @throws IOException if the content cannot be parsed
     */
    String load(Path path, byte[] content) throws IOException;
}
