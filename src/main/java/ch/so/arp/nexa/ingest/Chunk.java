package ch.so.arp.nexa.ingest;

/**
 * Bounded text span of a document and the unit of retrieval. The offsets
 * point into the text the loader produced for the document.
 */
public record Chunk(
        String id,
        String documentId,
        String source,
        int ordinal,
        String text,
        int startOffset,
        int endOffset) {

    public static String idFor(String documentId, int ordinal) {
        return documentId + ":" + ordinal;
    }

    /**
     * File name part of the source path, used when citing the chunk.
     */
    public String sourceName() {
        if (source == null || source.isBlank()) {
            return "unknown";
        }
        String normalized = source.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }
}
