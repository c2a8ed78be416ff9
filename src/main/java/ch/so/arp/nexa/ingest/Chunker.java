package ch.so.arp.nexa.ingest;

import java.util.ArrayList;
import java.util.List;

import ch.so.arp.nexa.error.ConfigurationException;

/**
 * Splits document text into overlapping word windows. Every window holds
 * {@code chunkSize} words and shares {@code overlap} words with its
 * predecessor; the last one may be shorter. The chunk text is the exact
 * source substring covering its words, so the same input always produces the
 * same boundaries.
 */
public class Chunker {

    private final int chunkSize;
    private final int overlap;

    public Chunker(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new ConfigurationException("chunk size must be positive, was " + chunkSize);
        }
        if (overlap < 0) {
            throw new ConfigurationException("chunk overlap must not be negative, was " + overlap);
        }
        if (overlap >= chunkSize) {
            throw new ConfigurationException(
                    "chunk overlap (" + overlap + ") must be smaller than chunk size (" + chunkSize + ")");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public List<Chunk> chunk(String documentId, String source, String text) {
        List<int[]> words = wordSpans(text);
        List<Chunk> chunks = new ArrayList<>();
        int start = 0;
        while (start < words.size()) {
            int end = Math.min(start + chunkSize, words.size());
            int from = words.get(start)[0];
            int to = words.get(end - 1)[1];
            int ordinal = chunks.size();
            chunks.add(new Chunk(Chunk.idFor(documentId, ordinal), documentId, source, ordinal,
                    text.substring(from, to), from, to));
            if (end >= words.size()) {
                break;
            }
            start = end - overlap;
        }
        return chunks;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getOverlap() {
        return overlap;
    }

    private static List<int[]> wordSpans(String text) {
        List<int[]> spans = new ArrayList<>();
        if (text == null) {
            return spans;
        }
        int i = 0;
        int length = text.length();
        while (i < length) {
            while (i < length && Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            if (i >= length) {
                break;
            }
            int begin = i;
            while (i < length && !Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            spans.add(new int[] { begin, i });
        }
        return spans;
    }
}
