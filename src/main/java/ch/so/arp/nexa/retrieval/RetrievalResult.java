package ch.so.arp.nexa.retrieval;

import java.util.List;

/**
 * Outcome of a retrieval. {@link Relevance#NO_RELEVANT_CONTEXT} is a regular
 * result and means the question must be refused; it is never represented by
 * an empty context.
 *
 * @param relevance whether any chunk passed the relevance threshold
 * @param chunks    the chunks that made it into the context, best first
 * @param context   the assembled context, empty when nothing was relevant
 */
public record RetrievalResult(Relevance relevance, List<RankedChunk> chunks, String context) {

    public enum Relevance {
        NO_RELEVANT_CONTEXT,
        CONTEXT_FOUND
    }

    public RetrievalResult {
        chunks = List.copyOf(chunks);
    }

    public static RetrievalResult noRelevantContext() {
        return new RetrievalResult(Relevance.NO_RELEVANT_CONTEXT, List.of(), "");
    }

    public static RetrievalResult contextFound(List<RankedChunk> chunks, String context) {
        if (chunks.isEmpty()) {
            throw new IllegalArgumentException("a found context needs at least one chunk");
        }
        return new RetrievalResult(Relevance.CONTEXT_FOUND, chunks, context);
    }

    public boolean hasContext() {
        return relevance == Relevance.CONTEXT_FOUND;
    }
}
