package ch.so.arp.nexa.retrieval;

/**
 * Reference from an answer to a chunk that was part of its context.
 *
 * @param source file name of the cited document
 */
public record Citation(String chunkId, String documentId, String source, double score) {

    public static Citation of(RankedChunk ranked) {
        return new Citation(ranked.chunk().id(), ranked.chunk().documentId(), ranked.chunk().sourceName(),
                ranked.score());
    }
}
