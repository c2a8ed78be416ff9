package ch.so.arp.nexa.index;

import java.util.List;

/**
 * Storage of chunk embeddings with nearest neighbour search. Implementations
 * publish their content in generations: a search always sees exactly one
 * generation, and {@link #rebuild()} and {@link #clear()} replace it
 * atomically.
 */
public interface VectorIndex {

    /**
     * @return the vector length every entry of this index has
     */
    int dimension();

    /**
     * Append entries to the current generation.
     *
     * @throws ch.so.arp.nexa.error.IndexIncompatibleException if a vector does
     *         not have {@link #dimension()} components
     */
    void add(List<VectorEntry> entries);

    /**
     * Find the {@code k} entries most similar to the query vector by cosine
     * similarity. Results are ordered by descending score, equal scores by
     * insertion order. Scores lie in {@code [-1, 1]}.
     */
    List<SearchHit> search(float[] query, int k);

    /**
     * Logically remove every entry of the document. Space is reclaimed by the
     * next {@link #rebuild()}.
     *
     * @return the number of entries that were live before the call
     */
    int remove(String documentId);

    /**
     * Compact the live entries into a new generation and publish it.
     */
    IndexStats rebuild();

    /**
     * Publish an empty generation. Calling it on an empty index is harmless.
     */
    void clear();

    IndexStats stats();
}
