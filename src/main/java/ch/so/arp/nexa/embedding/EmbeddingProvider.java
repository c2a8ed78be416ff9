package ch.so.arp.nexa.embedding;

import java.util.List;

/**
 * Strategy abstraction used to compute embeddings for chunks and questions.
 * Implementations either call a remote embedding API or compute deterministic
 * vectors locally. Every vector has exactly {@link #dimension()} components.
 */
public interface EmbeddingProvider {

    /**
     * @return the fixed length of the vectors this provider produces
     */
    int dimension();

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding represented as a float array
     */
    float[] embed(String text);

    /**
     * Create embeddings for several texts, in input order. Remote providers
     * override this to send one request per batch.
     */
    default List<float[]> embedBatch(List<String> texts) {
        return texts.stream().map(this::embed).toList();
    }
}
