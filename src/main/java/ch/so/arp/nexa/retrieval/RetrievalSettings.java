package ch.so.arp.nexa.retrieval;

import ch.so.arp.nexa.error.ConfigurationException;

/**
 * Tuning of the retrieval step that can be changed at runtime.
 *
 * @param topK               maximum number of hits to consider, positive
 * @param relevanceThreshold minimum cosine similarity, within [-1, 1]
 */
public record RetrievalSettings(int topK, double relevanceThreshold) {

    public RetrievalSettings {
        if (topK <= 0) {
            throw new ConfigurationException("top-k must be positive, was " + topK);
        }
        if (Double.isNaN(relevanceThreshold) || relevanceThreshold < -1.0d || relevanceThreshold > 1.0d) {
            throw new ConfigurationException("relevance threshold must be within [-1, 1], was " + relevanceThreshold);
        }
    }

    /**
     * Apply a partial change; {@code null} fields keep their current value.
     */
    public RetrievalSettings merge(Update update) {
        return new RetrievalSettings(
                update.topK() != null ? update.topK() : topK,
                update.relevanceThreshold() != null ? update.relevanceThreshold() : relevanceThreshold);
    }

    public record Update(Integer topK, Double relevanceThreshold) {
    }
}
