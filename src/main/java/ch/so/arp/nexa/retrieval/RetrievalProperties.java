package ch.so.arp.nexa.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rag.retrieval")
public class RetrievalProperties {

    /**
     * Number of nearest chunks fetched from the index.
     */
    private int topK = 4;

    /**
     * Minimum cosine similarity of a chunk to count as relevant.
     */
    private double relevanceThreshold = 0.35d;

    /**
     * Token budget of the context block in the prompt.
     */
    private int maxContextTokens = 2000;

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }

    public double getRelevanceThreshold() {
        return relevanceThreshold;
    }

    public void setRelevanceThreshold(double relevanceThreshold) {
        this.relevanceThreshold = relevanceThreshold;
    }

    public int getMaxContextTokens() {
        return maxContextTokens;
    }

    public void setMaxContextTokens(int maxContextTokens) {
        this.maxContextTokens = maxContextTokens;
    }
}
