package ch.so.arp.nexa.ingest;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Chunking settings for document ingestion.
 */
@ConfigurationProperties(prefix = "rag.ingest")
public class IngestionProperties {

    /**
     * Words per chunk.
     */
    private int chunkSize = 400;

    /**
     * Words shared by consecutive chunks. Must be smaller than the chunk size.
     */
    private int chunkOverlap = 80;

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }

    public void setChunkOverlap(int chunkOverlap) {
        this.chunkOverlap = chunkOverlap;
    }
}
