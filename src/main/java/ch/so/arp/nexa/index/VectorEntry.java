package ch.so.arp.nexa.index;

import java.util.Objects;

import ch.so.arp.nexa.ingest.Chunk;

/**
 * Embedding of one chunk together with its cached L2 norm.
 */
public record VectorEntry(Chunk chunk, float[] vector, double norm) {

    public VectorEntry {
        Objects.requireNonNull(chunk, "chunk");
        Objects.requireNonNull(vector, "vector");
    }

    public static VectorEntry of(Chunk chunk, float[] vector) {
        return new VectorEntry(chunk, vector, norm(vector));
    }

    public String documentId() {
        return chunk.documentId();
    }

    static double norm(float[] vector) {
        double sum = 0.0d;
        for (float value : vector) {
            sum += (double) value * value;
        }
        return Math.sqrt(sum);
    }
}
