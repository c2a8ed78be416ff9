package ch.so.arp.nexa.embedding;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic embedding provider based on feature hashing. Every word token
 * (lower-cased, stop words removed) is mapped to a bucket and a sign derived
 * from its SHA-256 digest; the resulting term-frequency vector is normalized.
 * Texts sharing vocabulary therefore get a positive cosine similarity, which
 * lets the application answer questions without an external embedding model.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(HashingEmbeddingProvider.class);

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "is", "are", "was", "were", "be", "been", "to", "of", "and", "or", "in", "on",
            "at", "by", "for", "with", "how", "what", "when", "where", "who", "why", "which", "do", "does",
            "did", "i", "you", "we", "it", "this", "that", "my", "your", "can", "could", "should", "would",
            "will", "me", "about", "from", "as", "if", "not", "no", "so", "then", "there", "their", "they",
            "he", "she", "his", "her", "its", "our", "has", "have", "had", "any", "some", "into", "than");

    private final int dimensions;

    public HashingEmbeddingProvider(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
        LOGGER.info("Using hashing embeddings with {} dimensions", dimensions);
    }

    @Override
    public int dimension() {
        return dimensions;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimensions];
        String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT);
        for (String token : normalized.split("[^\\p{L}\\p{Nd}]+")) {
            if (token.length() < 2 || STOP_WORDS.contains(token)) {
                continue;
            }
            byte[] digest = sha256(token);
            int bucket = Math.floorMod(bytesToInt(digest), dimensions);
            float sign = (digest[4] & 0x01) == 0 ? 1.0f : -1.0f;
            vector[bucket] += sign;
        }
        double norm = 0.0d;
        for (float value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        if (norm > 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] = (float) (vector[i] / norm);
            }
        }
        return vector;
    }

    private byte[] sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }

    private int bytesToInt(byte[] bytes) {
        int result = 0;
        for (int i = 0; i < 4; i++) {
            result = (result << 8) | (bytes[i] & 0xFF);
        }
        return result;
    }
}
