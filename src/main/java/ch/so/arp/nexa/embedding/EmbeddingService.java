package ch.so.arp.nexa.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.nexa.error.EmbeddingUnavailableException;
import ch.so.arp.nexa.error.IndexIncompatibleException;

/**
 * Front door to the active {@link EmbeddingProvider}. Splits large inputs
 * into batches and guarantees that every returned vector matches the
 * dimension of the vector index it is going to be used with.
 */
public class EmbeddingService {

    private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingProvider provider;
    private final int batchSize;
    private final IntSupplier indexDimension;

    public EmbeddingService(EmbeddingProvider provider, int batchSize, IntSupplier indexDimension) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.provider = Objects.requireNonNull(provider, "provider");
        this.batchSize = batchSize;
        this.indexDimension = Objects.requireNonNull(indexDimension, "indexDimension");
    }

    public float[] embed(String text) {
        return checked(provider.embed(text));
    }

    public List<float[]> embedBatch(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            List<String> batch = texts.subList(from, Math.min(from + batchSize, texts.size()));
            List<float[]> embedded = provider.embedBatch(batch);
            if (embedded.size() != batch.size()) {
                throw new EmbeddingUnavailableException("Embedding provider returned " + embedded.size()
                        + " vectors for " + batch.size() + " texts", null);
            }
            embedded.forEach(vector -> vectors.add(checked(vector)));
        }
        LOGGER.debug("Embedded {} texts in batches of {}", texts.size(), batchSize);
        return vectors;
    }

    public int dimension() {
        return provider.dimension();
    }

    private float[] checked(float[] vector) {
        int expected = indexDimension.getAsInt();
        if (vector.length != expected) {
            throw new IndexIncompatibleException(expected, vector.length);
        }
        return vector;
    }
}
