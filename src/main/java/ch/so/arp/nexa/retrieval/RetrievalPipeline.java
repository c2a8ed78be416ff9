package ch.so.arp.nexa.retrieval;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.nexa.embedding.EmbeddingService;
import ch.so.arp.nexa.error.ConfigurationException;
import ch.so.arp.nexa.index.VectorIndex;

/**
 * Finds the context for a question: embed it, search the index, keep the hits
 * at or above the relevance threshold and assemble them into a bounded
 * context block.
 */
public class RetrievalPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetrievalPipeline.class);

    private final EmbeddingService embeddingService;
    private final VectorIndex vectorIndex;
    private final ContextAssembler contextAssembler;
    private final AtomicReference<RetrievalSettings> settings;

    public RetrievalPipeline(EmbeddingService embeddingService, VectorIndex vectorIndex,
            ContextAssembler contextAssembler, int defaultTopK, double defaultThreshold) {
        this.settings = new AtomicReference<>(new RetrievalSettings(defaultTopK, defaultThreshold));
        this.embeddingService = Objects.requireNonNull(embeddingService, "embeddingService");
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
        this.contextAssembler = Objects.requireNonNull(contextAssembler, "contextAssembler");
    }

    /**
     * Retrieve with the current settings.
     */
    public RetrievalResult retrieve(String query) {
        return retrieve(query, settings.get());
    }

    public RetrievalSettings settings() {
        return settings.get();
    }

    /**
     * Change the settings used by later {@link #retrieve(String)} calls.
     * Retrievals already running keep the settings they started with.
     *
     * @throws ConfigurationException if the result would be invalid; the
     *         current settings are kept then
     */
    public RetrievalSettings updateSettings(RetrievalSettings.Update update) {
        Objects.requireNonNull(update, "update");
        RetrievalSettings updated = settings.updateAndGet(current -> current.merge(update));
        LOGGER.info("Retrieval settings updated: top-k {}, relevance threshold {}", updated.topK(),
                updated.relevanceThreshold());
        return updated;
    }

    /**
     * @param k                  maximum number of hits to consider, positive
     * @param relevanceThreshold minimum cosine similarity, within [-1, 1]
     * @throws ch.so.arp.nexa.error.EmbeddingUnavailableException if the query
     *         cannot be embedded
     * @throws ch.so.arp.nexa.error.IndexIncompatibleException if the query
     *         vector does not fit the index
     */
    public RetrievalResult retrieve(String query, int k, double relevanceThreshold) {
        return retrieve(query, new RetrievalSettings(k, relevanceThreshold));
    }

    private RetrievalResult retrieve(String query, RetrievalSettings tuning) {
        if (query == null || query.isBlank()) {
            throw new ConfigurationException("query must not be blank");
        }
        double relevanceThreshold = tuning.relevanceThreshold();
        float[] vector = embeddingService.embed(query);
        List<RankedChunk> relevant = vectorIndex.search(vector, tuning.topK()).stream()
                .filter(hit -> hit.score() >= relevanceThreshold)
                .map(hit -> new RankedChunk(hit.chunk(), hit.score()))
                .toList();
        if (relevant.isEmpty()) {
            LOGGER.debug("No chunk reached the relevance threshold {}", relevanceThreshold);
            return RetrievalResult.noRelevantContext();
        }
        ContextAssembler.Assembly assembly = contextAssembler.assemble(relevant);
        if (assembly.included().isEmpty()) {
            LOGGER.warn("None of {} relevant chunks fits the context budget of {} tokens", relevant.size(),
                    contextAssembler.getMaxTokens());
            return RetrievalResult.noRelevantContext();
        }
        LOGGER.debug("Retrieved {} relevant chunks, {} used in context (best score {})", relevant.size(),
                assembly.included().size(), relevant.get(0).score());
        return RetrievalResult.contextFound(assembly.included(), assembly.context());
    }
}
