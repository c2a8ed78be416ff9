package ch.so.arp.nexa.index;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.nexa.error.ConfigurationException;
import ch.so.arp.nexa.error.IndexIncompatibleException;

/**
 * Flat in-process {@link VectorIndex}. The content lives in an immutable
 * {@link IndexGeneration} behind an atomic reference, so searches never lock
 * and always run against a single generation. Rebuild and clear are
 * serialized with each other; a rebuild compacts a captured generation off to
 * the side and replays concurrent writes while publishing the result.
 */
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    static final String BACKEND = "in-memory";

    private final int dimension;
    private final Clock clock;
    private final AtomicReference<IndexGeneration> current;
    private final ReentrantLock rebuildLock = new ReentrantLock();

    public InMemoryVectorIndex(int dimension) {
        this(dimension, Clock.systemUTC());
    }

    InMemoryVectorIndex(int dimension, Clock clock) {
        if (dimension <= 0) {
            throw new ConfigurationException("index dimension must be positive, was " + dimension);
        }
        this.dimension = dimension;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.current = new AtomicReference<>(IndexGeneration.empty(0, 0, clock.instant()));
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public void add(List<VectorEntry> entries) {
        for (VectorEntry entry : entries) {
            requireDimension(entry.vector());
        }
        if (entries.isEmpty()) {
            return;
        }
        List<VectorEntry> copy = List.copyOf(entries);
        current.updateAndGet(generation -> generation.append(copy));
        LOGGER.debug("Added {} entries", copy.size());
    }

    @Override
    public List<SearchHit> search(float[] query, int k) {
        requireDimension(query);
        if (k <= 0) {
            return List.of();
        }
        IndexGeneration snapshot = current.get();
        double queryNorm = VectorEntry.norm(query);
        return snapshot.entries()
                .filter(snapshot::isLive)
                .map(stored -> new ScoredEntry(stored, cosine(query, queryNorm, stored.entry())))
                .sorted(Comparator.comparingDouble(ScoredEntry::score).reversed()
                        .thenComparingLong(scored -> scored.stored().sequence()))
                .limit(k)
                .map(scored -> new SearchHit(scored.stored().entry().chunk(), scored.score()))
                .toList();
    }

    @Override
    public int remove(String documentId) {
        IndexGeneration before = current.getAndUpdate(generation -> generation.liveCount(documentId) == 0
                ? generation
                : generation.remove(documentId));
        int removed = (int) before.liveCount(documentId);
        if (removed > 0) {
            LOGGER.debug("Removed {} entries of document {}", removed, documentId);
        }
        return removed;
    }

    @Override
    public IndexStats rebuild() {
        rebuildLock.lock();
        try {
            IndexGeneration base = current.get();
            IndexGeneration compacted = base.compact(base.generation() + 1, clock.instant());
            IndexGeneration published = current.updateAndGet(latest -> compacted.replay(base, latest));
            LOGGER.info("Published index generation {} with {} live entries ({} dropped)",
                    published.generation(), published.liveCount(),
                    base.size() - compacted.size());
            return toStats(published);
        } finally {
            rebuildLock.unlock();
        }
    }

    @Override
    public void clear() {
        rebuildLock.lock();
        try {
            IndexGeneration published = current.updateAndGet(latest -> IndexGeneration.empty(
                    latest.generation() + 1, latest.nextSequence(), clock.instant()));
            LOGGER.info("Cleared index, now at generation {}", published.generation());
        } finally {
            rebuildLock.unlock();
        }
    }

    @Override
    public IndexStats stats() {
        return toStats(current.get());
    }

    private IndexStats toStats(IndexGeneration generation) {
        return new IndexStats(BACKEND, generation.liveCount(), dimension, generation.generation(),
                generation.builtAt());
    }

    private void requireDimension(float[] vector) {
        if (vector.length != dimension) {
            throw new IndexIncompatibleException(dimension, vector.length);
        }
    }

    private static double cosine(float[] query, double queryNorm, VectorEntry entry) {
        if (queryNorm == 0.0d || entry.norm() == 0.0d) {
            return 0.0d;
        }
        float[] vector = entry.vector();
        double dot = 0.0d;
        for (int i = 0; i < vector.length; i++) {
            dot += (double) query[i] * vector[i];
        }
        double score = dot / (queryNorm * entry.norm());
        return Math.max(-1.0d, Math.min(1.0d, score));
    }

    private record ScoredEntry(IndexGeneration.StoredEntry stored, double score) {
    }
}
