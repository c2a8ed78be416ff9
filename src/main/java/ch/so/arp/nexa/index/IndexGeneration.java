package ch.so.arp.nexa.index;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Immutable content of the in-memory index. Every write produces a new
 * instance; the previous one stays valid for readers still holding it.
 * <p>
 * Entries are kept in immutable segments, one per write, which later
 * generations share instead of copying. Removal is recorded as a tombstone
 * per document: entries of the document with a sequence below the recorded
 * bound are dead. Live counts are carried along with every write.
 */
final class IndexGeneration {

    private final long generation;
    private final Instant builtAt;
    private final List<List<StoredEntry>> segments;
    private final int size;
    private final Map<String, Long> tombstones;
    private final Map<String, Integer> liveByDocument;
    private final long liveCount;
    private final long nextSequence;

    private IndexGeneration(long generation, Instant builtAt, List<List<StoredEntry>> segments, int size,
            Map<String, Long> tombstones, Map<String, Integer> liveByDocument, long liveCount, long nextSequence) {
        this.generation = generation;
        this.builtAt = builtAt;
        this.segments = Collections.unmodifiableList(segments);
        this.size = size;
        this.tombstones = Collections.unmodifiableMap(tombstones);
        this.liveByDocument = Collections.unmodifiableMap(liveByDocument);
        this.liveCount = liveCount;
        this.nextSequence = nextSequence;
    }

    static IndexGeneration empty(long generation, long nextSequence, Instant builtAt) {
        return new IndexGeneration(generation, builtAt, new ArrayList<>(), 0, new HashMap<>(), new HashMap<>(), 0,
                nextSequence);
    }

    long generation() {
        return generation;
    }

    Instant builtAt() {
        return builtAt;
    }

    long nextSequence() {
        return nextSequence;
    }

    long liveCount() {
        return liveCount;
    }

    /**
     * Number of stored entries, dead ones included.
     */
    int size() {
        return size;
    }

    Stream<StoredEntry> entries() {
        return segments.stream().flatMap(List::stream);
    }

    boolean isLive(StoredEntry stored) {
        Long bound = tombstones.get(stored.entry().documentId());
        return bound == null || stored.sequence() >= bound;
    }

    long liveCount(String documentId) {
        return liveByDocument.getOrDefault(documentId, 0);
    }

    IndexGeneration append(List<VectorEntry> added) {
        List<StoredEntry> segment = new ArrayList<>(added.size());
        Map<String, Integer> live = new HashMap<>(liveByDocument);
        long sequence = nextSequence;
        for (VectorEntry entry : added) {
            segment.add(new StoredEntry(sequence++, entry));
            live.merge(entry.documentId(), 1, Integer::sum);
        }
        List<List<StoredEntry>> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(List.copyOf(segment));
        return new IndexGeneration(generation, builtAt, next, size + segment.size(), new HashMap<>(tombstones), live,
                liveCount + segment.size(), sequence);
    }

    IndexGeneration remove(String documentId) {
        Map<String, Long> nextTombstones = new HashMap<>(tombstones);
        nextTombstones.put(documentId, nextSequence);
        Map<String, Integer> live = new HashMap<>(liveByDocument);
        Integer removed = live.remove(documentId);
        return new IndexGeneration(generation, builtAt, new ArrayList<>(segments), size, nextTombstones, live,
                liveCount - (removed == null ? 0 : removed), nextSequence);
    }

    /**
     * Copy of the live entries without tombstones. Sequence numbers are kept
     * so insertion order survives the rebuild.
     */
    IndexGeneration compact(long newGeneration, Instant newBuiltAt) {
        List<StoredEntry> live = entries().filter(this::isLive).toList();
        return counted(newGeneration, newBuiltAt, live, new HashMap<>(), nextSequence);
    }

    /**
     * Apply to this compacted generation the writes that reached {@code latest}
     * after {@code base} was captured for compaction.
     */
    IndexGeneration replay(IndexGeneration base, IndexGeneration latest) {
        List<StoredEntry> merged = new ArrayList<>(size);
        entries().forEach(merged::add);
        latest.entries()
                .filter(stored -> stored.sequence() >= base.nextSequence)
                .forEach(merged::add);
        Map<String, Long> newTombstones = new HashMap<>();
        latest.tombstones.forEach((documentId, bound) -> {
            if (!bound.equals(base.tombstones.get(documentId))) {
                newTombstones.put(documentId, bound);
            }
        });
        return counted(generation, builtAt, merged, newTombstones, latest.nextSequence);
    }

    private static IndexGeneration counted(long generation, Instant builtAt, List<StoredEntry> entries,
            Map<String, Long> tombstones, long nextSequence) {
        Map<String, Integer> live = new HashMap<>();
        for (StoredEntry stored : entries) {
            Long bound = tombstones.get(stored.entry().documentId());
            if (bound == null || stored.sequence() >= bound) {
                live.merge(stored.entry().documentId(), 1, Integer::sum);
            }
        }
        long liveCount = live.values().stream().mapToLong(Integer::longValue).sum();
        List<List<StoredEntry>> segments = new ArrayList<>();
        if (!entries.isEmpty()) {
            segments.add(List.copyOf(entries));
        }
        return new IndexGeneration(generation, builtAt, segments, entries.size(), tombstones, live, liveCount,
                nextSequence);
    }

    record StoredEntry(long sequence, VectorEntry entry) {
    }
}
