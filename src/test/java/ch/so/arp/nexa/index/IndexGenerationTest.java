package ch.so.arp.nexa.index;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import ch.so.arp.nexa.index.IndexGeneration.StoredEntry;
import ch.so.arp.nexa.ingest.Chunk;

class IndexGenerationTest {

    @Test
    void appendLeavesEarlierGenerationUntouched() {
        IndexGeneration empty = IndexGeneration.empty(1, 0, Instant.EPOCH);
        IndexGeneration first = empty.append(List.of(entry("a", 0), entry("a", 1)));
        IndexGeneration second = first.append(List.of(entry("b", 0)));

        assertThat(first.size()).isEqualTo(2);
        assertThat(first.liveCount()).isEqualTo(2);
        assertThat(first.liveCount("b")).isZero();
        assertThat(second.entries()).extracting(StoredEntry::sequence).containsExactly(0L, 1L, 2L);
        assertThat(second.liveCount()).isEqualTo(3);
        assertThat(second.nextSequence()).isEqualTo(3);
    }

    @Test
    void removeKeepsEntriesStoredButCountsThemDead() {
        IndexGeneration generation = IndexGeneration.empty(1, 0, Instant.EPOCH)
                .append(List.of(entry("a", 0), entry("b", 0), entry("b", 1)))
                .remove("b");

        assertThat(generation.size()).isEqualTo(3);
        assertThat(generation.liveCount()).isEqualTo(1);
        assertThat(generation.liveCount("b")).isZero();
        assertThat(generation.entries().filter(generation::isLive))
                .extracting(stored -> stored.entry().documentId())
                .containsExactly("a");

        IndexGeneration readded = generation.append(List.of(entry("b", 0)));
        assertThat(readded.liveCount("b")).isEqualTo(1);
        assertThat(readded.liveCount()).isEqualTo(2);
    }

    @Test
    void compactDropsDeadEntriesAndKeepsSequences() {
        IndexGeneration generation = IndexGeneration.empty(1, 0, Instant.EPOCH)
                .append(List.of(entry("a", 0)))
                .append(List.of(entry("b", 0)))
                .append(List.of(entry("c", 0)))
                .remove("b");

        IndexGeneration compacted = generation.compact(2, Instant.EPOCH);

        assertThat(compacted.generation()).isEqualTo(2);
        assertThat(compacted.size()).isEqualTo(2);
        assertThat(compacted.liveCount()).isEqualTo(2);
        assertThat(compacted.entries()).extracting(StoredEntry::sequence).containsExactly(0L, 2L);
        assertThat(compacted.nextSequence()).isEqualTo(3);
    }

    private static VectorEntry entry(String documentId, int ordinal) {
        Chunk chunk = new Chunk(Chunk.idFor(documentId, ordinal), documentId, documentId + ".txt", ordinal,
                "text of " + documentId, 0, 10);
        return VectorEntry.of(chunk, new float[] { 1.0f, 0.0f });
    }
}
