package ch.so.arp.nexa.ingest;

import java.time.Instant;
import java.util.List;

/**
 * One ingested version of a source file. Immutable apart from the tombstone
 * produced by {@link #withDeleted()}.
 *
 * @param tags free-form labels given at ingestion, never {@code null}
 */
public record Document(
        String id,
        String source,
        String version,
        List<String> tags,
        Instant ingestedAt,
        String checksum,
        boolean deleted) {

    public Document {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public Document withDeleted() {
        return new Document(id, source, version, tags, ingestedAt, checksum, true);
    }
}
