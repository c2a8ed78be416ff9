package ch.so.arp.nexa.ingest;

import java.util.List;

import jakarta.validation.constraints.NotEmpty;

/**
 * Incoming payload for ingestion requests. Paths are resolved on the server,
 * tags are optional labels stored with every ingested document.
 */
public record IngestRequest(@NotEmpty List<String> paths, String version, List<String> tags) {
}
