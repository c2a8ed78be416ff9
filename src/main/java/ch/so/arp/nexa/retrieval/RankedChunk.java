package ch.so.arp.nexa.retrieval;

import ch.so.arp.nexa.ingest.Chunk;

public record RankedChunk(Chunk chunk, double score) {
}
