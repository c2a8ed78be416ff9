package ch.so.arp.nexa.index;

import ch.so.arp.nexa.ingest.Chunk;

public record SearchHit(Chunk chunk, double score) {
}
