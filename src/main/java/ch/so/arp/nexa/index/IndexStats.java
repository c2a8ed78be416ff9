package ch.so.arp.nexa.index;

import java.time.Instant;

/**
 * Summary of the currently published index generation.
 *
 * @param backend    name of the index implementation
 * @param entryCount number of live entries, removed ones excluded
 * @param dimension  vector length of the index
 * @param generation build number, incremented by every rebuild and clear
 * @param builtAt    when the generation was published
 */
public record IndexStats(String backend, long entryCount, int dimension, long generation, Instant builtAt) {
}
