package ch.so.arp.nexa.session;

import java.time.Instant;

/**
 * Overview entry of a session for listings.
 *
 * @param title first question of the session, shortened
 */
public record SessionSummary(String id, String title, int turnCount, Instant createdAt, Instant updatedAt) {
}
