package ch.so.arp.nexa.chat;

import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for chat requests.
 *
 * @param sessionId optional session the turn is recorded in
 */
public record ChatRequest(@NotBlank String question, String sessionId) {
}
