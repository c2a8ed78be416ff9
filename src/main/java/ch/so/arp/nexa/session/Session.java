package ch.so.arp.nexa.session;

import java.util.List;

/**
 * Conversation history of one session, oldest turn first.
 */
public record Session(String id, List<SessionTurn> turns) {

    public Session {
        turns = List.copyOf(turns);
    }
}
