package ch.so.arp.nexa.session;

import java.util.List;
import java.util.Optional;

import ch.so.arp.nexa.retrieval.Citation;

/**
 * Key-value storage of conversation history. Turns of one session keep the
 * order they were appended in.
 */
public interface SessionStore {

    void appendTurn(String sessionId, String query, String answer, List<Citation> citations);

    Optional<Session> get(String sessionId);

    /**
     * Summaries of all sessions, most recently updated first.
     */
    List<SessionSummary> listSessions();

    /**
     * @return {@code false} if the session did not exist
     */
    boolean delete(String sessionId);

    void clearAll();
}
