package ch.so.arp.nexa.session;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.nexa.retrieval.Citation;

/**
 * {@link SessionStore} keeping all sessions in memory. History is lost on
 * restart.
 */
public class InMemorySessionStore implements SessionStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemorySessionStore.class);

    private static final int TITLE_LENGTH = 60;

    private final Map<String, List<SessionTurn>> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySessionStore() {
        this(Clock.systemUTC());
    }

    InMemorySessionStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void appendTurn(String sessionId, String query, String answer, List<Citation> citations) {
        Objects.requireNonNull(sessionId, "sessionId");
        SessionTurn turn = new SessionTurn(query, answer, citations, clock.instant());
        sessions.compute(sessionId, (id, turns) -> {
            List<SessionTurn> next = turns == null ? new ArrayList<>() : new ArrayList<>(turns);
            next.add(turn);
            return List.copyOf(next);
        });
        LOGGER.debug("Appended turn to session {}", sessionId);
    }

    @Override
    public Optional<Session> get(String sessionId) {
        List<SessionTurn> turns = sessions.get(sessionId);
        return turns == null ? Optional.empty() : Optional.of(new Session(sessionId, turns));
    }

    @Override
    public List<SessionSummary> listSessions() {
        List<SessionSummary> summaries = new ArrayList<>();
        sessions.forEach((id, turns) -> summaries.add(summarize(id, turns)));
        summaries.sort(Comparator.comparing(SessionSummary::updatedAt).reversed()
                .thenComparing(SessionSummary::id));
        return summaries;
    }

    @Override
    public boolean delete(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    @Override
    public void clearAll() {
        sessions.clear();
    }

    private static SessionSummary summarize(String id, List<SessionTurn> turns) {
        SessionTurn first = turns.get(0);
        SessionTurn last = turns.get(turns.size() - 1);
        String title = first.query().strip();
        if (title.length() > TITLE_LENGTH) {
            title = title.substring(0, TITLE_LENGTH - 3) + "...";
        }
        return new SessionSummary(id, title, turns.size(), first.timestamp(), last.timestamp());
    }
}
