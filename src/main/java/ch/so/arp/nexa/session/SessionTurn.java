package ch.so.arp.nexa.session;

import java.time.Instant;
import java.util.List;

import ch.so.arp.nexa.retrieval.Citation;

public record SessionTurn(String query, String answer, List<Citation> citations, Instant timestamp) {

    public SessionTurn {
        citations = List.copyOf(citations);
    }
}
