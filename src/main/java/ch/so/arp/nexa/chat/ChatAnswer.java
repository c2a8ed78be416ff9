package ch.so.arp.nexa.chat;

import java.util.List;

import ch.so.arp.nexa.error.ErrorCode;
import ch.so.arp.nexa.llm.Generation;
import ch.so.arp.nexa.retrieval.Citation;

/**
 * Result of a question, whatever the outcome. Provider and model are only set
 * for {@link AnswerStatus#ANSWERED}, error code and reason only for
 * {@link AnswerStatus#FAILED}.
 *
 * @param sources distinct file names of the cited chunks, best first
 */
public record ChatAnswer(
        AnswerStatus status,
        String answer,
        List<Citation> citations,
        List<String> sources,
        String provider,
        String model,
        String errorCode,
        String failureReason) {

    public ChatAnswer {
        citations = List.copyOf(citations);
        sources = List.copyOf(sources);
    }

    static ChatAnswer answered(Generation generation, List<Citation> citations) {
        List<String> sources = citations.stream().map(Citation::source).distinct().toList();
        return new ChatAnswer(AnswerStatus.ANSWERED, generation.text(), citations, sources,
                generation.provider().id(), generation.model(), null, null);
    }

    static ChatAnswer refused(String refusalText) {
        return new ChatAnswer(AnswerStatus.REFUSED, refusalText, List.of(), List.of(), null, null, null, null);
    }

    static ChatAnswer failed(ErrorCode errorCode, String reason) {
        return new ChatAnswer(AnswerStatus.FAILED, "", List.of(), List.of(), null, null, errorCode.code(), reason);
    }
}
