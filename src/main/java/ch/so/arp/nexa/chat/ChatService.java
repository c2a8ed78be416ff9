package ch.so.arp.nexa.chat;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.nexa.error.ConfigurationException;
import ch.so.arp.nexa.error.RagException;
import ch.so.arp.nexa.llm.Generation;
import ch.so.arp.nexa.llm.ProviderRouter;
import ch.so.arp.nexa.retrieval.Citation;
import ch.so.arp.nexa.retrieval.RetrievalPipeline;
import ch.so.arp.nexa.retrieval.RetrievalResult;
import ch.so.arp.nexa.session.SessionStore;

/**
 * Answers questions from the ingested corpus. Retrieval decides first: when
 * nothing relevant is found the fixed refusal text is returned and no
 * language model is called. Otherwise the context is handed to the
 * {@link ProviderRouter}. Backend failures end in a {@link AnswerStatus#FAILED}
 * answer instead of an exception, so callers can tell a malfunction from a
 * refusal.
 */
public class ChatService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatService.class);

    private final RetrievalPipeline retrievalPipeline;
    private final ProviderRouter providerRouter;
    private final PromptBuilder promptBuilder;
    private final SessionStore sessionStore;
    private final ExecutorService chatExecutor;
    private final String refusalText;

    public ChatService(RetrievalPipeline retrievalPipeline, ProviderRouter providerRouter,
            PromptBuilder promptBuilder, SessionStore sessionStore, ExecutorService chatExecutor,
            String refusalText) {
        this.retrievalPipeline = Objects.requireNonNull(retrievalPipeline, "retrievalPipeline");
        this.providerRouter = Objects.requireNonNull(providerRouter, "providerRouter");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder");
        this.sessionStore = Objects.requireNonNull(sessionStore, "sessionStore");
        this.chatExecutor = Objects.requireNonNull(chatExecutor, "chatExecutor");
        this.refusalText = Objects.requireNonNull(refusalText, "refusalText");
    }

    /**
     * Run {@link #answer(String, String)} on the chat executor. Cancelling the
     * returned future with interruption stops the work at the next stage and
     * aborts a pending language model call; no turn is recorded then.
     */
    public Future<ChatAnswer> submit(String question, String sessionId) {
        return chatExecutor.submit(() -> answer(question, sessionId));
    }

    /**
     * @param sessionId session to record the turn in, {@code null} for none
     * @throws ConfigurationException if the question is blank
     * @throws CancellationException if the calling thread was interrupted
     */
    public ChatAnswer answer(String question, String sessionId) {
        if (question == null || question.isBlank()) {
            throw new ConfigurationException("question must not be blank");
        }
        ChatAnswer answer;
        try {
            RetrievalResult retrieval = retrievalPipeline.retrieve(question);
            checkCancelled();
            if (!retrieval.hasContext()) {
                LOGGER.info("No relevant context for question, refusing");
                answer = ChatAnswer.refused(refusalText);
            } else {
                Generation generation = providerRouter.generate(promptBuilder.build(retrieval, question));
                checkCancelled();
                List<Citation> citations = retrieval.chunks().stream().map(Citation::of).toList();
                answer = ChatAnswer.answered(generation, citations);
                LOGGER.debug("Answered with {} / {} citing {} chunks", generation.provider().id(),
                        generation.model(), citations.size());
            }
        } catch (RagException ex) {
            LOGGER.error("Failed to answer question '{}': {}", question, ex.getMessage(), ex);
            return ChatAnswer.failed(ex.getErrorCode(), ex.getMessage());
        }
        recordTurn(sessionId, question, answer);
        return answer;
    }

    private void recordTurn(String sessionId, String question, ChatAnswer answer) {
        if (sessionId == null || sessionId.isBlank()) {
            return;
        }
        try {
            sessionStore.appendTurn(sessionId, question, answer.answer(), answer.citations());
        } catch (RuntimeException ex) {
            LOGGER.warn("Unable to record turn in session {}: {}", sessionId, ex.getMessage(), ex);
        }
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("chat request cancelled");
        }
    }
}
