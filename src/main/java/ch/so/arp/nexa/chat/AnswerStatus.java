package ch.so.arp.nexa.chat;

/**
 * How a question was handled.
 */
public enum AnswerStatus {

    /** Context was found and the language model produced an answer. */
    ANSWERED,

    /** Nothing in the corpus was relevant; the fixed refusal text was returned. */
    REFUSED,

    /** Retrieval or generation broke down; the answer carries the reason. */
    FAILED
}
