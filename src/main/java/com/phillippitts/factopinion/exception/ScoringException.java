package com.phillippitts.factopinion.exception;

/**
 * Thrown by the dispatcher when a batch cannot be scored: a sentence task failed,
 * the batch timed out, or the dispatching thread was interrupted.
 */
public class ScoringException extends FactOpinionException {

    /** Sentence index used when the failure is not tied to one sentence. */
    public static final int NO_SENTENCE = -1;

    private final int sentenceIndex;

    public ScoringException(String message) {
        super(message);
        this.sentenceIndex = NO_SENTENCE;
    }

    public ScoringException(String message, Throwable cause) {
        super(message, cause);
        this.sentenceIndex = NO_SENTENCE;
    }

    public ScoringException(String message, int sentenceIndex, Throwable cause) {
        super(message + " (sentence: " + sentenceIndex + ")", cause);
        this.sentenceIndex = sentenceIndex;
    }

    public int getSentenceIndex() {
        return sentenceIndex;
    }
}
