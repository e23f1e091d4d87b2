package com.phillippitts.factopinion.exception;

/**
 * Thrown when the dependency annotator cannot process a sentence
 * (unreachable server, malformed encoding, unparseable CoNLL-U output).
 */
public class AnnotationException extends FactOpinionException {

    public AnnotationException(String message) {
        super(message);
    }

    public AnnotationException(String message, Throwable cause) {
        super(message, cause);
    }
}
