package com.phillippitts.factopinion.exception;

/**
 * Thrown when the text submitted for classification is null, empty or blank.
 * Raised before any sentence reaches the annotator or the classifier ensemble.
 */
public class InvalidInputException extends FactOpinionException {

    private final String reason;

    public InvalidInputException(String reason) {
        super("Invalid input text: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
