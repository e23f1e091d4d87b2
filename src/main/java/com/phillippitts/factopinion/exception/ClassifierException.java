package com.phillippitts.factopinion.exception;

/**
 * Thrown when an ensemble member fails or returns an invalid probability vector.
 * Always fatal to the batch: dropping a member would bias the ensemble average.
 */
public class ClassifierException extends FactOpinionException {

    private final String classifierName;

    public ClassifierException(String message) {
        super(message);
        this.classifierName = "unknown";
    }

    public ClassifierException(String message, String classifierName) {
        super(message + " (classifier: " + classifierName + ")");
        this.classifierName = classifierName;
    }

    public ClassifierException(String message, String classifierName, Throwable cause) {
        super(message + " (classifier: " + classifierName + ")", cause);
        this.classifierName = classifierName;
    }

    public String getClassifierName() {
        return classifierName;
    }
}
