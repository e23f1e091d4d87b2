package com.phillippitts.factopinion.exception;

/**
 * Base exception for all fact-opinion application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class FactOpinionException extends RuntimeException {

    public FactOpinionException(String message) {
        super(message);
    }

    public FactOpinionException(String message, Throwable cause) {
        super(message, cause);
    }

    public FactOpinionException(Throwable cause) {
        super(cause);
    }
}
