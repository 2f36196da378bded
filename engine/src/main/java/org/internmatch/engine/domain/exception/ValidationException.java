package org.internmatch.engine.domain.exception;

/**
 * Raised when a candidate, internship, weight vector or request is malformed.
 * Always thrown before any scoring runs.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
