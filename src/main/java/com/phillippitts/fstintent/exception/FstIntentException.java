package com.phillippitts.fstintent.exception;

/**
 * Base exception for all fst-intent application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class FstIntentException extends RuntimeException {

    public FstIntentException(String message) {
        super(message);
    }

    public FstIntentException(String message, Throwable cause) {
        super(message, cause);
    }

    public FstIntentException(Throwable cause) {
        super(cause);
    }
}
