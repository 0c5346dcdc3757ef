package com.phillippitts.syd.exception;

/**
 * Base exception for all syd application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SydException extends RuntimeException {

    public SydException(String message) {
        super(message);
    }

    public SydException(String message, Throwable cause) {
        super(message, cause);
    }

    public SydException(Throwable cause) {
        super(cause);
    }
}
