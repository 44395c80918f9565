package com.phillippitts.selfspy.exception;

/**
 * Base exception for all selfspy application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SelfspyException extends RuntimeException {

    public SelfspyException(String message) {
        super(message);
    }

    public SelfspyException(String message, Throwable cause) {
        super(message, cause);
    }

    public SelfspyException(Throwable cause) {
        super(cause);
    }
}
