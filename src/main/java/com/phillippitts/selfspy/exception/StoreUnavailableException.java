package com.phillippitts.selfspy.exception;

/**
 * Thrown when the activity store cannot be reached at all (missing file, locked
 * database, connection pool exhausted).
 */
public class StoreUnavailableException extends SelfspyException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
