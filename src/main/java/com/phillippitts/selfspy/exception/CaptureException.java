package com.phillippitts.selfspy.exception;

/**
 * Thrown when a capture source cannot be started, typically because the OS denied
 * input-monitoring or accessibility permission.
 */
public class CaptureException extends SelfspyException {

    private final String source;

    public CaptureException(String source, String message) {
        super(message + " (source: " + source + ")");
        this.source = source;
    }

    public CaptureException(String source, String message, Throwable cause) {
        super(message + " (source: " + source + ")", cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
