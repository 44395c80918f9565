package com.phillippitts.selfspy.exception;

import java.time.Instant;

/**
 * Thrown when a drained snapshot could not be persisted after all retry attempts.
 * The snapshot has been discarded; the fields describe what was lost.
 */
public class FlushException extends SelfspyException {

    private final int recordCount;
    private final int attempts;
    private final Instant earliest;
    private final Instant latest;

    public FlushException(String message, int recordCount, int attempts,
                          Instant earliest, Instant latest, Throwable cause) {
        super(message + " (records: " + recordCount + ", attempts: " + attempts
                + ", range: " + earliest + " .. " + latest + ")", cause);
        this.recordCount = recordCount;
        this.attempts = attempts;
        this.earliest = earliest;
        this.latest = latest;
    }

    public int getRecordCount() {
        return recordCount;
    }

    public int getAttempts() {
        return attempts;
    }

    public Instant getEarliest() {
        return earliest;
    }

    public Instant getLatest() {
        return latest;
    }
}
