package com.phillippitts.selfspy.service.store;

import java.time.Duration;
import java.time.Instant;

/**
 * Write side of the activity store. Only the flush coordinator calls it, from a single thread.
 */
public interface ActivityWriter {

    /**
     * Persists a snapshot in one transaction: processes, then windows, then keystrokes and
     * pointer events with resolved window references. Either every row is committed or none.
     *
     * @param timeout bound on the whole transaction
     * @return number of rows inserted, processes excluded
     * @throws org.springframework.dao.DataAccessException if the transaction failed and was rolled back
     */
    int persist(PreparedSnapshot snapshot, Duration timeout);

    /**
     * @return id of the new session
     */
    long openSession(Instant start);

    /** Advances the end of a still-running session. */
    void touchSession(long sessionId, Instant end);

    void closeSession(long sessionId, Instant end);

    /**
     * Cheap reachability probe; never throws.
     */
    boolean isAvailable();
}
