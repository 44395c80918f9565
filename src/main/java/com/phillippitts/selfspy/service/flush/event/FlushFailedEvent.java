package com.phillippitts.selfspy.service.flush.event;

import java.time.Instant;

/**
 * Published when a drained snapshot is discarded after exhausting all attempts.
 * Carries only sizes and timestamps, never record content.
 *
 * @param earliest earliest record timestamp in the lost snapshot, or null if unknown
 * @param latest latest record timestamp in the lost snapshot, or null if unknown
 * @param reason simple class name of the last failure
 */
public record FlushFailedEvent(int recordCount, int attempts, Instant earliest, Instant latest,
                               String reason, Instant at) { }
