package com.phillippitts.selfspy.util;

import java.time.Instant;

/**
 * Interval arithmetic over {@link Instant} ranges.
 *
 * @since 1.0
 */
public final class TimeUtils {

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Length in milliseconds of the overlap of {@code [start, end)} with
     * {@code [windowStart, windowEnd)}; zero when they do not intersect.
     *
     * @param end interval end, or {@code null} for an interval still open at {@code windowEnd}
     */
    public static long overlapMillis(Instant start, Instant end, Instant windowStart, Instant windowEnd) {
        Instant effectiveEnd = end == null ? windowEnd : end;
        Instant from = start.isAfter(windowStart) ? start : windowStart;
        Instant to = effectiveEnd.isBefore(windowEnd) ? effectiveEnd : windowEnd;
        long millis = to.toEpochMilli() - from.toEpochMilli();
        return Math.max(0, millis);
    }
}
