package com.phillippitts.selfspy.domain;

import java.time.Instant;
import java.util.List;

/**
 * Read-only aggregate over a day-count window. Never persisted.
 */
public record ActivityStats(long keystrokes,
                            long pointerEvents,
                            long clicks,
                            long windowChanges,
                            long activeSeconds,
                            List<AppUsage> topApps,
                            Instant rangeStart,
                            Instant rangeEnd) {

    public ActivityStats {
        topApps = List.copyOf(topApps);
    }

    public static ActivityStats empty(Instant rangeStart, Instant rangeEnd) {
        return new ActivityStats(0, 0, 0, 0, 0, List.of(), rangeStart, rangeEnd);
    }
}
