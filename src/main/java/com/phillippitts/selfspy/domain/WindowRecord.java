package com.phillippitts.selfspy.domain;

import java.time.Instant;

/**
 * Closed window observation emitted by the deduplicator when the buffer drains.
 *
 * @param activeMillis time this window spent as the current foreground window
 * @param continued    the window was already in the foreground when the previous buffer drained,
 *                     so this record continues an earlier one rather than marking a window change
 */
public record WindowRecord(WindowKey key, String bundleId, int x, int y, int width, int height,
                           Instant firstSeen, Instant lastSeen, long activeMillis, boolean continued) {

    public WindowRecord(WindowKey key, String bundleId, int x, int y, int width, int height,
                        Instant firstSeen, Instant lastSeen, long activeMillis) {
        this(key, bundleId, x, y, width, height, firstSeen, lastSeen, activeMillis, false);
    }
}
