package com.phillippitts.selfspy.domain;

import java.util.Locale;

/**
 * Usage of one application within a stats window.
 *
 * @param durationMillis exact foreground time
 * @param percentage exact share of total tracked time (0..100); round only for display
 */
public record AppUsage(String name, long durationMillis, long windowCount, long eventCount, double percentage) {

    /** Percentage rounded to one decimal, e.g. {@code "42.9"}. */
    public String formattedPercentage() {
        return String.format(Locale.ROOT, "%.1f", percentage);
    }
}
