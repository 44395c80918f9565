package com.phillippitts.selfspy.service.store;

/**
 * Raw totals over a time range.
 *
 * @param keystrokes sum of batch counts, not number of batches
 */
public record ActivityCounts(long keystrokes, long pointerEvents, long clicks, long windows) {

    public static final ActivityCounts ZERO = new ActivityCounts(0, 0, 0, 0);
}
