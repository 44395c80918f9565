package com.phillippitts.selfspy.service.store;

/**
 * Aggregated foreground time for one application name.
 */
public record AppDurationRow(String name, long durationMillis, long windowCount, long eventCount) { }
