package com.phillippitts.selfspy.domain;

import java.time.Instant;

/**
 * Point-in-time copy of the engine's live session counters.
 */
public record LiveCounters(long keystrokes, long clicks, long windows, long dropped, Instant lastActivity) {
}
