package com.phillippitts.selfspy.service.buffer.event;

import java.time.Instant;

/**
 * Published when the buffer starts dropping events at its hard cap.
 *
 * @param droppedTotal events dropped since monitoring started
 */
public record EventsDroppedEvent(int hardCap, long droppedTotal, Instant at) { }
