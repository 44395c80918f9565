package com.phillippitts.selfspy.service.buffer.event;

import java.time.Instant;

/**
 * Published once per drain cycle when the buffer reaches its soft cap. A flush is
 * forced at the same time.
 */
public record BufferOverflowWarningEvent(int bufferedCount, int softCap, Instant at) { }
