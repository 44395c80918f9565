package com.phillippitts.selfspy.service.flush.event;

import java.time.Instant;

/**
 * Published when a flush is skipped because the store cannot be reached.
 * The buffer is left intact.
 */
public record StoreUnavailableEvent(int bufferedCount, Instant at) { }
