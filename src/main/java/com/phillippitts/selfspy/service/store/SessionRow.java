package com.phillippitts.selfspy.service.store;

import java.time.Instant;

/**
 * @param endTime null while the session is running
 */
public record SessionRow(long id, Instant startTime, Instant endTime) { }
