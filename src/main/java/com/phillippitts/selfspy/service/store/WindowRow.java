package com.phillippitts.selfspy.service.store;

import java.time.Instant;

public record WindowRow(long id, String title, long processId, int pid, int x, int y, int width, int height,
                        Instant firstSeen, Instant lastSeen, long activeMillis, boolean continued) { }
