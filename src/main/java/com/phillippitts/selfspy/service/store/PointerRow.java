package com.phillippitts.selfspy.service.store;

import java.time.Instant;

public record PointerRow(long id, Long windowId, int x, int y, String button, String eventType,
                         Instant recordedAt) { }
