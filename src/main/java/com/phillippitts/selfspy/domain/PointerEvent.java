package com.phillippitts.selfspy.domain;

import java.time.Instant;

/**
 * Normalized pointer action (click, move or scroll).
 */
public record PointerEvent(int x, int y, String button, PointerEventType type,
                           WindowKey windowKey, Instant timestamp) {

    public PointerEvent {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        button = button == null ? "" : button;
    }
}
