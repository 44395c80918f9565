package com.phillippitts.selfspy.service.capture;

import com.phillippitts.selfspy.domain.PointerEventType;

/**
 * Pointer input normalized away from the native hook library.
 *
 * @param button canonical button name ({@code LEFT}, {@code RIGHT}, {@code MIDDLE},
 *               {@code WHEEL_UP}, {@code WHEEL_DOWN}) or empty for moves
 */
public record NormalizedPointerEvent(PointerEventType type, int x, int y, String button, long whenMillis) {

    public NormalizedPointerEvent {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        button = button == null ? "" : button;
    }
}
