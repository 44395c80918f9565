package com.phillippitts.selfspy.domain;

import java.time.Instant;
import java.util.Set;

/**
 * Normalized keystroke observation as delivered by a keyboard source.
 *
 * @param text typed text (may be empty when text capture is disabled)
 * @param modifiers active modifier names (upper-case)
 * @param windowKey window the keystroke belongs to, or {@code null} if unknown
 * @param timestamp when the keystroke happened
 */
public record KeystrokeEvent(String text, Set<String> modifiers, WindowKey windowKey, Instant timestamp) {

    public KeystrokeEvent {
        text = text == null ? "" : text;
        modifiers = modifiers == null ? Set.of() : Set.copyOf(modifiers);
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
    }
}
