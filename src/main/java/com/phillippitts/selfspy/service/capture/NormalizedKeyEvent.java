package com.phillippitts.selfspy.service.capture;

import java.util.Locale;
import java.util.Set;

/**
 * Keyboard input normalized away from the native hook library.
 *
 * @param text text the key produced: the typed character, or a bracketed name such as
 *             {@code <[Enter]>} for special keys and shortcuts
 * @param modifiers canonical upper-case modifier names held at the time
 */
public record NormalizedKeyEvent(String text, Set<String> modifiers, long whenMillis) {

    public NormalizedKeyEvent {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("text must not be empty");
        }
        modifiers = modifiers == null ? Set.of()
                : Set.copyOf(modifiers.stream().map(m -> m.toUpperCase(Locale.ROOT)).toList());
    }

    @Override
    public String toString() {
        return "NormalizedKeyEvent[modifiers=" + modifiers + ", whenMillis=" + whenMillis + "]";
    }
}
