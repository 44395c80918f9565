package com.phillippitts.selfspy.domain;

import java.time.Instant;
import java.util.Set;

/**
 * Consecutive keystrokes for one window and modifier set, still in plaintext.
 * Text only ever leaves the process through {@code KeystrokeProtector}.
 *
 * @param recordedAt timestamp of the first keystroke in the batch
 */
public record KeystrokeBatch(String text, Set<String> modifiers, int count,
                             WindowKey windowKey, Instant recordedAt) {

    public KeystrokeBatch {
        modifiers = Set.copyOf(modifiers);
    }

    @Override
    public String toString() {
        // never print the text
        return "KeystrokeBatch[count=" + count + ", modifiers=" + modifiers
                + ", window=" + windowKey + ", recordedAt=" + recordedAt + "]";
    }
}
