package com.phillippitts.selfspy.service.store;

import java.time.Instant;

/**
 * Stored keystroke batch. {@code payload} is ciphertext when {@code encrypted} is true.
 *
 * @param windowId null when the owning window could not be resolved
 */
public record KeystrokeRow(long id, Long windowId, String payload, boolean encrypted, String modifiers,
                           int count, Instant recordedAt) {

    /** Same row carrying recovered plaintext. */
    public KeystrokeRow decrypted(String plaintext) {
        return new KeystrokeRow(id, windowId, plaintext, false, modifiers, count, recordedAt);
    }

    /** Same row with the payload blanked, flags unchanged. */
    public KeystrokeRow withoutPayload() {
        return new KeystrokeRow(id, windowId, "", encrypted, modifiers, count, recordedAt);
    }

    @Override
    public String toString() {
        return "KeystrokeRow[id=" + id + ", windowId=" + windowId + ", encrypted=" + encrypted
                + ", count=" + count + ", recordedAt=" + recordedAt + "]";
    }
}
