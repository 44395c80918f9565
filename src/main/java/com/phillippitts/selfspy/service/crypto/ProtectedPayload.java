package com.phillippitts.selfspy.service.crypto;

/**
 * Keystroke text in its persisted form.
 *
 * @param encrypted true only when {@code payload} is codec output
 */
public record ProtectedPayload(String payload, boolean encrypted) {

    @Override
    public String toString() {
        return "ProtectedPayload[encrypted=" + encrypted + ", length=" + payload.length() + "]";
    }
}
