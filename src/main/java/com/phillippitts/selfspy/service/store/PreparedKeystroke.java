package com.phillippitts.selfspy.service.store;

import com.phillippitts.selfspy.domain.WindowKey;
import com.phillippitts.selfspy.service.crypto.ProtectedPayload;

import java.time.Instant;
import java.util.Set;

/**
 * Keystroke batch in its persisted form: payload already encrypted when encryption is on.
 */
public record PreparedKeystroke(ProtectedPayload payload, Set<String> modifiers, int count,
                                WindowKey windowKey, Instant recordedAt) {

    public PreparedKeystroke {
        modifiers = Set.copyOf(modifiers);
    }
}
