package com.phillippitts.selfspy.domain;

import java.time.Instant;

/**
 * Observation of the current foreground window.
 */
public record WindowEvent(String title, String processName, int processId, String bundleId,
                          int x, int y, int width, int height, Instant timestamp) {

    public WindowEvent {
        if (processName == null || processName.isBlank()) {
            throw new IllegalArgumentException("processName must not be blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        title = title == null ? "" : title;
        bundleId = bundleId == null ? "" : bundleId;
    }

    public WindowKey key() {
        return new WindowKey(title, processName, processId);
    }
}
