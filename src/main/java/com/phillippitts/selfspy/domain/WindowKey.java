package com.phillippitts.selfspy.domain;

/**
 * Identity of a logical foreground window for deduplication: (title, process name, pid).
 */
public record WindowKey(String title, String processName, int processId) {

    public WindowKey {
        if (processName == null || processName.isBlank()) {
            throw new IllegalArgumentException("processName must not be blank");
        }
        title = title == null ? "" : title;
    }
}
