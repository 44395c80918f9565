package com.phillippitts.selfspy.service.capture;

/**
 * Foreground window as reported by the platform.
 *
 * @param bundleId platform application identifier, empty when unknown
 */
public record ActiveWindow(String title, String processName, int processId, String bundleId,
                           int x, int y, int width, int height) {

    public ActiveWindow {
        title = title == null ? "" : title;
        bundleId = bundleId == null ? "" : bundleId;
    }
}
