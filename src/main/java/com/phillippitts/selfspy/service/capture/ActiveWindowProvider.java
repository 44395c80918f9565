package com.phillippitts.selfspy.service.capture;

import java.util.Optional;

/**
 * Platform query for the current foreground window. Polled by {@link WindowWatcher}.
 */
public interface ActiveWindowProvider {

    /**
     * @return the foreground window, or empty when it cannot be determined right now
     */
    Optional<ActiveWindow> activeWindow();

    /** Whether this provider can work on the current platform at all. */
    boolean isSupported();
}
