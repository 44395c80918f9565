package com.phillippitts.selfspy.service.engine;

import com.phillippitts.selfspy.domain.PointerEventType;
import com.phillippitts.selfspy.domain.WindowKey;

import java.time.Instant;
import java.util.Set;

/**
 * Inbound port for capture sources. One method per event kind.
 *
 * <p>Implementations never throw back into the source; a rejected or failed event is
 * logged and dropped.
 */
public interface ActivityEventSink {

    /**
     * @param windowKey owning window, or null to attribute to the current foreground window
     */
    void onKeystroke(String text, Set<String> modifiers, WindowKey windowKey, Instant timestamp);

    /**
     * @param windowKey owning window, or null to attribute to the current foreground window
     */
    void onPointerEvent(int x, int y, String button, PointerEventType type, WindowKey windowKey, Instant timestamp);

    /**
     * @param bundleId platform application identifier; may be null
     */
    void onWindowChange(String title, String processName, int processId, String bundleId,
                        int x, int y, int width, int height, Instant timestamp);
}
