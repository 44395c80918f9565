package com.phillippitts.selfspy.testutil;

import com.phillippitts.selfspy.domain.KeystrokeEvent;
import com.phillippitts.selfspy.domain.PointerEvent;
import com.phillippitts.selfspy.domain.PointerEventType;
import com.phillippitts.selfspy.domain.WindowEvent;
import com.phillippitts.selfspy.domain.WindowKey;

import java.time.Instant;
import java.util.Set;

/**
 * Factories for the three event kinds with sensible geometry.
 */
public final class TestEvents {

    private TestEvents() {}

    public static WindowEvent window(String title, String process, int pid, Instant at) {
        return new WindowEvent(title, process, pid, "", 0, 0, 800, 600, at);
    }

    public static KeystrokeEvent key(String text, WindowKey window, Instant at) {
        return new KeystrokeEvent(text, Set.of(), window, at);
    }

    public static PointerEvent click(WindowKey window, Instant at) {
        return new PointerEvent(10, 20, "LEFT", PointerEventType.CLICK, window, at);
    }
}
