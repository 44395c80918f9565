package com.phillippitts.selfspy.service.store;

import com.phillippitts.selfspy.domain.PointerEvent;
import com.phillippitts.selfspy.domain.WindowRecord;

import java.util.List;

/**
 * A drained snapshot ready to be written. Built once per flush and reused on every
 * retry, so payloads are encrypted exactly once.
 */
public record PreparedSnapshot(List<WindowRecord> windows,
                               List<PreparedKeystroke> keystrokes,
                               List<PointerEvent> pointerEvents) {

    public PreparedSnapshot {
        windows = List.copyOf(windows);
        keystrokes = List.copyOf(keystrokes);
        pointerEvents = List.copyOf(pointerEvents);
    }

    public int recordCount() {
        return windows.size() + keystrokes.size() + pointerEvents.size();
    }
}
