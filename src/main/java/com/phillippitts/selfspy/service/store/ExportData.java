package com.phillippitts.selfspy.service.store;

import java.util.List;

/**
 * Everything stored for a time range, in insertion order per table.
 */
public record ExportData(List<ProcessRow> processes,
                         List<WindowRow> windows,
                         List<KeystrokeRow> keystrokes,
                         List<PointerRow> pointerEvents,
                         List<SessionRow> sessions) {

    public ExportData {
        processes = List.copyOf(processes);
        windows = List.copyOf(windows);
        keystrokes = List.copyOf(keystrokes);
        pointerEvents = List.copyOf(pointerEvents);
        sessions = List.copyOf(sessions);
    }
}
