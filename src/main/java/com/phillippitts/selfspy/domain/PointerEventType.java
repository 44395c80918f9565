package com.phillippitts.selfspy.domain;

import java.util.Locale;

/** Kind of pointer action. Persisted lower-case. */
public enum PointerEventType {
    CLICK, MOVE, SCROLL;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
