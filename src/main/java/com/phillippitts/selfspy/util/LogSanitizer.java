package com.phillippitts.selfspy.util;

/** Utility for privacy-safe logging of window titles and other user-visible strings. */
public final class LogSanitizer {

    /** Default maximum characters of a window title written to logs. */
    public static final int TITLE_PREVIEW = 24;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Shortened window title for log lines, with an ellipsis marker when cut.
     */
    public static String title(String title) {
        if (title == null) {
            return "";
        }
        return title.length() <= TITLE_PREVIEW ? title : truncate(title, TITLE_PREVIEW) + "…";
    }
}
