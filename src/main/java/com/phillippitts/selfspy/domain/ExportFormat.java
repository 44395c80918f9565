package com.phillippitts.selfspy.domain;

import java.util.Locale;

public enum ExportFormat {
    JSON, CSV, SQL;

    /**
     * Parses a user-supplied format name, case-insensitive.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static ExportFormat from(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("export format must not be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported export format: " + name + " (json, csv, sql)");
        }
    }
}
