package com.vidnyan.cstfix.domain.rule;

import java.util.Locale;

/**
 * Diagnostic severity levels.
 */
public enum Severity {
    ERROR,  // Should fix - fails a check run
    WARN,   // Should review - reported but does not fail
    INFO;   // Informational only

    /**
     * Parses a configured level name; {@code warning} is accepted for {@link #WARN}.
     */
    public static Severity parse(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "error" -> ERROR;
            case "warn", "warning" -> WARN;
            case "info" -> INFO;
            default -> throw new IllegalArgumentException("Unknown severity: " + value);
        };
    }
}
