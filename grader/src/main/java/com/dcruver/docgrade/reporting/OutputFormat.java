package com.dcruver.docgrade.reporting;

import java.util.Locale;

/**
 * Report renderings supported by the formatter.
 */
public enum OutputFormat {
    CONSOLE,
    JSON,
    MARKDOWN;

    /**
     * Parse a format name ignoring case; "text" is accepted for CONSOLE
     */
    public static OutputFormat fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("TEXT")) {
            return CONSOLE;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown output format: " + name + " (console, json, markdown)", e);
        }
    }
}
