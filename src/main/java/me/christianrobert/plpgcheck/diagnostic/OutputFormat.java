package me.christianrobert.plpgcheck.diagnostic;

import java.util.Locale;

public enum OutputFormat {
    TEXT,
    TABULAR,
    JSON,
    XML;

    public static OutputFormat fromString(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unrecognized format: \"" + value + "\"", e);
        }
    }
}
