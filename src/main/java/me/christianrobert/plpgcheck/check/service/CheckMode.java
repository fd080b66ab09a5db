package me.christianrobert.plpgcheck.check.service;

import java.util.Locale;

/**
 * When routines are checked: only on request, or passively when they start.
 */
public enum CheckMode {
    DISABLED,
    BY_FUNCTION,
    FRESH_START,
    EVERY_START;

    /**
     * The value as written in the configuration, e.g. {@code fresh_start}.
     */
    public String getConfigName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the configuration value ({@code by_function}, {@code fresh_start}, ...).
     *
     * @return the mode, or {@code null} when the value names none
     */
    public static CheckMode fromConfig(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (CheckMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        return null;
    }
}
