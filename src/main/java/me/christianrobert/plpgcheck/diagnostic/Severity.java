package me.christianrobert.plpgcheck.diagnostic;

/**
 * Diagnostic severity. Every warning severity belongs to one warning category that can
 * be switched on and off per run and per pragma scope.
 */
public enum Severity {
    ERROR("error"),
    WARNING_OTHERS("warning"),
    WARNING_EXTRA("warning extra"),
    WARNING_PERFORMANCE("performance"),
    WARNING_SECURITY("security"),
    WARNING_COMPATIBILITY("compatibility");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isError() {
        return this == ERROR;
    }
}
