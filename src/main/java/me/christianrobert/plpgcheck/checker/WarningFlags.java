package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.diagnostic.Severity;

/**
 * Switchable checker features of one pragma scope. Pragmas switch warning categories
 * within the limit given by the check options: a category the options turned off stays off.
 */
public class WarningFlags {

    private boolean check = true;
    private boolean tracer;
    private boolean otherWarnings;
    private boolean performanceWarnings;
    private boolean extraWarnings;
    private boolean securityWarnings;
    private boolean compatibilityWarnings;
    private WarningFlags limit;

    public static WarningFlags from(CheckOptions options) {
        WarningFlags flags = new WarningFlags();
        flags.otherWarnings = options.isOtherWarnings();
        flags.performanceWarnings = options.isPerformanceWarnings();
        flags.extraWarnings = options.isExtraWarnings();
        flags.securityWarnings = options.isSecurityWarnings();
        flags.compatibilityWarnings = options.isCompatibilityWarnings();
        flags.limit = flags.copy();
        return flags;
    }

    public WarningFlags copy() {
        WarningFlags copy = new WarningFlags();
        copy.check = check;
        copy.tracer = tracer;
        copy.otherWarnings = otherWarnings;
        copy.performanceWarnings = performanceWarnings;
        copy.extraWarnings = extraWarnings;
        copy.securityWarnings = securityWarnings;
        copy.compatibilityWarnings = compatibilityWarnings;
        copy.limit = limit;
        return copy;
    }

    /**
     * Whether diagnostics of this severity are reported under these flags.
     */
    public boolean allows(Severity severity) {
        if (!check) {
            return false;
        }
        switch (severity) {
            case ERROR:
                return true;
            case WARNING_OTHERS:
                return isOtherWarnings();
            case WARNING_EXTRA:
                return isExtraWarnings();
            case WARNING_PERFORMANCE:
                return isPerformanceWarnings();
            case WARNING_SECURITY:
                return isSecurityWarnings();
            case WARNING_COMPATIBILITY:
                return isCompatibilityWarnings();
            default:
                return false;
        }
    }

    /**
     * Sets a feature by its pragma name.
     *
     * @return {@code false} when the name is unknown
     */
    public boolean set(String feature, boolean enabled) {
        switch (feature) {
            case "check":
                check = enabled;
                return true;
            case "tracer":
                tracer = enabled;
                return true;
            case "other_warnings":
                otherWarnings = enabled;
                return true;
            case "performance_warnings":
                performanceWarnings = enabled;
                return true;
            case "extra_warnings":
                extraWarnings = enabled;
                return true;
            case "security_warnings":
                securityWarnings = enabled;
                return true;
            case "compatibility_warnings":
                compatibilityWarnings = enabled;
                return true;
            default:
                return false;
        }
    }

    /**
     * @return the effective feature state, or {@code null} when the name is unknown
     */
    public Boolean get(String feature) {
        switch (feature) {
            case "check":
                return check;
            case "tracer":
                return tracer;
            case "other_warnings":
                return isOtherWarnings();
            case "performance_warnings":
                return isPerformanceWarnings();
            case "extra_warnings":
                return isExtraWarnings();
            case "security_warnings":
                return isSecurityWarnings();
            case "compatibility_warnings":
                return isCompatibilityWarnings();
            default:
                return null;
        }
    }

    public boolean isCheck() {
        return check;
    }

    public boolean isTracer() {
        return tracer;
    }

    public boolean isOtherWarnings() {
        return otherWarnings && (limit == null || limit.otherWarnings);
    }

    public boolean isPerformanceWarnings() {
        return performanceWarnings && (limit == null || limit.performanceWarnings);
    }

    public boolean isSecurityWarnings() {
        return securityWarnings && (limit == null || limit.securityWarnings);
    }

    public boolean isExtraWarnings() {
        return extraWarnings && (limit == null || limit.extraWarnings);
    }

    public boolean isCompatibilityWarnings() {
        return compatibilityWarnings && (limit == null || limit.compatibilityWarnings);
    }
}
