package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.diagnostic.Diagnostic;

/**
 * Raised by a passive check when the routine about to run has an error.
 */
public class RoutineCheckException extends RuntimeException {

    private final transient Diagnostic diagnostic;

    public RoutineCheckException(String routine, Diagnostic diagnostic) {
        super("routine " + routine + " failed check: " + diagnostic.getMessage());
        this.diagnostic = diagnostic;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
