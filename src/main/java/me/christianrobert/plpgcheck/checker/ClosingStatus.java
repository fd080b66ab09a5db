package me.christianrobert.plpgcheck.checker;

/**
 * Control flow verdict for a statement or statement list, ordered from the weakest to
 * the strongest guarantee that control leaves by RETURN or by an exception.
 */
public enum ClosingStatus {
    UNCLOSED,
    POSSIBLY_CLOSED,
    CLOSED_BY_EXCEPTIONS,
    CLOSED;

    /**
     * Greatest lower bound of the two verdicts.
     */
    public static ClosingStatus meet(ClosingStatus a, ClosingStatus b) {
        return a.ordinal() <= b.ordinal() ? a : b;
    }

    /**
     * Verdict of two alternative paths. Control that leaves on one path only is
     * possibly closed.
     */
    public static ClosingStatus mergeBranches(ClosingStatus a, ClosingStatus b) {
        ClosingStatus result = meet(a, b);
        if (result == UNCLOSED && (a != UNCLOSED || b != UNCLOSED)) {
            return POSSIBLY_CLOSED;
        }
        return result;
    }

    /**
     * Verdict of a body that may run zero times.
     */
    public ClosingStatus possibly() {
        return this == UNCLOSED ? UNCLOSED : POSSIBLY_CLOSED;
    }

    public boolean isClosed() {
        return this == CLOSED || this == CLOSED_BY_EXCEPTIONS;
    }
}
