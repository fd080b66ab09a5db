package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.ast.ExceptionConditions;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * How control leaves a statement or statement list: the closing status plus, for
 * {@link ClosingStatus#CLOSED_BY_EXCEPTIONS}, the SQLSTATE codes that may be raised.
 */
final class Flow {

    /**
     * Stands for an exception whose code is not known before run time.
     */
    static final String UNKNOWN_CODE = "?";

    static final Flow UNCLOSED = new Flow(ClosingStatus.UNCLOSED, Collections.emptySet());
    static final Flow CLOSED = new Flow(ClosingStatus.CLOSED, Collections.emptySet());

    private final ClosingStatus status;
    private final Set<String> exceptions;

    private Flow(ClosingStatus status, Set<String> exceptions) {
        this.status = status;
        this.exceptions = exceptions;
    }

    static Flow of(ClosingStatus status) {
        switch (status) {
            case UNCLOSED:
                return UNCLOSED;
            case CLOSED:
                return CLOSED;
            default:
                return new Flow(status, Collections.emptySet());
        }
    }

    static Flow raising(String code) {
        Set<String> codes = new LinkedHashSet<>();
        codes.add(code);
        return new Flow(ClosingStatus.CLOSED_BY_EXCEPTIONS, codes);
    }

    static Flow raising(Set<String> codes) {
        return new Flow(ClosingStatus.CLOSED_BY_EXCEPTIONS, new LinkedHashSet<>(codes));
    }

    ClosingStatus getStatus() {
        return status;
    }

    Set<String> getExceptions() {
        return exceptions;
    }

    boolean isRaising() {
        return status == ClosingStatus.CLOSED_BY_EXCEPTIONS;
    }

    /**
     * Flow of a body that may run zero times.
     */
    Flow possibly() {
        return of(status.possibly());
    }

    /**
     * Verdict of two alternative paths. {@code current} is {@code null} before the first
     * path is known. When a handler for {@code caughtCode} re-raises, the re-raise is
     * replaced by that code.
     */
    static Flow merge(Flow current, Flow path, String caughtCode) {
        if (current == null) {
            return path.isRaising() ? new Flow(path.status, reraised(new LinkedHashSet<>(), path, caughtCode)) : path;
        }
        if (current.status == path.status) {
            if (current.status != ClosingStatus.CLOSED_BY_EXCEPTIONS) {
                return current;
            }
            Set<String> codes = reraised(new LinkedHashSet<>(current.exceptions), path, caughtCode);
            return new Flow(ClosingStatus.CLOSED_BY_EXCEPTIONS, codes);
        }
        if (current.status.isClosed() && path.status.isClosed()) {
            return CLOSED;
        }
        return of(ClosingStatus.mergeBranches(current.status, path.status));
    }

    private static Set<String> reraised(Set<String> codes, Flow path, String caughtCode) {
        for (String code : path.exceptions) {
            codes.add(ExceptionConditions.RERAISE.equals(code) && caughtCode != null ? caughtCode : code);
        }
        return codes;
    }

    @Override
    public String toString() {
        return status + (exceptions.isEmpty() ? "" : exceptions.toString());
    }
}
