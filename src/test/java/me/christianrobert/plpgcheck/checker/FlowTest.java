package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.ast.ExceptionConditions;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the closing status lattice and flow merging.
 */
class FlowTest {

    // ========== ClosingStatus ==========

    @Test
    void mergeBranches_oneClosedPathIsPossiblyClosed() {
        assertEquals(ClosingStatus.POSSIBLY_CLOSED,
                ClosingStatus.mergeBranches(ClosingStatus.CLOSED, ClosingStatus.UNCLOSED));
        assertEquals(ClosingStatus.UNCLOSED,
                ClosingStatus.mergeBranches(ClosingStatus.UNCLOSED, ClosingStatus.UNCLOSED));
        assertEquals(ClosingStatus.CLOSED_BY_EXCEPTIONS,
                ClosingStatus.mergeBranches(ClosingStatus.CLOSED, ClosingStatus.CLOSED_BY_EXCEPTIONS));
    }

    @Test
    void possibly_weakensClosedStatuses() {
        assertEquals(ClosingStatus.POSSIBLY_CLOSED, ClosingStatus.CLOSED.possibly());
        assertEquals(ClosingStatus.UNCLOSED, ClosingStatus.UNCLOSED.possibly());
        assertFalse(ClosingStatus.CLOSED.possibly().isClosed());
    }

    @Test
    void isClosed_countsExceptions() {
        assertTrue(ClosingStatus.CLOSED_BY_EXCEPTIONS.isClosed());
        assertFalse(ClosingStatus.POSSIBLY_CLOSED.isClosed());
    }

    // ========== Flow ==========

    @Test
    void merge_firstPathIsTakenAsIs() {
        assertSame(Flow.CLOSED, Flow.merge(null, Flow.CLOSED, null));
    }

    @Test
    void merge_raisingPathsUnionTheirCodes() {
        Flow merged = Flow.merge(Flow.raising("P0001"), Flow.raising("22012"), null);
        assertTrue(merged.isRaising());
        assertEquals(Set.of("P0001", "22012"), merged.getExceptions());
    }

    @Test
    void merge_returnAndRaiseIsClosed() {
        Flow merged = Flow.merge(Flow.CLOSED, Flow.raising("P0001"), null);
        assertEquals(ClosingStatus.CLOSED, merged.getStatus());
    }

    @Test
    void merge_reraiseTakesTheCaughtCode() {
        Flow merged = Flow.merge(null, Flow.raising(ExceptionConditions.RERAISE), "22012");
        assertEquals(Set.of("22012"), merged.getExceptions());
    }

    @Test
    void possibly_dropsExceptionCodes() {
        Flow loopBody = Flow.raising("P0001").possibly();
        assertEquals(ClosingStatus.POSSIBLY_CLOSED, loopBody.getStatus());
        assertTrue(loopBody.getExceptions().isEmpty());
    }
}
