package me.christianrobert.plpgcheck.check.rest;

import me.christianrobert.plpgcheck.core.job.model.check.RoutineCheckSummary;
import me.christianrobert.plpgcheck.core.job.model.check.RoutineCheckSummary.RoutineOutcome;
import me.christianrobert.plpgcheck.diagnostic.Diagnostic;
import me.christianrobert.plpgcheck.diagnostic.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the batch summary returned by the job result endpoint.
 */
class CheckResourceTest {

    // ========== Batch summary ==========

    @Test
    void testGenerateRoutineCheckSummary() {
        RoutineCheckSummary summary = new RoutineCheckSummary();
        summary.addOutcome("public", new RoutineOutcome("public.f_ok()"));
        RoutineOutcome broken = new RoutineOutcome("public.f_broken()");
        broken.addDiagnostics(List.of(Diagnostic.builder(Severity.ERROR, "relation \"nosuch\" does not exist")
                .sqlState("42P01")
                .build()));
        summary.addOutcome("public", broken);
        RoutineOutcome failed = new RoutineOutcome("billing.trg()");
        failed.fail("trigger function is not used by any trigger");
        summary.addOutcome("billing", failed);

        Map<String, Object> result = CheckResource.generateRoutineCheckSummary(List.of(summary));

        assertEquals(3, result.get("totalRoutines"));
        assertEquals(1, result.get("cleanCount"));
        assertEquals(1, result.get("errorCount"));
        assertEquals(1, result.get("failedCount"));
        assertEquals(Map.of("public", 2, "billing", 1), result.get("routinesPerSchema"));
        assertEquals("Check completed: 3 routine(s) in 2 schema(s), 1 with errors, 1 failed", result.get("message"));
    }
}
