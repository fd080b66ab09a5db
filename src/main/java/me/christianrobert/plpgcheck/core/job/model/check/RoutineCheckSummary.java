package me.christianrobert.plpgcheck.core.job.model.check;

import me.christianrobert.plpgcheck.diagnostic.Diagnostic;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a batch check over the routines of one or more schemas.
 */
public class RoutineCheckSummary {

    private final Map<String, List<RoutineOutcome>> schemas = new HashMap<>();
    private LocalDateTime checkedAt = LocalDateTime.now();

    public void addOutcome(String schema, RoutineOutcome outcome) {
        schemas.computeIfAbsent(schema, k -> new ArrayList<>()).add(outcome);
    }

    public Map<String, List<RoutineOutcome>> getSchemas() {
        return schemas;
    }

    public int getTotalRoutines() {
        int total = 0;
        for (List<RoutineOutcome> outcomes : schemas.values()) {
            total += outcomes.size();
        }
        return total;
    }

    public int getCleanCount() {
        return count(Status.CLEAN);
    }

    public int getWarningCount() {
        return count(Status.WARNINGS);
    }

    public int getErrorCount() {
        return count(Status.ERRORS);
    }

    public int getFailedCount() {
        return count(Status.FAILED);
    }

    public boolean isSuccessful() {
        return getErrorCount() == 0 && getFailedCount() == 0;
    }

    public LocalDateTime getCheckedAt() {
        return checkedAt;
    }

    public void setCheckedAt(LocalDateTime checkedAt) {
        this.checkedAt = checkedAt;
    }

    private int count(Status status) {
        int n = 0;
        for (List<RoutineOutcome> outcomes : schemas.values()) {
            for (RoutineOutcome outcome : outcomes) {
                if (outcome.getStatus() == status) {
                    n++;
                }
            }
        }
        return n;
    }

    public enum Status {
        CLEAN,
        WARNINGS,
        ERRORS,
        /** The routine could not be checked at all. */
        FAILED
    }

    public static class RoutineOutcome {
        private final String signature;
        private Status status = Status.CLEAN;
        private int errors;
        private int warnings;
        private String failureMessage;
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        public RoutineOutcome(String signature) {
            this.signature = signature;
        }

        public void addDiagnostics(List<Diagnostic> found) {
            for (Diagnostic diagnostic : found) {
                diagnostics.add(diagnostic);
                if (diagnostic.isError()) {
                    errors++;
                } else {
                    warnings++;
                }
            }
            if (errors > 0) {
                status = Status.ERRORS;
            } else if (warnings > 0) {
                status = Status.WARNINGS;
            }
        }

        public void fail(String message) {
            this.status = Status.FAILED;
            this.failureMessage = message;
        }

        public String getSignature() { return signature; }
        public Status getStatus() { return status; }
        public int getErrors() { return errors; }
        public int getWarnings() { return warnings; }
        public String getFailureMessage() { return failureMessage; }
        public List<Diagnostic> getDiagnostics() { return diagnostics; }
    }
}
