package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.catalog.Volatility;
import me.christianrobert.plpgcheck.coverage.StatementInventory;
import me.christianrobert.plpgcheck.dependency.DependencyRecord;
import me.christianrobert.plpgcheck.diagnostic.Diagnostic;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one check run.
 */
public class CheckResult {

    private final String routineId;
    private final List<Diagnostic> diagnostics;
    private final List<String> notices;
    private final List<DependencyRecord> dependencies;
    private final Volatility observedVolatility;
    private final StatementInventory inventory;
    private final boolean notChecked;

    public CheckResult(String routineId, List<Diagnostic> diagnostics, List<String> notices,
                       List<DependencyRecord> dependencies, Volatility observedVolatility,
                       StatementInventory inventory, boolean notChecked) {
        this.routineId = routineId;
        this.diagnostics = List.copyOf(diagnostics);
        this.notices = List.copyOf(notices);
        this.dependencies = List.copyOf(dependencies);
        this.observedVolatility = observedVolatility;
        this.inventory = inventory;
        this.notChecked = notChecked;
    }

    /**
     * Result of a run that was not performed because checking is disabled.
     */
    public static CheckResult disabled(String routineId) {
        List<String> notices = new ArrayList<>();
        notices.add("plpgsql_check is disabled");
        return new CheckResult(routineId, List.of(), notices, List.of(), null, null, true);
    }

    public String getRoutineId() {
        return routineId;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<String> getNotices() {
        return notices;
    }

    public List<DependencyRecord> getDependencies() {
        return dependencies;
    }

    /**
     * Volatility the routine's statements need; {@code null} when not determined.
     */
    public Volatility getObservedVolatility() {
        return observedVolatility;
    }

    /**
     * Statements of the compiled routine; {@code null} when it did not compile.
     */
    public StatementInventory getInventory() {
        return inventory;
    }

    public boolean isNotChecked() {
        return notChecked;
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public long countErrors() {
        return diagnostics.stream().filter(Diagnostic::isError).count();
    }
}
