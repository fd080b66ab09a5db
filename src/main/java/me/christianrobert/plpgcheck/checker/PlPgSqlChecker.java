package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.ast.CompiledRoutine;
import me.christianrobert.plpgcheck.diagnostic.Diagnostic;
import me.christianrobert.plpgcheck.diagnostic.Severity;
import me.christianrobert.plpgcheck.parser.RoutineCompileException;
import me.christianrobert.plpgcheck.parser.RoutineCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of a static check: compiles the routine, walks its body once and adds the
 * end of routine reports.
 */
public class PlPgSqlChecker {

    private static final Logger log = LoggerFactory.getLogger(PlPgSqlChecker.class);

    private final RoutineCompiler compiler;
    private final CheckStateManager manager;

    public PlPgSqlChecker() {
        this(new RoutineCompiler(), new CheckStateManager());
    }

    public PlPgSqlChecker(RoutineCompiler compiler, CheckStateManager manager) {
        this.compiler = compiler;
        this.manager = manager;
    }

    /**
     * Checks one routine.
     *
     * @throws InvalidInputException for usage errors, before anything is examined
     */
    public CheckResult check(CheckRequest request) {
        CheckState state = manager.beginCheck(request);
        try {
            CompiledRoutine compiled;
            try {
                compiled = compiler.compile(request.getRoutine(), state.getCatalog(), state.getTriggerRelation(),
                        state.getPolymorphicTypes());
            } catch (RoutineCompileException e) {
                log.debug("Routine {} does not compile: {}", request.getRoutine().getSignature(), e.getMessage());
                state.report(Diagnostic.builder(Severity.ERROR, e.getMessage())
                        .sqlState(e.getSqlState())
                        .statement(e.getLineno(), null)
                        .detail(e.getDetail()));
                return manager.endCheck(state);
            }
            state.attach(compiled);

            StatementWalker walker = new StatementWalker(state);
            ClosingStatus status = walker.walk();
            if (!state.isStopped()) {
                state.setCurrentStatement(null);
                reportMissingReturn(state, status);
                UsageReporter usage = new UsageReporter(state);
                usage.reportUnusedVariables();
                usage.reportUnusedParameters(walker.isFoundReturnQuery());
                usage.reportVolatility();
            }
            return manager.endCheck(state);
        } finally {
            state.release();
        }
    }

    private static void reportMissingReturn(CheckState state, ClosingStatus status) {
        CompiledRoutine compiled = state.getCompiled();
        if (compiled.isProcedure() || status.isClosed()) {
            return;
        }
        if (status == ClosingStatus.UNCLOSED) {
            state.report(Diagnostic.builder(Severity.ERROR, "control reached end of function without RETURN")
                    .sqlState(SqlStates.RETURN_NOT_PERFORMED));
        } else {
            state.report(Diagnostic.builder(Severity.WARNING_EXTRA, "control reached end of function without RETURN")
                    .sqlState(SqlStates.RETURN_NOT_PERFORMED));
        }
    }
}
