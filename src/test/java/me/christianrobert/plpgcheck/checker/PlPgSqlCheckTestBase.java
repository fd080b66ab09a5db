package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.catalog.InMemoryCatalog;
import me.christianrobert.plpgcheck.diagnostic.Diagnostic;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;

import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Shared fixtures for checker tests: a small catalog and helpers to build, check and
 * inspect routines.
 */
abstract class PlPgSqlCheckTestBase {

    protected final InMemoryCatalog catalog = new InMemoryCatalog()
            .addTable("public.t1", "a integer", "b text")
            .addTable("public.t2", "a integer", "c date")
            .addSequence("public.s1");

    protected final PlPgSqlChecker checker = new PlPgSqlChecker();

    protected static RoutineDefinition function(String returnType, String source) {
        RoutineDefinition definition = new RoutineDefinition("public", "f1", source);
        definition.setReturnType(returnType);
        return definition;
    }

    protected CheckResult check(RoutineDefinition routine) {
        return check(routine, CheckOptions.defaults());
    }

    protected CheckResult check(RoutineDefinition routine, CheckOptions options) {
        return checker.check(new CheckRequest(routine, catalog).options(options));
    }

    protected static Diagnostic findDiagnostic(CheckResult result, String message) {
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            if (message.equals(diagnostic.getMessage())) {
                return diagnostic;
            }
        }
        return null;
    }

    protected static Diagnostic assertReported(CheckResult result, String message) {
        Diagnostic diagnostic = findDiagnostic(result, message);
        assertNotNull(diagnostic, "expected \"" + message + "\" among " + describe(result));
        return diagnostic;
    }

    protected static void assertNotReported(CheckResult result, String message) {
        assertNull(findDiagnostic(result, message), "unexpected \"" + message + "\" among " + describe(result));
    }

    private static String describe(CheckResult result) {
        return result.getDiagnostics().stream().map(Diagnostic::toString).collect(Collectors.joining("; ", "[", "]"));
    }
}
