package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.diagnostic.Diagnostic;
import me.christianrobert.plpgcheck.diagnostic.Severity;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;
import me.christianrobert.plpgcheck.routine.RoutineParameter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EXECUTE and format(): constant dynamic SQL, USING, records filled by
 * dynamic SQL and the SQL injection heuristics.
 */
class DynamicSqlCheckTest extends PlPgSqlCheckTestBase {

    private static final String NOT_SANITIZED = "text type variable is not sanitized";

    private static RoutineDefinition withTextParameter(String name, String source) {
        RoutineDefinition routine = function("void", source);
        routine.addParameter(RoutineParameter.in(name, "text"));
        return routine;
    }

    private static CheckOptions securityOptions() {
        CheckOptions options = CheckOptions.defaults();
        options.setSecurityWarnings(true);
        return options;
    }

    private static boolean hasSeverity(CheckResult result, Severity severity) {
        return result.getDiagnostics().stream().anyMatch(d -> d.getSeverity() == severity);
    }

    // ========== Constant EXECUTE ==========

    @Test
    void constantQueryWithoutParametersIsImmutable() {
        CheckOptions options = CheckOptions.defaults();
        options.setPerformanceWarnings(true);

        Diagnostic diagnostic = assertReported(check(function("void", """
                begin
                  execute 'select 1';
                end;
                """), options), "immutable expression without parameters found");

        assertEquals(Severity.WARNING_PERFORMANCE, diagnostic.getSeverity());
        assertEquals("Don't use dynamic SQL when you can use static SQL.", diagnostic.getHint());
    }

    @Test
    void constantQueryIsCheckedAgainstCatalog() {
        Diagnostic diagnostic = assertReported(check(function("void", """
                begin
                  execute 'select zz from t1';
                end;
                """)), "column \"zz\" does not exist");
        assertEquals("42703", diagnostic.getSqlState());
    }

    @Test
    void usingValuesNotReferencedByQuery() {
        RoutineDefinition routine = function("void", """
                begin
                  execute 'select 1' using p;
                end;
                """);
        routine.addParameter(RoutineParameter.in("p", "integer"));

        Diagnostic diagnostic = assertReported(check(routine),
                "values passed to EXECUTE statement by USING clause was not used");
        assertEquals(Severity.WARNING_OTHERS, diagnostic.getSeverity());
    }

    @Test
    void usingValuesReferencedByPosition() {
        RoutineDefinition routine = function("void", """
                begin
                  execute 'select b from t1 where a = $1' using p;
                end;
                """);
        routine.addParameter(RoutineParameter.in("p", "integer"));
        CheckOptions options = CheckOptions.defaults();
        options.setPerformanceWarnings(true);

        CheckResult result = check(routine, options);

        assertNotReported(result, "values passed to EXECUTE statement by USING clause was not used");
        assertNotReported(result, "immutable expression without parameters found");
    }

    // ========== Records filled by dynamic SQL ==========

    @Test
    void recordFromUnknownQueryLosesItsShape() {
        CheckResult result = check(withTextParameter("q", """
                declare
                  r record;
                begin
                  execute q into r;
                  raise notice '%', r.anything;
                end;
                """));

        Diagnostic diagnostic = assertReported(result, "cannot determinate a result of dynamic SQL");
        assertEquals(Severity.WARNING_OTHERS, diagnostic.getSeverity());
        assertFalse(result.hasErrors(), "fields of a degraded record are not checked: " + result.getDiagnostics());
    }

    @Test
    void typePragmaKeepsShapeOfRecordFromDynamicSql() {
        CheckResult result = check(withTextParameter("q", """
                declare
                  r record;
                begin
                  perform plpgsql_check_pragma('type: r (id integer, processed boolean)');
                  execute q into r;
                  if not r.processed then
                    raise notice 'pending %', r.id;
                  end if;
                end;
                """));

        assertTrue(result.getDiagnostics().isEmpty(), "diagnostics: " + result.getDiagnostics());
    }

    @Test
    void typePragmaStillRejectsUnknownField() {
        CheckResult result = check(withTextParameter("q", """
                declare
                  r record;
                begin
                  perform plpgsql_check_pragma('type: r (id integer, processed boolean)');
                  execute q into r;
                  raise notice '%', r.name;
                end;
                """));

        Diagnostic diagnostic = assertReported(result, "record \"r\" has no field \"name\"");
        assertEquals("42703", diagnostic.getSqlState());
    }

    // ========== SQL injection ==========

    @Test
    void concatenatedParameterIsNotSanitized() {
        CheckResult result = check(withTextParameter("tab", """
                begin
                  execute 'select * from ' || tab;
                end;
                """), securityOptions());

        Diagnostic diagnostic = assertReported(result, NOT_SANITIZED);
        assertEquals(Severity.WARNING_SECURITY, diagnostic.getSeverity());
        assertEquals("Use quote_ident, quote_literal or format function to secure variable.", diagnostic.getHint());
        assertTrue(diagnostic.getPosition() > 0, "points at the variable");
    }

    @Test
    void quotedParameterIsSafe() {
        CheckResult result = check(withTextParameter("v", """
                begin
                  execute 'select * from t1 where b = ' || quote_literal(v);
                end;
                """), securityOptions());

        assertFalse(hasSeverity(result, Severity.WARNING_SECURITY), "diagnostics: " + result.getDiagnostics());
    }

    @Test
    void variableAssignedFromQuotedValueIsSafe() {
        CheckResult result = check(withTextParameter("v", """
                declare
                  cond text;
                begin
                  cond := 'b = ' || quote_literal(v);
                  execute 'select * from t1 where ' || cond;
                end;
                """), securityOptions());

        assertFalse(hasSeverity(result, Severity.WARNING_SECURITY), "diagnostics: " + result.getDiagnostics());
    }

    @Test
    void variableAssignedFromRawValueIsNotSanitized() {
        CheckResult result = check(withTextParameter("v", """
                declare
                  cond text;
                begin
                  cond := 'b = ' || v;
                  execute 'select * from t1 where ' || cond;
                end;
                """), securityOptions());

        assertReported(result, NOT_SANITIZED);
    }

    @Test
    void formatIdentifierSpecifierIsSafe() {
        CheckResult safe = check(withTextParameter("tab", """
                begin
                  execute format('select * from %I', tab);
                end;
                """), securityOptions());
        assertFalse(hasSeverity(safe, Severity.WARNING_SECURITY), "diagnostics: " + safe.getDiagnostics());

        CheckResult unsafe = check(withTextParameter("tab", """
                begin
                  execute format('select * from %s', tab);
                end;
                """), securityOptions());
        assertTrue(hasSeverity(unsafe, Severity.WARNING_SECURITY), "diagnostics: " + unsafe.getDiagnostics());
    }

    @Test
    void injectionCheckNeedsSecurityWarnings() {
        CheckResult result = check(withTextParameter("tab", """
                begin
                  execute 'select * from ' || tab;
                end;
                """));

        assertNotReported(result, NOT_SANITIZED);
    }

    // ========== format() ==========

    @Test
    void formatWithTooFewArguments() {
        Diagnostic diagnostic = assertReported(check(function("void", """
                begin
                  perform format('%s and %s', 1);
                end;
                """)), "too few arguments for format()");

        assertEquals(Severity.ERROR, diagnostic.getSeverity());
        assertEquals("22023", diagnostic.getSqlState());
    }

    @Test
    void formatWithUnusedArguments() {
        Diagnostic diagnostic = assertReported(check(function("void", """
                begin
                  perform format('%s', 1, 2);
                end;
                """)), "unused parameters of function \"format\"");
        assertEquals(Severity.WARNING_OTHERS, diagnostic.getSeverity());
    }

    @Test
    void formatWithUnknownSpecifier() {
        assertReported(check(function("void", """
                begin
                  perform format('%d', 1);
                end;
                """)), "unrecognized format() type specifier \"d\"");
    }

    @Test
    void formatWithMatchingArguments() {
        CheckResult result = check(function("void", """
                begin
                  perform format('%s is %L, 100%%', 'a', 'b');
                end;
                """));
        assertTrue(result.getDiagnostics().isEmpty(), "diagnostics: " + result.getDiagnostics());
    }
}
