package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.catalog.Volatility;
import me.christianrobert.plpgcheck.diagnostic.Diagnostic;
import me.christianrobert.plpgcheck.diagnostic.Severity;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for embedded SQL and expressions: name resolution, result destinations,
 * volatility restrictions and assignment casts.
 */
class SqlStatementCheckTest extends PlPgSqlCheckTestBase {

    // ========== Destinations ==========

    @Test
    void selectWithoutInto() {
        Diagnostic diagnostic = assertReported(check(function("void", """
                begin
                  select 1;
                end;
                """)), "query has no destination for result data");

        assertEquals("42601", diagnostic.getSqlState());
        assertEquals("SQL statement", diagnostic.getStatement());
        assertEquals(2, diagnostic.getLineno());
        assertNotNull(diagnostic.getHint());
    }

    @Test
    void selectIntoVariable() {
        CheckResult result = check(function("integer", """
                declare
                  x integer;
                begin
                  select a into x from t1;
                  return x;
                end;
                """));
        assertFalse(result.hasErrors(), "diagnostics: " + result.getDiagnostics());
        assertNotReported(result, "unused variable \"x\"");
    }

    @Test
    void transactionCommandsAreRejected() {
        assertReported(check(function("void", """
                begin
                  savepoint sp1;
                end;
                """)), "cannot begin/end transactions in PL/pgSQL");
    }

    // ========== Name resolution ==========

    @Test
    void unknownRelation() {
        Diagnostic diagnostic = assertReported(check(function("void", """
                begin
                  insert into nosuch values (1);
                end;
                """)), "relation \"nosuch\" does not exist");

        assertEquals("42P01", diagnostic.getSqlState());
        assertNotNull(diagnostic.getQuery(), "the failing query is attached");
    }

    @Test
    void unknownColumn() {
        Diagnostic diagnostic = assertReported(check(function("void", """
                begin
                  perform a from t1 where zz = 1;
                end;
                """)), "column \"zz\" does not exist");
        assertEquals("42703", diagnostic.getSqlState());
    }

    @Test
    void variableClashesWithColumn() {
        Diagnostic diagnostic = assertReported(check(function("void", """
                declare
                  a integer := 1;
                begin
                  perform a from t1;
                end;
                """)), "column reference \"a\" is ambiguous");

        assertEquals("42702", diagnostic.getSqlState());
        assertEquals("It could refer to either a PL/pgSQL variable or a table column.", diagnostic.getDetail());
    }

    // ========== Volatility ==========

    @Test
    void insertInStableFunction() {
        RoutineDefinition routine = function("void", """
                begin
                  insert into t1 values (1, 'x');
                end;
                """);
        routine.setVolatility(Volatility.STABLE);

        assertReported(check(routine), "INSERT is not allowed in a non volatile function");
    }

    @Test
    void insertInVolatileFunction() {
        CheckResult result = check(function("void", """
                begin
                  insert into t1 values (1, 'x');
                end;
                """));
        assertFalse(result.hasErrors(), "diagnostics: " + result.getDiagnostics());
    }

    // ========== Sequences ==========

    @Test
    void nextvalOfUnknownSequence() {
        assertReported(check(function("void", """
                begin
                  perform nextval('nosuch');
                end;
                """)), "relation \"nosuch\" does not exist");
    }

    @Test
    void nextvalOfTable() {
        assertReported(check(function("void", """
                begin
                  perform nextval('t1');
                end;
                """)), "\"t1\" is not a sequence");
    }

    // ========== Assignment casts ==========

    @Test
    void assignmentWithoutCast() {
        Diagnostic diagnostic = assertReported(check(function("void", """
                declare
                  d date;
                begin
                  d := 1;
                end;
                """)), "target type is different type than source type");

        assertEquals(Severity.WARNING_OTHERS, diagnostic.getSeverity());
        assertEquals("assignment", diagnostic.getStatement());
    }

    @Test
    void narrowingAssignmentIsPerformanceWarning() {
        RoutineDefinition routine = function("void", """
                declare
                  x integer;
                begin
                  x := 1::bigint;
                end;
                """);
        CheckOptions options = CheckOptions.defaults();
        options.setPerformanceWarnings(true);

        Diagnostic diagnostic = assertReported(check(routine, options), "target type is different type than source type");
        assertEquals(Severity.WARNING_PERFORMANCE, diagnostic.getSeverity());
    }

    @Test
    void compositeAssignedToScalar() {
        Diagnostic diagnostic = assertReported(check(function("void", """
                declare
                  r t1;
                  x integer;
                begin
                  x := r;
                end;
                """)), "cannot cast composite value to a scalar type");
        assertTrue(diagnostic.isError());
    }

    // ========== Records ==========

    @Test
    void recordFieldMissingFromSelectedRow() {
        CheckResult result = check(function("integer", """
                declare
                  r record;
                begin
                  select * into r from t1;
                  return r.c;
                end;
                """));

        Diagnostic diagnostic = assertReported(result, "record \"r\" has no field \"c\"");
        assertEquals("42703", diagnostic.getSqlState());
        assertEquals("RETURN", diagnostic.getStatement());
        assertEquals(1, result.countErrors());
    }

    @Test
    void recordFieldOfSelectedRow() {
        CheckResult result = check(function("text", """
                declare
                  r record;
                begin
                  select * into r from t1;
                  return r.b;
                end;
                """));
        assertFalse(result.hasErrors(), "diagnostics: " + result.getDiagnostics());
    }

    @Test
    void recordReassignedWithDifferentStructure() {
        Diagnostic diagnostic = assertReported(check(function("void", """
                declare
                  r record;
                begin
                  select * into r from t1;
                  select * into r from t2;
                end;
                """)), "record \"r\" is assigned a value of different structure");

        assertEquals(Severity.WARNING_EXTRA, diagnostic.getSeverity());
        assertEquals(5, diagnostic.getLineno());
    }

    @Test
    void recordReassignedWithSameStructure() {
        CheckResult result = check(function("void", """
                declare
                  r record;
                begin
                  select * into r from t1;
                  select * into r from t1 where a = 1;
                end;
                """));
        assertNotReported(result, "record \"r\" is assigned a value of different structure");
    }

    @Test
    void recordFieldsFollowLatestAssignment() {
        CheckOptions options = CheckOptions.defaults();
        options.setFatalErrors(false);

        CheckResult result = check(function("void", """
                declare
                  r record;
                begin
                  select * into r from t1;
                  raise notice '%', r.b;
                  select * into r from t2;
                  raise notice '%', r.b;
                end;
                """), options);

        Diagnostic diagnostic = assertReported(result, "record \"r\" has no field \"b\"");
        assertEquals(7, diagnostic.getLineno(), "only the use after the second assignment fails");
        assertEquals(1, result.countErrors());
    }

    // ========== Implicit casts in predicates ==========

    @Test
    void columnCastToVariableType() {
        CheckOptions options = CheckOptions.defaults();
        options.setPerformanceWarnings(true);

        Diagnostic diagnostic = assertReported(check(function("void", """
                declare
                  v numeric := 1.5;
                begin
                  perform b from t1 where a = v;
                end;
                """), options), "implicit cast of attribute caused by different PLpgSQL variable type in WHERE clause");

        assertEquals(Severity.WARNING_PERFORMANCE, diagnostic.getSeverity());
        assertEquals("42804", diagnostic.getSqlState());
        assertEquals("Check a variable type - int versus numeric", diagnostic.getHint());
    }

    @Test
    void variableOfColumnTypeNeedsNoCast() {
        CheckOptions options = CheckOptions.defaults();
        options.setPerformanceWarnings(true);

        assertNotReported(check(function("void", """
                declare
                  v integer := 1;
                begin
                  perform b from t1 where a = v;
                end;
                """), options), "implicit cast of attribute caused by different PLpgSQL variable type in WHERE clause");
    }

    @Test
    void implicitCastCheckCanBeSwitchedOffAlone() {
        CheckOptions options = CheckOptions.defaults();
        options.setPerformanceWarnings(true);
        options.setFishyCastCheck(false);

        assertNotReported(check(function("void", """
                declare
                  v numeric := 1.5;
                begin
                  perform b from t1 where a = v;
                end;
                """), options), "implicit cast of attribute caused by different PLpgSQL variable type in WHERE clause");
    }
}
