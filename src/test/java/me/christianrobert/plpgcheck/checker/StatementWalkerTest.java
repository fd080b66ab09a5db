package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.diagnostic.Diagnostic;
import me.christianrobert.plpgcheck.diagnostic.Severity;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;
import me.christianrobert.plpgcheck.routine.RoutineKind;
import me.christianrobert.plpgcheck.routine.RoutineParameter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the statement walk: control flow, RAISE, loops, transaction control and
 * variable declarations.
 */
class StatementWalkerTest extends PlPgSqlCheckTestBase {

    private static final String MISSING_RETURN = "control reached end of function without RETURN";

    // ========== Control flow ==========

    @Test
    void unreachableCodeAfterReturn() {
        CheckResult result = check(function("integer", """
                begin
                  return 1;
                  raise notice 'never';
                end;
                """));

        Diagnostic diagnostic = assertReported(result, "unreachable code");
        assertEquals(Severity.WARNING_EXTRA, diagnostic.getSeverity());
        assertEquals(3, diagnostic.getLineno());
        assertEquals("RAISE", diagnostic.getStatement());
        assertNotReported(result, MISSING_RETURN);
    }

    @Test
    void missingReturnIsAnError() {
        CheckResult result = check(function("integer", """
                begin
                  null;
                end;
                """));

        Diagnostic diagnostic = assertReported(result, MISSING_RETURN);
        assertEquals(Severity.ERROR, diagnostic.getSeverity());
        assertEquals("2F005", diagnostic.getSqlState());
        assertNull(diagnostic.getStatement(), "reported for the whole routine");
        assertTrue(result.hasErrors());
    }

    @Test
    void returnOnOneBranchOnlyIsAWarning() {
        RoutineDefinition routine = function("integer", """
                begin
                  if p > 0 then
                    return 1;
                  end if;
                end;
                """);
        routine.addParameter(RoutineParameter.in("p", "integer"));

        CheckResult result = check(routine);

        Diagnostic diagnostic = assertReported(result, MISSING_RETURN);
        assertEquals(Severity.WARNING_EXTRA, diagnostic.getSeverity(), "the IF may return");
        assertFalse(result.hasErrors());
    }

    @Test
    void returnOnBothBranchesCloses() {
        RoutineDefinition routine = function("integer", """
                begin
                  if p > 0 then
                    return 1;
                  else
                    return 0;
                  end if;
                end;
                """);
        routine.addParameter(RoutineParameter.in("p", "integer"));

        assertNotReported(check(routine), MISSING_RETURN);
    }

    @Test
    void handlerReturnClosesRaisingBlock() {
        CheckResult result = check(function("integer", """
                begin
                  raise exception 'boom';
                exception
                  when others then
                    return 0;
                end;
                """));

        assertNotReported(result, MISSING_RETURN);
        assertFalse(result.hasErrors(), "raise and handler together leave by RETURN");
    }

    @Test
    void fallThroughHandlerDecidesBlockWithUncaughtCodes() {
        RoutineDefinition routine = function("integer", """
                begin
                  begin
                    if p > 0 then
                      raise division_by_zero;
                    else
                      raise unique_violation;
                    end if;
                  exception
                    when division_by_zero then
                      null;
                  end;
                end;
                """);
        routine.addParameter(RoutineParameter.in("p", "integer"));

        Diagnostic diagnostic = assertReported(check(routine), MISSING_RETURN);
        assertEquals(Severity.ERROR, diagnostic.getSeverity(), "the handler falls through to the end");
        assertEquals("2F005", diagnostic.getSqlState());
    }

    @Test
    void reraisingHandlerKeepsUncaughtCodes() {
        RoutineDefinition routine = function("integer", """
                begin
                  begin
                    if p > 0 then
                      raise division_by_zero;
                    else
                      raise unique_violation;
                    end if;
                  exception
                    when division_by_zero then
                      raise;
                  end;
                end;
                """);
        routine.addParameter(RoutineParameter.in("p", "integer"));

        assertNotReported(check(routine), MISSING_RETURN);
    }

    @Test
    void proceduresNeedNoReturn() {
        RoutineDefinition routine = function("void", """
                begin
                  null;
                end;
                """);
        routine.setKind(RoutineKind.PROCEDURE);

        assertNotReported(check(routine), MISSING_RETURN);
    }

    // ========== RETURN ==========

    @Test
    void returnValueInVoidFunction() {
        Diagnostic diagnostic = assertReported(check(function("void", """
                begin
                  return 1;
                end;
                """)), "RETURN cannot have a parameter in function returning void");
        assertEquals("42804", diagnostic.getSqlState());
        assertEquals("RETURN", diagnostic.getStatement());
    }

    @Test
    void returnNextInScalarFunction() {
        assertReported(check(function("integer", """
                begin
                  return next 1;
                end;
                """)), "cannot use RETURN NEXT in a non-SETOF function");
    }

    @Test
    void returnQueryStructureMustMatch() {
        RoutineDefinition routine = function("integer", """
                begin
                  return query select 1, 2;
                end;
                """);
        routine.setReturnsSet(true);

        assertReported(check(routine), "structure of query does not match function result type");
    }

    // ========== RAISE ==========

    @Test
    void raiseWithTooFewParameters() {
        Diagnostic diagnostic = assertReported(check(function("void", """
                begin
                  raise notice 'a % b %', 1;
                end;
                """)), "too few parameters specified for RAISE");
        assertEquals("42601", diagnostic.getSqlState());
        assertEquals(2, diagnostic.getLineno());
    }

    @Test
    void raiseWithTooManyParameters() {
        assertReported(check(function("void", """
                begin
                  raise notice 'a', 1;
                end;
                """)), "too many parameters specified for RAISE");
    }

    @Test
    void reraiseOutsideHandler() {
        Diagnostic diagnostic = assertReported(check(function("void", """
                begin
                  raise;
                end;
                """)), "RAISE without parameters cannot be used outside an exception handler");
        assertEquals("0Z002", diagnostic.getSqlState());
    }

    @Test
    void reraiseInsideHandlerIsFine() {
        CheckResult result = check(function("void", """
                begin
                  perform 1;
                exception
                  when others then
                    raise;
                end;
                """));
        assertFalse(result.hasErrors());
    }

    // ========== EXIT and CONTINUE ==========

    @Test
    void exitOutsideLoop() {
        assertReported(check(function("void", """
                begin
                  exit;
                end;
                """)), "EXIT cannot be used outside a loop, unless it has a label");
    }

    @Test
    void exitWithUnknownLabel() {
        assertReported(check(function("void", """
                begin
                  loop
                    exit nope;
                  end loop;
                end;
                """)), "label \"nope\" does not exist");
    }

    @Test
    void continueWithBlockLabel() {
        assertReported(check(function("void", """
                <<blk>>
                begin
                  loop
                    continue blk;
                  end loop;
                end;
                """)), "block label \"blk\" cannot be used in CONTINUE");
    }

    // ========== Transaction control ==========

    @Test
    void commitInFunction() {
        Diagnostic diagnostic = assertReported(check(function("void", """
                begin
                  commit;
                end;
                """)), "invalid transaction termination");
        assertEquals("2D000", diagnostic.getSqlState());
    }

    @Test
    void commitInProcedureHandler() {
        RoutineDefinition routine = function("void", """
                begin
                  null;
                exception
                  when others then
                    commit;
                end;
                """);
        routine.setKind(RoutineKind.PROCEDURE);

        assertReported(check(routine), "cannot commit while a subtransaction is active");
    }

    @Test
    void commitInProcedureBody() {
        RoutineDefinition routine = function("void", """
                begin
                  commit;
                end;
                """);
        routine.setKind(RoutineKind.PROCEDURE);

        assertFalse(check(routine).hasErrors());
    }

    // ========== Declarations ==========

    @Test
    void innerVariableShadowsOuter() {
        Diagnostic diagnostic = assertReported(check(function("integer", """
                declare
                  x integer := 1;
                begin
                  declare
                    x integer := 2;
                  begin
                    return x;
                  end;
                end;
                """)), "variable \"x\" shadows a previously defined variable");
        assertEquals(Severity.WARNING_EXTRA, diagnostic.getSeverity());
    }

    @Test
    void variableOverlapsParameter() {
        RoutineDefinition routine = function("integer", """
                declare
                  a integer := 1;
                begin
                  return a;
                end;
                """);
        routine.addParameter(RoutineParameter.in("a", "integer"));

        Diagnostic diagnostic = assertReported(check(routine), "parameter \"a\" is overlapped");
        assertEquals(Severity.WARNING_OTHERS, diagnostic.getSeverity());
    }

    // ========== Usage ==========

    @Test
    void unusedVariable() {
        Diagnostic diagnostic = assertReported(check(function("integer", """
                declare
                  x integer;
                begin
                  return 1;
                end;
                """)), "unused variable \"x\"");
        assertEquals(Severity.WARNING_OTHERS, diagnostic.getSeverity());
        assertEquals(2, diagnostic.getLineno(), "reported at the declaration");
        assertNull(diagnostic.getStatement());
    }

    @Test
    void neverReadVariable() {
        CheckResult result = check(function("integer", """
                declare
                  x integer := 1;
                begin
                  return 1;
                end;
                """));
        assertReported(result, "never read variable \"x\"");
        assertNotReported(result, "unused variable \"x\"");
    }

    @Test
    void unusedAndNeverReadParameters() {
        RoutineDefinition routine = function("integer", """
                begin
                  q := 2;
                  return 1;
                end;
                """);
        routine.addParameter(RoutineParameter.in("p", "integer"));
        routine.addParameter(RoutineParameter.in("q", "integer"));

        CheckResult result = check(routine);

        assertReported(result, "unused parameter \"p\"");
        assertReported(result, "parameter \"q\" is never read");
    }

    @Test
    void unmodifiedOutVariable() {
        RoutineDefinition routine = function("integer", """
                begin
                end;
                """);
        routine.addParameter(RoutineParameter.out("r", "integer"));

        assertReported(check(routine), "unmodified OUT variable \"r\"");
    }

    @Test
    void warningsCanBeSwitchedOff() {
        CheckResult result = check(function("integer", """
                declare
                  x integer;
                begin
                  return 1;
                end;
                """), CheckOptions.defaults().withoutWarnings());

        assertTrue(result.getDiagnostics().isEmpty(), "only errors remain and there are none");
    }

    // ========== Volatility ==========

    @Test
    void volatileFunctionThatCouldBeImmutable() {
        RoutineDefinition routine = function("integer", """
                begin
                  return p + 1;
                end;
                """);
        routine.addParameter(RoutineParameter.in("p", "integer"));
        CheckOptions options = CheckOptions.defaults();
        options.setPerformanceWarnings(true);

        Diagnostic diagnostic = assertReported(check(routine, options), "routine is marked as VOLATILE, should be IMMUTABLE");
        assertEquals(Severity.WARNING_PERFORMANCE, diagnostic.getSeverity());
    }

    @Test
    void volatilityAdviceNeedsPerformanceWarnings() {
        RoutineDefinition routine = function("integer", """
                begin
                  return p + 1;
                end;
                """);
        routine.addParameter(RoutineParameter.in("p", "integer"));

        assertNotReported(check(routine), "routine is marked as VOLATILE, should be IMMUTABLE");
    }

    // ========== FOREACH ==========

    @Test
    void foreachOverArray() {
        CheckResult result = check(function("integer", """
                declare
                  x integer;
                  s integer := 0;
                begin
                  foreach x in array array[1, 2, 3] loop
                    s := s + x;
                  end loop;
                  return s;
                end;
                """));
        assertTrue(result.getDiagnostics().isEmpty(), "diagnostics: " + result.getDiagnostics());
    }

    @Test
    void foreachOverScalar() {
        Diagnostic diagnostic = assertReported(check(function("void", """
                declare
                  x integer;
                begin
                  foreach x in array 1 loop
                    raise notice '%', x;
                  end loop;
                end;
                """)), "FOREACH expression must yield an array, not type integer");

        assertEquals(Severity.ERROR, diagnostic.getSeverity());
        assertEquals("42804", diagnostic.getSqlState());
    }

    @Test
    void foreachElementIntoIncompatibleTarget() {
        Diagnostic diagnostic = assertReported(check(function("void", """
                declare
                  d date;
                begin
                  foreach d in array array[1, 2] loop
                    raise notice '%', d;
                  end loop;
                end;
                """)), "target type is different type than source type");
        assertEquals("cast \"integer\" value to \"date\" type", diagnostic.getDetail());
    }

    // ========== GET DIAGNOSTICS ==========

    @Test
    void getDiagnosticsRowCount() {
        CheckResult result = check(function("bigint", """
                declare
                  n bigint;
                begin
                  update t1 set b = 'x';
                  get diagnostics n = row_count;
                  return n;
                end;
                """));
        assertTrue(result.getDiagnostics().isEmpty(), "diagnostics: " + result.getDiagnostics());
    }

    @Test
    void getDiagnosticsIntoIncompatibleTarget() {
        assertReported(check(function("void", """
                declare
                  d date;
                begin
                  get diagnostics d = row_count;
                  raise notice '%', d;
                end;
                """)), "target type is different type than source type");
    }

    @Test
    void getStackedDiagnosticsOutsideHandler() {
        Diagnostic diagnostic = assertReported(check(function("void", """
                declare
                  msg text;
                begin
                  get stacked diagnostics msg = message_text;
                  raise notice '%', msg;
                end;
                """)), "GET STACKED DIAGNOSTICS cannot be used outside an exception handler");
        assertEquals("0Z002", diagnostic.getSqlState());
    }

    @Test
    void getStackedDiagnosticsInsideHandler() {
        CheckResult result = check(function("void", """
                declare
                  msg text;
                begin
                  perform 1 / 0;
                exception
                  when others then
                    get stacked diagnostics msg = message_text;
                    raise notice '%', msg;
                end;
                """));
        assertFalse(result.hasErrors(), "diagnostics: " + result.getDiagnostics());
    }

    // ========== Cursors ==========

    @Test
    void boundCursorWithMatchingArguments() {
        CheckResult result = check(function("void", """
                declare
                  c cursor (k integer) for select b from t1 where a = k;
                begin
                  open c(1);
                  close c;
                end;
                """));
        assertFalse(result.hasErrors(), "diagnostics: " + result.getDiagnostics());
    }

    @Test
    void boundCursorWithoutArguments() {
        Diagnostic diagnostic = assertReported(check(function("void", """
                declare
                  c cursor (k integer) for select b from t1 where a = k;
                begin
                  open c;
                end;
                """)), "not enough arguments for cursor \"c\"");
        assertEquals("42601", diagnostic.getSqlState());
    }

    @Test
    void boundCursorWithTooManyArguments() {
        assertReported(check(function("void", """
                declare
                  c cursor (k integer) for select b from t1 where a = k;
                begin
                  open c(1, 2);
                end;
                """)), "too many arguments for cursor \"c\"");
    }

    @Test
    void cursorLoopChecksArgumentsToo() {
        assertReported(check(function("void", """
                declare
                  c cursor (k integer) for select b from t1 where a = k;
                begin
                  for r in c loop
                    raise notice '%', r.b;
                  end loop;
                end;
                """)), "not enough arguments for cursor \"c\"");
    }

    // ========== Repeated runs ==========

    private static final String MIXED_PROBLEMS = """
            declare
              r record;
              unused integer;
            begin
              select * into r from t1;
              select * into r from t2;
              raise notice 'x %';
              return r.zz;
            end;
            """;

    private static List<String> lines(CheckResult result) {
        return result.getDiagnostics().stream().map(Diagnostic::toString).collect(Collectors.toList());
    }

    @Test
    void repeatedRunsGiveIdenticalDiagnostics() {
        CheckOptions options = CheckOptions.defaults();
        options.setFatalErrors(false);

        List<String> first = lines(check(function("integer", MIXED_PROBLEMS), options));
        List<String> second = lines(check(function("integer", MIXED_PROBLEMS), options));

        assertTrue(first.size() >= 3, "diagnostics: " + first);
        assertEquals(first, second);
    }

    @Test
    void fatalErrorsCutTheListAfterTheFirstError() {
        CheckOptions collectAll = CheckOptions.defaults();
        collectAll.setFatalErrors(false);
        CheckResult all = check(function("integer", MIXED_PROBLEMS), collectAll);
        CheckResult fatal = check(function("integer", MIXED_PROBLEMS));

        int firstError = 0;
        while (!all.getDiagnostics().get(firstError).isError()) {
            firstError++;
        }
        assertEquals(lines(all).subList(0, firstError + 1), lines(fatal));
        assertEquals("too few parameters specified for RAISE", fatal.getDiagnostics().get(firstError).getMessage());
    }

    // ========== Fatal errors ==========

    @Test
    void firstErrorStopsTheCheckByDefault() {
        CheckResult result = check(function("void", """
                begin
                  exit;
                  continue;
                end;
                """));
        assertEquals(1, result.countErrors());
    }

    @Test
    void allErrorsAreCollectedWithoutFatalErrors() {
        CheckOptions options = CheckOptions.defaults();
        options.setFatalErrors(false);

        CheckResult result = check(function("void", """
                begin
                  exit;
                  continue;
                end;
                """), options);

        assertEquals(2, result.countErrors());
        assertReported(result, "CONTINUE cannot be used outside a loop");
    }
}
