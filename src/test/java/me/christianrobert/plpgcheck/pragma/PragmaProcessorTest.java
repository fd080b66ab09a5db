package me.christianrobert.plpgcheck.pragma;

import me.christianrobert.plpgcheck.catalog.InMemoryCatalog;
import me.christianrobert.plpgcheck.checker.CheckOptions;
import me.christianrobert.plpgcheck.checker.CheckRequest;
import me.christianrobert.plpgcheck.checker.CheckResult;
import me.christianrobert.plpgcheck.checker.PlPgSqlChecker;
import me.christianrobert.plpgcheck.diagnostic.Diagnostic;
import me.christianrobert.plpgcheck.diagnostic.Severity;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;
import me.christianrobert.plpgcheck.routine.RoutineParameter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for in-body pragmas, parsed directly and applied through a full check.
 */
class PragmaProcessorTest {

    private final InMemoryCatalog catalog = new InMemoryCatalog().addTable("public.t1", "a integer", "b text");
    private final PlPgSqlChecker checker = new PlPgSqlChecker();

    private CheckResult check(String returnType, String source) {
        return check(returnType, source, CheckOptions.defaults());
    }

    private CheckResult check(String returnType, String source, CheckOptions options) {
        return check(routine(returnType, source), options);
    }

    private CheckResult check(RoutineDefinition routine, CheckOptions options) {
        return checker.check(new CheckRequest(routine, catalog).options(options));
    }

    private static RoutineDefinition routine(String returnType, String source) {
        RoutineDefinition routine = new RoutineDefinition("public", "f1", source);
        routine.setReturnType(returnType);
        return routine;
    }

    private static Diagnostic find(CheckResult result, String message) {
        return result.getDiagnostics().stream()
                .filter(d -> message.equals(d.getMessage()))
                .findFirst()
                .orElse(null);
    }

    // ========== Directive extraction ==========

    @Test
    void directives_extractsEveryLiteral() {
        List<String> directives = PragmaProcessor.directives(
                "SELECT plpgsql_check_pragma('disable:check', 'echo:hi')");
        assertEquals(List.of("disable:check", "echo:hi"), directives);
    }

    @Test
    void directives_acceptsSchemaQualifiedCall() {
        assertEquals(List.of("enable:tracer"),
                PragmaProcessor.directives("public.plpgsql_check_pragma('enable:tracer')"));
    }

    @Test
    void directives_ignoresOtherCalls() {
        assertTrue(PragmaProcessor.directives("SELECT length('x')").isEmpty());
        assertTrue(PragmaProcessor.directives(null).isEmpty());
    }

    // ========== Feature switches ==========

    @Test
    void disableCheck_silencesTheRestOfTheBlock() {
        CheckResult result = check("void", """
                begin
                  perform plpgsql_check_pragma('disable:check');
                  raise notice 'a %';
                end;
                """);
        assertNull(find(result, "too few parameters specified for RAISE"));
    }

    @Test
    void disableCheck_endsWithItsBlock() {
        CheckResult result = check("void", """
                begin
                  begin
                    perform plpgsql_check_pragma('disable:check');
                  end;
                  raise notice 'a %';
                end;
                """);
        assertNotNull(find(result, "too few parameters specified for RAISE"),
                "the outer block is checked again");
    }

    @Test
    void status_addsNotice() {
        CheckResult result = check("void", """
                begin
                  perform plpgsql_check_pragma('status:extra_warnings');
                end;
                """);
        assertTrue(result.getNotices().contains("extra_warnings is active"), "notices: " + result.getNotices());
    }

    @Test
    void echo_substitutesRoutineName() {
        CheckResult result = check("void", """
                begin
                  perform plpgsql_check_pragma('echo:checking @@name');
                end;
                """);
        assertTrue(result.getNotices().contains("checking f1"), "notices: " + result.getNotices());
    }

    @Test
    void unknownPragma_isReportedAndSkipped() {
        CheckResult result = check("void", """
                begin
                  perform plpgsql_check_pragma('nosuch:thing');
                end;
                """);

        Diagnostic diagnostic = find(result, "Pragma \"nosuch\" on line 2 is not processed.");
        assertNotNull(diagnostic);
        assertEquals(Severity.WARNING_OTHERS, diagnostic.getSeverity());
        assertEquals("unknown pragma \"nosuch\"", diagnostic.getDetail());
    }

    @Test
    void unknownFeature_isReported() {
        CheckResult result = check("void", """
                begin
                  perform plpgsql_check_pragma('enable:nothing');
                end;
                """);
        Diagnostic diagnostic = find(result, "Pragma \"enable\" on line 2 is not processed.");
        assertNotNull(diagnostic);
        assertEquals("unknown feature \"nothing\"", diagnostic.getDetail());
    }

    @Test
    void enable_cannotTurnOnCategoryDisabledByOptions() {
        CheckOptions options = CheckOptions.defaults();
        options.setPerformanceWarnings(false);

        CheckResult result = check("void", """
                declare
                  x numeric := 1.5;
                  y integer;
                begin
                  perform plpgsql_check_pragma('enable:performance_warnings');
                  y := x;
                  perform plpgsql_check_pragma('status:performance_warnings');
                end;
                """, options);

        assertTrue(result.getDiagnostics().stream().noneMatch(d -> d.getSeverity() == Severity.WARNING_PERFORMANCE),
                "diagnostics: " + result.getDiagnostics());
        assertTrue(result.getNotices().contains("performance_warnings is disabled"), "notices: " + result.getNotices());
    }

    @Test
    void enable_restoresCategoryAllowedByOptions() {
        CheckOptions options = CheckOptions.defaults();
        options.setPerformanceWarnings(true);

        CheckResult result = check("void", """
                declare
                  x integer;
                begin
                  perform plpgsql_check_pragma('disable:performance_warnings');
                  perform plpgsql_check_pragma('enable:performance_warnings');
                  x := 1::bigint;
                end;
                """, options);

        Diagnostic diagnostic = find(result, "target type is different type than source type");
        assertNotNull(diagnostic, "diagnostics: " + result.getDiagnostics());
        assertEquals(Severity.WARNING_PERFORMANCE, diagnostic.getSeverity());
    }

    @Test
    void declarationPragma_coversEndOfRoutineChecks() {
        RoutineDefinition routine = routine("integer", """
                declare
                  d integer := plpgsql_check_pragma('disable:extra_warnings');
                begin
                  if p > 0 then
                    return 1;
                  end if;
                end;
                """);
        routine.addParameter(RoutineParameter.in("p", "integer"));

        CheckResult result = check(routine, CheckOptions.defaults());

        assertNull(find(result, "control reached end of function without RETURN"),
                "diagnostics: " + result.getDiagnostics());
        assertTrue(result.getDiagnostics().stream().noneMatch(d -> d.getSeverity() == Severity.WARNING_EXTRA),
                "diagnostics: " + result.getDiagnostics());
    }

    @Test
    void declarationPragma_ofInnerBlockOutlivesTheBlock() {
        CheckResult result = check("void", """
                begin
                  declare
                    d integer := plpgsql_check_pragma('disable:check');
                  begin
                    null;
                  end;
                  raise notice 'a %';
                end;
                """);
        assertNull(find(result, "too few parameters specified for RAISE"),
                "diagnostics: " + result.getDiagnostics());
    }

    @Test
    void bodyPragma_doesNotCoverEndOfRoutineChecks() {
        RoutineDefinition routine = routine("integer", """
                begin
                  if p > 0 then
                    perform plpgsql_check_pragma('disable:extra_warnings');
                    return 1;
                  end if;
                end;
                """);
        routine.addParameter(RoutineParameter.in("p", "integer"));

        Diagnostic diagnostic = find(check(routine, CheckOptions.defaults()),
                "control reached end of function without RETURN");
        assertNotNull(diagnostic);
        assertEquals(Severity.WARNING_EXTRA, diagnostic.getSeverity());
    }

    // ========== Types and relations ==========

    @Test
    void typeHint_shapesRecordVariable() {
        CheckResult withoutHint = check("integer", """
                declare
                  r record;
                begin
                  return r.a;
                end;
                """);
        assertNotNull(find(withoutHint, "record \"r\" is not assigned yet"));

        CheckResult withHint = check("integer", """
                declare
                  r record;
                begin
                  perform plpgsql_check_pragma('type: r (a integer, b text)');
                  return r.a;
                end;
                """);
        assertNull(find(withHint, "record \"r\" is not assigned yet"));
        assertFalse(withHint.hasErrors(), "diagnostics: " + withHint.getDiagnostics());
    }

    @Test
    void typeHint_requiresRecordVariable() {
        CheckResult result = check("integer", """
                declare
                  x integer := 1;
                begin
                  perform plpgsql_check_pragma('type: x (a integer)');
                  return x;
                end;
                """);
        Diagnostic diagnostic = find(result, "Pragma \"type\" on line 4 is not processed.");
        assertNotNull(diagnostic);
        assertEquals("Pragma \"settype\" can be applied only on variable of record type", diagnostic.getDetail());
    }

    @Test
    void table_declaresTemporaryTable() {
        CheckResult before = check("void", """
                begin
                  insert into tmp values (1, 'x');
                end;
                """);
        assertNotNull(find(before, "relation \"tmp\" does not exist"));

        CheckResult after = check("void", """
                begin
                  perform plpgsql_check_pragma('table: tmp(id integer, name text)');
                  insert into tmp values (1, 'x');
                end;
                """);
        assertFalse(after.hasErrors(), "diagnostics: " + after.getDiagnostics());
        assertNull(catalog.findRelation("tmp"), "the base catalog is left untouched");
    }

    @Test
    void table_requiresColumnList() {
        CheckResult result = check("void", """
                begin
                  perform plpgsql_check_pragma('table: tmp');
                end;
                """);
        Diagnostic diagnostic = find(result, "Pragma \"table\" on line 2 is not processed.");
        assertNotNull(diagnostic);
        assertEquals("Syntax error (expected table specification)", diagnostic.getDetail());
    }
}
