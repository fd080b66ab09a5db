package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.routine.RoutineDefinition;
import me.christianrobert.plpgcheck.routine.RoutineParameter;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for request validation done before a routine is examined, and for trigger
 * relations.
 */
class CheckStateManagerTest extends PlPgSqlCheckTestBase {

    private static RoutineDefinition trigger(String source) {
        return function("trigger", source);
    }

    private InvalidInputException invalid(CheckRequest request) {
        return assertThrows(InvalidInputException.class, () -> checker.check(request));
    }

    // ========== Language ==========

    @Test
    void onlyPlpgsqlIsChecked() {
        RoutineDefinition routine = function("integer", "select 1");
        routine.setLanguage("sql");

        InvalidInputException e = invalid(new CheckRequest(routine, catalog));
        assertEquals("0A000", e.getSqlState());
        assertTrue(e.getMessage().contains("sql"));
    }

    // ========== Trigger relations ==========

    @Test
    void triggerNeedsRelation() {
        InvalidInputException e = invalid(new CheckRequest(trigger("begin return new; end;"), catalog));
        assertEquals("missing trigger relation", e.getMessage());
    }

    @Test
    void triggerRelationMustExist() {
        InvalidInputException e = invalid(new CheckRequest(trigger("begin return new; end;"), catalog)
                .relation("nosuch"));
        assertEquals("42P01", e.getSqlState());
    }

    @Test
    void relationOnlyForTriggers() {
        InvalidInputException e = invalid(new CheckRequest(function("void", "begin null; end;"), catalog)
                .relation("t1"));
        assertEquals("function is not trigger", e.getMessage());
    }

    @Test
    void transitionTablesNeedRelation() {
        CheckOptions options = CheckOptions.defaults();
        options.setNewTable("newtab");

        InvalidInputException e = invalid(new CheckRequest(function("void", "begin null; end;"), catalog)
                .options(options));
        assertEquals("missing description of trigger relation for transition tables", e.getMessage());
    }

    @Test
    void triggerChecksAgainstRelation() {
        CheckResult result = checker.check(new CheckRequest(trigger("""
                begin
                  new.a := new.a + 1;
                  return new;
                end;
                """), catalog).relation("t1"));

        assertFalse(result.hasErrors(), "diagnostics: " + result.getDiagnostics());
    }

    @Test
    void transitionTableIsQueryable() {
        CheckOptions options = CheckOptions.defaults();
        options.setNewTable("newtab");

        CheckResult result = checker.check(new CheckRequest(trigger("""
                begin
                  perform a from newtab;
                  return new;
                end;
                """), catalog).relation("t1").options(options));

        assertNotReported(result, "relation \"newtab\" does not exist");
        assertFalse(result.hasErrors(), "diagnostics: " + result.getDiagnostics());
    }

    // ========== Polymorphic substitutions ==========

    @Test
    void unknownSubstitutionType() {
        CheckOptions options = CheckOptions.defaults();
        options.setPolymorphicTypes(Map.of("anyelement", "nosuchtype"));

        InvalidInputException e = invalid(new CheckRequest(function("void", "begin null; end;"), catalog)
                .options(options));
        assertEquals("42704", e.getSqlState());
    }

    @Test
    void polymorphicSubstitutionIsRejected() {
        CheckOptions options = CheckOptions.defaults();
        options.setPolymorphicTypes(Map.of("anyelement", "anyarray"));

        InvalidInputException e = invalid(new CheckRequest(function("void", "begin null; end;"), catalog)
                .options(options));
        assertEquals("42804", e.getSqlState());
    }

    @Test
    void polymorphicParameterUsesSubstitute() {
        RoutineDefinition routine = function("anyelement", """
                begin
                  return p;
                end;
                """);
        routine.addParameter(RoutineParameter.in("p", "anyelement"));

        CheckResult result = check(routine);
        assertFalse(result.hasErrors(), "diagnostics: " + result.getDiagnostics());
    }
}
