package me.christianrobert.plpgcheck.parser;

import me.christianrobert.plpgcheck.ast.BlockStmt;
import me.christianrobert.plpgcheck.ast.CompiledRoutine;
import me.christianrobert.plpgcheck.ast.Datum;
import me.christianrobert.plpgcheck.ast.PlStatement;
import me.christianrobert.plpgcheck.ast.ReturnStmt;
import me.christianrobert.plpgcheck.ast.StatementKind;
import me.christianrobert.plpgcheck.catalog.InMemoryCatalog;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;
import me.christianrobert.plpgcheck.routine.RoutineParameter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RoutineCompiler: parsing, datum allocation and compile time errors.
 */
class RoutineCompilerTest {

    private final RoutineCompiler compiler = new RoutineCompiler();
    private final InMemoryCatalog catalog = new InMemoryCatalog().addTable("public.t1", "a integer", "b text");

    private static RoutineDefinition routine(String returnType, String source) {
        RoutineDefinition definition = new RoutineDefinition("public", "f1", source);
        definition.setReturnType(returnType);
        return definition;
    }

    private RoutineCompileException compileError(RoutineDefinition definition) {
        return assertThrows(RoutineCompileException.class, () -> compiler.compile(definition, catalog));
    }

    // ========== Syntax ==========

    @Test
    void compile_syntaxErrorReportsFirstLine() {
        RoutineCompileException e = compileError(routine("void", """
                begin
                  if true then
                    null;
                end;
                """));

        assertEquals("syntax error", e.getMessage());
        assertEquals("42601", e.getSqlState());
        assertTrue(e.getLineno() > 0, "line of the first syntax error is known");
        assertNotNull(e.getDetail(), "parser messages are carried as detail");
    }

    @Test
    void compile_emptyBodyIsRejected() {
        RoutineCompileException e = compileError(routine("void", "   "));
        assertEquals("routine body is empty", e.getMessage());
    }

    @Test
    void compile_endLabelMustMatch() {
        RoutineCompileException e = compileError(routine("void", """
                <<outer>>
                begin
                  null;
                end inner;
                """));
        assertEquals("end label \"inner\" differs from block's label \"outer\"", e.getMessage());
    }

    // ========== Declarations ==========

    @Test
    void compile_notNullWithoutDefault() {
        RoutineCompileException e = compileError(routine("void", """
                declare
                  x integer not null;
                begin
                  null;
                end;
                """));

        assertEquals("variable \"x\" must have a default value, since it's declared NOT NULL", e.getMessage());
        assertEquals("22004", e.getSqlState());
        assertEquals(2, e.getLineno(), "reported at the declaration");
    }

    @Test
    void compile_unknownTypeOfVariable() {
        RoutineCompileException e = compileError(routine("void", """
                declare
                  x no_such_type;
                begin
                  null;
                end;
                """));
        assertEquals("42704", e.getSqlState());
    }

    @Test
    void compile_aliasOfUnknownVariable() {
        RoutineCompileException e = compileError(routine("void", """
                declare
                  y alias for nothing_here;
                begin
                  null;
                end;
                """));
        assertEquals("variable \"nothing_here\" does not exist", e.getMessage());
    }

    // ========== Targets ==========

    @Test
    void compile_assignmentToConstant() {
        RoutineCompileException e = compileError(routine("void", """
                declare
                  c constant integer := 10;
                begin
                  c := 20;
                end;
                """));

        assertEquals("variable \"c\" is declared CONSTANT", e.getMessage());
        assertEquals("22005", e.getSqlState());
        assertEquals(4, e.getLineno());
    }

    @Test
    void compile_assignmentToUnknownVariable() {
        RoutineCompileException e = compileError(routine("void", """
                begin
                  nope := 1;
                end;
                """));
        assertEquals("\"nope\" is not a known variable", e.getMessage());
    }

    // ========== Exception handlers ==========

    @Test
    void compile_unknownExceptionCondition() {
        RoutineCompileException e = compileError(routine("void", """
                begin
                  null;
                exception
                  when no_such_condition then
                    null;
                end;
                """));
        assertEquals("unrecognized exception condition \"no_such_condition\"", e.getMessage());
    }

    @Test
    void compile_invalidSqlStateCode() {
        RoutineCompileException e = compileError(routine("void", """
                begin
                  null;
                exception
                  when sqlstate 'XX' then
                    null;
                end;
                """));
        assertEquals("invalid SQLSTATE code", e.getMessage());
    }

    // ========== Datums and statements ==========

    @Test
    void compile_datumOrderFollowsDeclaration() {
        RoutineDefinition definition = routine("integer", """
                declare
                  x integer := 1;
                  y text;
                begin
                  return x;
                end;
                """);
        definition.addParameter(RoutineParameter.in("p", "integer"));

        CompiledRoutine compiled = compiler.compile(definition, catalog);
        List<Datum> datums = compiled.getDatums();

        assertEquals("p", datums.get(0).getRefname(), "parameters come first");
        assertEquals("found", datums.get(1).getRefname(), "then FOUND");
        assertEquals("x", datums.get(2).getRefname());
        assertEquals("y", datums.get(3).getRefname());
        assertEquals(List.of(0), compiled.getParamVarnos());
        assertEquals(1, compiled.getFoundVarno());
        assertEquals(2, datums.get(2).getLineno());
    }

    @Test
    void compile_voidFunctionGetsInvisibleReturn() {
        CompiledRoutine compiled = compiler.compile(routine("void", """
                begin
                  perform 1;
                end;
                """), catalog);

        BlockStmt action = compiled.getAction();
        PlStatement last = action.getBody().get(action.getBody().size() - 1);
        assertTrue(last instanceof ReturnStmt, "an implicit RETURN is appended");
        assertFalse(last.isVisible());
        assertEquals(StatementKind.PERFORM, action.getBody().get(0).getKind());
        assertEquals(2, action.getBody().get(0).getLineno());
    }

    @Test
    void compile_scalarFunctionGetsNoImplicitReturn() {
        CompiledRoutine compiled = compiler.compile(routine("integer", """
                begin
                  perform 1;
                end;
                """), catalog);

        assertEquals(1, compiled.getAction().getBody().size());
    }

    @Test
    void compile_statementIdsAreAssigned() {
        CompiledRoutine compiled = compiler.compile(routine("void", """
                begin
                  if true then
                    perform 1;
                  end if;
                end;
                """), catalog);

        assertEquals(1, compiled.getAction().getStmtId(), "the top block is statement 1");
        assertEquals(4, compiled.getStatementCount(), "block, IF, PERFORM and the implicit RETURN");
    }
}
