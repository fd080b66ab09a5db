package me.christianrobert.plpgcheck.coverage;

import me.christianrobert.plpgcheck.ast.CompiledRoutine;
import me.christianrobert.plpgcheck.catalog.InMemoryCatalog;
import me.christianrobert.plpgcheck.parser.RoutineCompiler;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;
import me.christianrobert.plpgcheck.routine.RoutineParameter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for statement and branch coverage and the counters behind them.
 */
class CoverageCalculatorTest {

    private final CoverageCalculator calculator = new CoverageCalculator();
    private CompiledRoutine routine;

    @BeforeEach
    void setUp() {
        RoutineDefinition definition = new RoutineDefinition("public", "sign_of", """
                begin
                  if p > 0 then
                    return 1;
                  end if;
                  return 0;
                end;
                """);
        definition.setReturnType("integer");
        definition.addParameter(RoutineParameter.in("p", "integer"));
        routine = new RoutineCompiler().compile(definition, new InMemoryCatalog());
    }

    private StatementCounters executed(int... stmtIds) {
        StatementCounters counters = new StatementCounters(routine.getStatementCount());
        for (int stmtId : stmtIds) {
            counters.record(stmtId, 10);
        }
        return counters;
    }

    // ========== Inventory ==========

    @Test
    void inventory_listsVisibleStatementsInOrder() {
        StatementInventory inventory = StatementInventory.of(routine);

        assertEquals(4, inventory.size(), "block, IF and two RETURNs");
        assertEquals(1, inventory.getEntries().get(0).getStmtId());
        assertEquals(0, inventory.getEntries().get(0).getParentId());
        assertEquals(2, inventory.getEntries().get(2).getParentId(), "the first RETURN sits in the IF");
        assertEquals(5, inventory.getEntries().get(3).getLineno());
    }

    // ========== Statement coverage ==========

    @Test
    void statements_countsExecutedStatements() {
        assertEquals(0.75, calculator.statements(routine, executed(1, 2, 4)), 0.0001);
        assertEquals(1.0, calculator.statements(routine, executed(1, 2, 3, 4)), 0.0001);
        assertEquals(0.0, calculator.statements(routine, executed()), 0.0001);
    }

    // ========== Branch coverage ==========

    @Test
    void branches_ifWithoutElseHasImplicitFallThrough() {
        assertEquals(0.5, calculator.branches(routine, executed(1, 2, 4)), 0.0001,
                "only the fall through branch ran");
        assertEquals(0.5, calculator.branches(routine, executed(1, 2, 3)), 0.0001,
                "only the THEN branch ran");
    }

    @Test
    void branches_bothBranchesTaken() {
        StatementCounters counters = executed(1, 2, 3, 1, 2, 4);
        assertEquals(1.0, calculator.branches(routine, counters), 0.0001);
    }

    // ========== Counters ==========

    @Test
    void counters_ignoreUnknownStatements() {
        StatementCounters counters = executed(0, 99, 2, 2);
        assertEquals(0, counters.getExecutions(0));
        assertEquals(0, counters.getExecutions(99));
        assertEquals(2, counters.getExecutions(2));
        assertEquals(20, counters.getTotalMicros(2));
    }

    @Test
    void counters_copyIsIndependent() {
        StatementCounters counters = executed(1);
        StatementCounters copy = counters.copy();
        counters.record(1, 5);

        assertEquals(1, copy.getExecutions(1));
        assertEquals(2, counters.getExecutions(1));
    }
}
