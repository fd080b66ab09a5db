package me.christianrobert.plpgcheck.coverage;

import me.christianrobert.plpgcheck.ast.CaseStmt;
import me.christianrobert.plpgcheck.ast.CompiledRoutine;
import me.christianrobert.plpgcheck.ast.IfStmt;
import me.christianrobert.plpgcheck.ast.LoopStatement;
import me.christianrobert.plpgcheck.ast.PlStatement;
import me.christianrobert.plpgcheck.ast.StatementScanner;

import java.util.List;

/**
 * Relates profiler counters to the statements of a routine.
 */
public class CoverageCalculator {

    /**
     * Executed visible statements divided by all visible statements; 1.0 for an empty routine.
     */
    public double statements(CompiledRoutine routine, StatementCounters counters) {
        StatementInventory inventory = StatementInventory.of(routine);
        if (inventory.size() == 0) {
            return 1.0;
        }
        int executed = 0;
        for (StatementInventory.Entry entry : inventory.getEntries()) {
            if (counters.getExecutions(entry.getStmtId()) > 0) {
                executed++;
            }
        }
        return (double) executed / inventory.size();
    }

    /**
     * Executed branches divided by all branches of IF, CASE and loop statements; 1.0 when
     * the routine has no branches.
     */
    public double branches(CompiledRoutine routine, StatementCounters counters) {
        int[] totals = new int[2];
        new StatementScanner() {
            @Override
            protected void onStatement(PlStatement stmt, PlStatement parent) {
                if (stmt instanceof IfStmt) {
                    IfStmt ifStmt = (IfStmt) stmt;
                    long taken = branch(ifStmt.getThenBody(), totals);
                    for (IfStmt.ElsifClause elsif : ifStmt.getElsifs()) {
                        taken += branch(elsif.getBody(), totals);
                    }
                    if (ifStmt.getElseBody() != null) {
                        branch(ifStmt.getElseBody(), totals);
                    } else {
                        fallThrough(counters.getExecutions(stmt.getStmtId()) - taken, totals);
                    }
                } else if (stmt instanceof CaseStmt) {
                    CaseStmt caseStmt = (CaseStmt) stmt;
                    for (CaseStmt.CaseWhen when : caseStmt.getWhens()) {
                        branch(when.getBody(), totals);
                    }
                    if (caseStmt.getElseBody() != null) {
                        branch(caseStmt.getElseBody(), totals);
                    }
                } else if (stmt instanceof LoopStatement) {
                    branch(((LoopStatement) stmt).getBody(), totals);
                }
            }

            private long branch(List<PlStatement> body, int[] totals) {
                long executions = firstExecutions(body, counters);
                totals[1]++;
                if (executions > 0) {
                    totals[0]++;
                }
                return executions;
            }

            private void fallThrough(long executions, int[] totals) {
                totals[1]++;
                if (executions > 0) {
                    totals[0]++;
                }
            }
        }.scan(routine.getAction());

        if (totals[1] == 0) {
            return 1.0;
        }
        return (double) totals[0] / totals[1];
    }

    private static long firstExecutions(List<PlStatement> body, StatementCounters counters) {
        if (body == null) {
            return 0;
        }
        for (PlStatement stmt : body) {
            if (stmt.isVisible()) {
                return counters.getExecutions(stmt.getStmtId());
            }
        }
        return 0;
    }
}
