package me.christianrobert.plpgcheck.coverage;

import java.util.Arrays;

/**
 * Execution counters of one routine, indexed by statement id. Not thread safe; the
 * profile store serializes updates per routine.
 */
public class StatementCounters {

    private final long[] executions;
    private final long[] totalMicros;

    public StatementCounters(int statementCount) {
        this.executions = new long[statementCount + 1];
        this.totalMicros = new long[statementCount + 1];
    }

    public void record(int stmtId, long micros) {
        if (stmtId <= 0 || stmtId >= executions.length) {
            return;
        }
        executions[stmtId]++;
        totalMicros[stmtId] += micros;
    }

    public long getExecutions(int stmtId) {
        return stmtId > 0 && stmtId < executions.length ? executions[stmtId] : 0;
    }

    public long getTotalMicros(int stmtId) {
        return stmtId > 0 && stmtId < totalMicros.length ? totalMicros[stmtId] : 0;
    }

    public int getStatementCount() {
        return executions.length - 1;
    }

    public StatementCounters copy() {
        StatementCounters copy = new StatementCounters(getStatementCount());
        System.arraycopy(executions, 0, copy.executions, 0, executions.length);
        System.arraycopy(totalMicros, 0, copy.totalMicros, 0, totalMicros.length);
        return copy;
    }

    @Override
    public String toString() {
        return "StatementCounters" + Arrays.toString(executions);
    }
}
