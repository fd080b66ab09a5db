package me.christianrobert.plpgcheck.ast;

import me.christianrobert.plpgcheck.catalog.PgType;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;
import me.christianrobert.plpgcheck.routine.TriggerType;

import java.util.List;

/**
 * The compiled form of a routine: its datums, indexed by varno, and its statement tree.
 */
public class CompiledRoutine {

    private final RoutineDefinition definition;
    private final List<Datum> datums;
    private final BlockStmt action;
    private final List<Integer> paramVarnos;
    private final int foundVarno;
    private final int outVarno;
    private final int newVarno;
    private final int oldVarno;
    private final PgType returnType;
    private final int statementCount;

    public CompiledRoutine(RoutineDefinition definition, List<Datum> datums, BlockStmt action,
                           List<Integer> paramVarnos, int foundVarno, int outVarno, int newVarno, int oldVarno,
                           PgType returnType, int statementCount) {
        this.definition = definition;
        this.datums = List.copyOf(datums);
        this.action = action;
        this.paramVarnos = List.copyOf(paramVarnos);
        this.foundVarno = foundVarno;
        this.outVarno = outVarno;
        this.newVarno = newVarno;
        this.oldVarno = oldVarno;
        this.returnType = returnType;
        this.statementCount = statementCount;
    }

    public RoutineDefinition getDefinition() {
        return definition;
    }

    public List<Datum> getDatums() {
        return datums;
    }

    public Datum getDatum(int varno) {
        return datums.get(varno);
    }

    public BlockStmt getAction() {
        return action;
    }

    /**
     * Datums of the declared arguments, in argument order, OUT arguments included.
     */
    public List<Integer> getParamVarnos() {
        return paramVarnos;
    }

    public int getFoundVarno() {
        return foundVarno;
    }

    /**
     * The datum holding the OUT arguments: the single OUT variable, a row over several of them, or -1.
     */
    public int getOutVarno() {
        return outVarno;
    }

    public boolean hasOutParams() {
        return outVarno >= 0;
    }

    public int getNewVarno() {
        return newVarno;
    }

    public int getOldVarno() {
        return oldVarno;
    }

    /**
     * The resolved result type, with polymorphic types already substituted.
     */
    public PgType getReturnType() {
        return returnType;
    }

    public boolean isReturnsSet() {
        return definition.isReturnsSet();
    }

    public boolean isProcedure() {
        return definition.isProcedure();
    }

    public TriggerType getTriggerType() {
        return definition.getTriggerType();
    }

    public int getStatementCount() {
        return statementCount;
    }
}
