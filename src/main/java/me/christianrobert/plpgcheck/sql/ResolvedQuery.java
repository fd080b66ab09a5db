package me.christianrobert.plpgcheck.sql;

import me.christianrobert.plpgcheck.catalog.FunctionInfo;
import me.christianrobert.plpgcheck.catalog.OperatorInfo;
import me.christianrobert.plpgcheck.catalog.RelationInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of analyzing one query: its shape and everything it references.
 */
public class ResolvedQuery {

    private final CommandType commandType;
    private final String sql;
    private final List<ResolvedColumn> targetList = new ArrayList<>();
    private final List<RelationInfo> relations = new ArrayList<>();
    private final List<FunctionInfo> functions = new ArrayList<>();
    private final List<OperatorInfo> operators = new ArrayList<>();
    private final List<ParamRef> paramRefs = new ArrayList<>();
    private final List<ResolvedExpr> functionCalls = new ArrayList<>();
    private final List<ResolvedExpr> conditions = new ArrayList<>();
    private boolean returnsTuples;
    private boolean forUpdate;
    private boolean modifyingCte;
    private boolean opaque;

    public ResolvedQuery(CommandType commandType, String sql) {
        this.commandType = commandType;
        this.sql = sql;
    }

    public CommandType getCommandType() {
        return commandType;
    }

    public String getSql() {
        return sql;
    }

    public List<ResolvedColumn> getTargetList() {
        return targetList;
    }

    public boolean isReturnsTuples() {
        return returnsTuples;
    }

    public void setReturnsTuples(boolean returnsTuples) {
        this.returnsTuples = returnsTuples;
    }

    /**
     * Relations in the order they were first referenced, each once.
     */
    public List<RelationInfo> getRelations() {
        return Collections.unmodifiableList(relations);
    }

    void addRelation(RelationInfo relation) {
        for (RelationInfo known : relations) {
            if (known.getOid() == relation.getOid()) {
                return;
            }
        }
        relations.add(relation);
    }

    /**
     * Called functions in discovery order, each once.
     */
    public List<FunctionInfo> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    void addFunctionCall(ResolvedExpr call) {
        functionCalls.add(call);
        FunctionInfo function = call.getFunction();
        if (function != null && functions.stream().noneMatch(f -> f.getOid() == function.getOid())) {
            functions.add(function);
        }
    }

    /**
     * Every resolved function call node, duplicates included.
     */
    public List<ResolvedExpr> getFunctionCalls() {
        return Collections.unmodifiableList(functionCalls);
    }

    /**
     * User defined operators in discovery order, each once.
     */
    public List<OperatorInfo> getOperators() {
        return Collections.unmodifiableList(operators);
    }

    void addOperator(OperatorInfo operator) {
        if (operators.stream().noneMatch(o -> o.getOid() == operator.getOid())) {
            operators.add(operator);
        }
    }

    /**
     * Routine variables and positional parameters in order of reference.
     */
    public List<ParamRef> getParamRefs() {
        return Collections.unmodifiableList(paramRefs);
    }

    void addParamRef(ParamRef ref) {
        paramRefs.add(ref);
    }

    /**
     * WHERE, JOIN ... ON and HAVING conditions.
     */
    public List<ResolvedExpr> getConditions() {
        return Collections.unmodifiableList(conditions);
    }

    void addCondition(ResolvedExpr condition) {
        conditions.add(condition);
    }

    public boolean isForUpdate() {
        return forUpdate;
    }

    void setForUpdate(boolean forUpdate) {
        this.forUpdate = forUpdate;
    }

    /**
     * True when a WITH item runs INSERT, UPDATE or DELETE.
     */
    public boolean hasModifyingCte() {
        return modifyingCte;
    }

    void setModifyingCte(boolean modifyingCte) {
        this.modifyingCte = modifyingCte;
    }

    /**
     * True when the statement was accepted without analysis, so its shape is unknown.
     */
    public boolean isOpaque() {
        return opaque;
    }

    void setOpaque(boolean opaque) {
        this.opaque = opaque;
    }

    /**
     * True when the statement changes data, directly or through a WITH item.
     */
    public boolean isDataModifying() {
        return commandType.isDataModifying() || modifyingCte;
    }

    @Override
    public String toString() {
        return commandType + " " + targetList;
    }
}
