package me.christianrobert.plpgcheck.ast;

import java.util.List;

public class AssignStmt extends PlStatement {

    private final int targetVarno;
    private final List<PlExpression> subscripts;
    private final PlExpression expression;

    public AssignStmt(int lineno, int targetVarno, List<PlExpression> subscripts, PlExpression expression) {
        super(StatementKind.ASSIGN, lineno);
        this.targetVarno = targetVarno;
        this.subscripts = subscripts;
        this.expression = expression;
    }

    public int getTargetVarno() {
        return targetVarno;
    }

    /**
     * Array subscripts of the target, {@code a[i] := ...}; empty for plain targets.
     */
    public List<PlExpression> getSubscripts() {
        return subscripts;
    }

    public PlExpression getExpression() {
        return expression;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }
}
