package me.christianrobert.plpgcheck.ast;

import java.util.List;

public class ForeachStmt extends LoopStatement {

    private final int targetVarno;
    private final int slice;
    private final PlExpression expression;

    public ForeachStmt(int lineno, String label, int targetVarno, int slice, PlExpression expression,
                       List<PlStatement> body) {
        super(StatementKind.FOREACH_A, lineno, label, body);
        this.targetVarno = targetVarno;
        this.slice = slice;
        this.expression = expression;
    }

    public int getTargetVarno() {
        return targetVarno;
    }

    public int getSlice() {
        return slice;
    }

    public PlExpression getExpression() {
        return expression;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitForeach(this);
    }
}
