package me.christianrobert.plpgcheck.ast;

public class ReturnNextStmt extends PlStatement {

    private final PlExpression expression;

    public ReturnNextStmt(int lineno, PlExpression expression) {
        super(StatementKind.RETURN_NEXT, lineno);
        this.expression = expression;
    }

    public PlExpression getExpression() {
        return expression;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReturnNext(this);
    }
}
