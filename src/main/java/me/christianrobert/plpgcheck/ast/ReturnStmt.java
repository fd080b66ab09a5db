package me.christianrobert.plpgcheck.ast;

public class ReturnStmt extends PlStatement {

    private final PlExpression expression;

    public ReturnStmt(int lineno, PlExpression expression) {
        super(StatementKind.RETURN, lineno);
        this.expression = expression;
    }

    /**
     * @return the returned expression, or {@code null} for a bare RETURN
     */
    public PlExpression getExpression() {
        return expression;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }
}
