package me.christianrobert.plpgcheck.ast;

public class CallStmt extends PlStatement {

    private final PlExpression expression;

    public CallStmt(int lineno, PlExpression expression) {
        super(StatementKind.CALL, lineno);
        this.expression = expression;
    }

    /**
     * The call without the CALL keyword, like {@code proc(a, b)}.
     */
    public PlExpression getExpression() {
        return expression;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
