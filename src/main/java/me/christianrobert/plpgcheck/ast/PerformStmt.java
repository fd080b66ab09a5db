package me.christianrobert.plpgcheck.ast;

public class PerformStmt extends PlStatement {

    private final PlExpression expression;

    public PerformStmt(int lineno, PlExpression expression) {
        super(StatementKind.PERFORM, lineno);
        this.expression = expression;
    }

    /**
     * The query with PERFORM replaced by SELECT.
     */
    public PlExpression getExpression() {
        return expression;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitPerform(this);
    }
}
