package me.christianrobert.plpgcheck.ast;

public class AssertStmt extends PlStatement {

    private final PlExpression condition;
    private final PlExpression message;

    public AssertStmt(int lineno, PlExpression condition, PlExpression message) {
        super(StatementKind.ASSERT, lineno);
        this.condition = condition;
        this.message = message;
    }

    public PlExpression getCondition() {
        return condition;
    }

    public PlExpression getMessage() {
        return message;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAssert(this);
    }
}
