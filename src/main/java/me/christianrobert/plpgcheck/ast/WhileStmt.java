package me.christianrobert.plpgcheck.ast;

import java.util.List;

public class WhileStmt extends LoopStatement {

    private final PlExpression condition;

    public WhileStmt(int lineno, String label, PlExpression condition, List<PlStatement> body) {
        super(StatementKind.WHILE, lineno, label, body);
        this.condition = condition;
    }

    public PlExpression getCondition() {
        return condition;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }
}
