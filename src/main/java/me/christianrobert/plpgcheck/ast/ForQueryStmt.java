package me.christianrobert.plpgcheck.ast;

import java.util.List;

public class ForQueryStmt extends LoopStatement {

    private final int targetVarno;
    private final PlExpression query;

    public ForQueryStmt(int lineno, String label, int targetVarno, PlExpression query, List<PlStatement> body) {
        super(StatementKind.FORS, lineno, label, body);
        this.targetVarno = targetVarno;
        this.query = query;
    }

    public int getTargetVarno() {
        return targetVarno;
    }

    public PlExpression getQuery() {
        return query;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitForQuery(this);
    }
}
