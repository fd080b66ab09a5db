package me.christianrobert.plpgcheck.ast;

import java.util.List;

public class ForDynamicStmt extends LoopStatement {

    private final int targetVarno;
    private final PlExpression query;
    private final List<PlExpression> params;

    public ForDynamicStmt(int lineno, String label, int targetVarno, PlExpression query, List<PlExpression> params,
                          List<PlStatement> body) {
        super(StatementKind.DYNFORS, lineno, label, body);
        this.targetVarno = targetVarno;
        this.query = query;
        this.params = params;
    }

    public int getTargetVarno() {
        return targetVarno;
    }

    /**
     * The expression producing the query string.
     */
    public PlExpression getQuery() {
        return query;
    }

    public List<PlExpression> getParams() {
        return params;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitForDynamic(this);
    }
}
