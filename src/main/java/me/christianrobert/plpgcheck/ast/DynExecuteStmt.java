package me.christianrobert.plpgcheck.ast;

import java.util.List;

public class DynExecuteStmt extends PlStatement {

    private final PlExpression query;
    private final boolean into;
    private final boolean strict;
    private final int targetVarno;
    private final List<PlExpression> params;

    public DynExecuteStmt(int lineno, PlExpression query, boolean into, boolean strict, int targetVarno,
                          List<PlExpression> params) {
        super(StatementKind.DYNEXECUTE, lineno);
        this.query = query;
        this.into = into;
        this.strict = strict;
        this.targetVarno = targetVarno;
        this.params = params;
    }

    public PlExpression getQuery() {
        return query;
    }

    public boolean isInto() {
        return into;
    }

    public boolean isStrict() {
        return strict;
    }

    public int getTargetVarno() {
        return targetVarno;
    }

    public List<PlExpression> getParams() {
        return params;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitDynExecute(this);
    }
}
