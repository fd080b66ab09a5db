package me.christianrobert.plpgcheck.ast;

/**
 * An embedded SQL statement. The INTO clause has been cut out of the query text.
 */
public class ExecSqlStmt extends PlStatement {

    private final PlExpression query;
    private final boolean into;
    private final boolean strict;
    private final int targetVarno;

    public ExecSqlStmt(int lineno, PlExpression query, boolean into, boolean strict, int targetVarno) {
        super(StatementKind.EXECSQL, lineno);
        this.query = query;
        this.into = into;
        this.strict = strict;
        this.targetVarno = targetVarno;
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

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExecSql(this);
    }
}
