package me.christianrobert.plpgcheck.ast;

import java.util.List;

/**
 * OPEN of a bound cursor with arguments, of an unbound cursor FOR a query, or FOR EXECUTE.
 */
public class OpenStmt extends PlStatement {

    private final int cursorVarno;
    private final PlExpression query;
    private final PlExpression dynamicQuery;
    private final List<PlExpression> params;
    private final List<PlExpression> arguments;

    public OpenStmt(int lineno, int cursorVarno, PlExpression query, PlExpression dynamicQuery,
                    List<PlExpression> params, List<PlExpression> arguments) {
        super(StatementKind.OPEN, lineno);
        this.cursorVarno = cursorVarno;
        this.query = query;
        this.dynamicQuery = dynamicQuery;
        this.params = params;
        this.arguments = arguments;
    }

    public int getCursorVarno() {
        return cursorVarno;
    }

    public PlExpression getQuery() {
        return query;
    }

    public PlExpression getDynamicQuery() {
        return dynamicQuery;
    }

    public List<PlExpression> getParams() {
        return params;
    }

    /**
     * Arguments passed to a bound cursor; {@code null} when the OPEN has no argument list.
     */
    public List<PlExpression> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitOpen(this);
    }
}
