package me.christianrobert.plpgcheck.ast;

import java.util.List;

/**
 * {@code RETURN QUERY query} or {@code RETURN QUERY EXECUTE expr [USING ...]}; exactly one of
 * query and dynamic query is set.
 */
public class ReturnQueryStmt extends PlStatement {

    private final PlExpression query;
    private final PlExpression dynamicQuery;
    private final List<PlExpression> params;

    public ReturnQueryStmt(int lineno, PlExpression query, PlExpression dynamicQuery, List<PlExpression> params) {
        super(StatementKind.RETURN_QUERY, lineno);
        this.query = query;
        this.dynamicQuery = dynamicQuery;
        this.params = params;
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

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReturnQuery(this);
    }
}
