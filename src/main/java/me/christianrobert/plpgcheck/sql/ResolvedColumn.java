package me.christianrobert.plpgcheck.sql;

import me.christianrobert.plpgcheck.catalog.PgType;

/**
 * One entry of a query's target list.
 */
public class ResolvedColumn {

    private final String name;
    private final PgType type;
    private final ResolvedExpr expression;

    public ResolvedColumn(String name, PgType type, ResolvedExpr expression) {
        this.name = name;
        this.type = type;
        this.expression = expression;
    }

    public String getName() {
        return name;
    }

    public PgType getType() {
        return type;
    }

    /**
     * The expression producing the column, {@code null} for columns expanded from {@code *}.
     */
    public ResolvedExpr getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return name + " " + type;
    }
}
