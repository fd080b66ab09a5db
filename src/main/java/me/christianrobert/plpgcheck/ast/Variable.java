package me.christianrobert.plpgcheck.ast;

import me.christianrobert.plpgcheck.catalog.PgType;

import java.util.ArrayList;
import java.util.List;

/**
 * A scalar variable. Cursor variables are {@code refcursor} scalars, optionally bound to a query.
 */
public class Variable extends Datum {

    private final PgType type;
    private boolean constant;
    private boolean notNull;
    private PlExpression cursorQuery;
    private List<Integer> cursorArgVarnos = new ArrayList<>();

    public Variable(int varno, String refname, int lineno, PgType type) {
        super(varno, refname, lineno);
        this.type = type;
    }

    @Override
    public Kind getKind() {
        return Kind.VAR;
    }

    public PgType getType() {
        return type;
    }

    public boolean isConstant() {
        return constant;
    }

    public void setConstant(boolean constant) {
        this.constant = constant;
    }

    public boolean isNotNull() {
        return notNull;
    }

    public void setNotNull(boolean notNull) {
        this.notNull = notNull;
    }

    public PlExpression getCursorQuery() {
        return cursorQuery;
    }

    public void setCursorQuery(PlExpression cursorQuery) {
        this.cursorQuery = cursorQuery;
    }

    public boolean isBoundCursor() {
        return cursorQuery != null;
    }

    public List<Integer> getCursorArgVarnos() {
        return cursorArgVarnos;
    }

    public void setCursorArgVarnos(List<Integer> cursorArgVarnos) {
        this.cursorArgVarnos = cursorArgVarnos;
    }
}
