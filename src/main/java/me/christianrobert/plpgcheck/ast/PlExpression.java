package me.christianrobert.plpgcheck.ast;

/**
 * An embedded SQL expression or query: its text, the line it starts on and the names visible to it.
 */
public class PlExpression {

    private final String query;
    private final int lineno;
    private final Namespace namespace;

    public PlExpression(String query, int lineno, Namespace namespace) {
        this.query = query;
        this.lineno = lineno;
        this.namespace = namespace;
    }

    public String getQuery() {
        return query;
    }

    public int getLineno() {
        return lineno;
    }

    public Namespace getNamespace() {
        return namespace;
    }

    @Override
    public String toString() {
        return query;
    }
}
