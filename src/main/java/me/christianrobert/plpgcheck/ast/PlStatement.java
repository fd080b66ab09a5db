package me.christianrobert.plpgcheck.ast;

/**
 * A node of the compiled statement tree. Statements with line number 0 were added by the
 * compiler and are invisible to reports and coverage.
 */
public abstract class PlStatement {

    private final StatementKind kind;
    private final int lineno;
    private int stmtId;

    protected PlStatement(StatementKind kind, int lineno) {
        this.kind = kind;
        this.lineno = lineno;
    }

    public StatementKind getKind() {
        return kind;
    }

    public int getLineno() {
        return lineno;
    }

    public boolean isVisible() {
        return lineno > 0;
    }

    /**
     * Position of the statement in walk order, starting at 1.
     */
    public int getStmtId() {
        return stmtId;
    }

    public void setStmtId(int stmtId) {
        this.stmtId = stmtId;
    }

    public String getTypeName() {
        return kind.getDisplayName();
    }

    public abstract <R> R accept(StatementVisitor<R> visitor);
}
