package me.christianrobert.plpgcheck.ast;

public class RollbackStmt extends PlStatement {

    private final boolean chain;

    public RollbackStmt(int lineno, boolean chain) {
        super(StatementKind.ROLLBACK, lineno);
        this.chain = chain;
    }

    public boolean isChain() {
        return chain;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitRollback(this);
    }
}
