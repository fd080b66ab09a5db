package me.christianrobert.plpgcheck.ast;

public class CommitStmt extends PlStatement {

    private final boolean chain;

    public CommitStmt(int lineno, boolean chain) {
        super(StatementKind.COMMIT, lineno);
        this.chain = chain;
    }

    public boolean isChain() {
        return chain;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitCommit(this);
    }
}
