package me.christianrobert.plpgcheck.ast;

public class NullStmt extends PlStatement {

    public NullStmt(int lineno) {
        super(StatementKind.NULL, lineno);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitNull(this);
    }
}
