package me.christianrobert.plpgcheck.ast;

public class CloseStmt extends PlStatement {

    private final int cursorVarno;

    public CloseStmt(int lineno, int cursorVarno) {
        super(StatementKind.CLOSE, lineno);
        this.cursorVarno = cursorVarno;
    }

    public int getCursorVarno() {
        return cursorVarno;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitClose(this);
    }
}
