package me.christianrobert.plpgcheck.ast;

/**
 * FETCH or MOVE. MOVE has no target.
 */
public class FetchStmt extends PlStatement {

    private final int cursorVarno;
    private final int targetVarno;
    private final boolean move;
    private final String direction;

    public FetchStmt(int lineno, int cursorVarno, int targetVarno, boolean move, String direction) {
        super(StatementKind.FETCH, lineno);
        this.cursorVarno = cursorVarno;
        this.targetVarno = targetVarno;
        this.move = move;
        this.direction = direction;
    }

    public int getCursorVarno() {
        return cursorVarno;
    }

    public int getTargetVarno() {
        return targetVarno;
    }

    public boolean isMove() {
        return move;
    }

    public String getDirection() {
        return direction;
    }

    @Override
    public String getTypeName() {
        return move ? "MOVE" : "FETCH";
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFetch(this);
    }
}
