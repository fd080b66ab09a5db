package me.christianrobert.plpgcheck.ast;

import java.util.List;

/**
 * {@code FOR rec IN cursor[(args)] LOOP}; {@code rec} is declared implicitly as a record.
 */
public class ForCursorStmt extends LoopStatement {

    private final int targetVarno;
    private final int cursorVarno;
    private final List<PlExpression> arguments;

    public ForCursorStmt(int lineno, String label, int targetVarno, int cursorVarno, List<PlExpression> arguments,
                         List<PlStatement> body) {
        super(StatementKind.FORC, lineno, label, body);
        this.targetVarno = targetVarno;
        this.cursorVarno = cursorVarno;
        this.arguments = arguments;
    }

    public int getTargetVarno() {
        return targetVarno;
    }

    public int getCursorVarno() {
        return cursorVarno;
    }

    public List<PlExpression> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitForCursor(this);
    }
}
