package me.christianrobert.plpgcheck.ast;

import java.util.List;

public class LoopStmt extends LoopStatement {

    public LoopStmt(int lineno, String label, List<PlStatement> body) {
        super(StatementKind.LOOP, lineno, label, body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitLoop(this);
    }
}
