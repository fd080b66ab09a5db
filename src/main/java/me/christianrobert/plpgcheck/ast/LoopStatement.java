package me.christianrobert.plpgcheck.ast;

import java.util.List;

/**
 * Common shape of all loops: an optional label and a body.
 */
public abstract class LoopStatement extends PlStatement {

    private final String label;
    private final List<PlStatement> body;

    protected LoopStatement(StatementKind kind, int lineno, String label, List<PlStatement> body) {
        super(kind, lineno);
        this.label = label;
        this.body = body;
    }

    public String getLabel() {
        return label;
    }

    public List<PlStatement> getBody() {
        return body;
    }
}
