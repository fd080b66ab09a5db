package me.christianrobert.plpgcheck.ast;

/**
 * EXIT or CONTINUE, optionally labelled and conditional.
 */
public class ExitStmt extends PlStatement {

    private final boolean exit;
    private final String label;
    private final PlExpression condition;

    public ExitStmt(int lineno, boolean exit, String label, PlExpression condition) {
        super(StatementKind.EXIT, lineno);
        this.exit = exit;
        this.label = label;
        this.condition = condition;
    }

    public boolean isExit() {
        return exit;
    }

    public String getLabel() {
        return label;
    }

    public PlExpression getCondition() {
        return condition;
    }

    @Override
    public String getTypeName() {
        return exit ? "EXIT" : "CONTINUE";
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExit(this);
    }
}
