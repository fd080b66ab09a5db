package me.christianrobert.plpgcheck.ast;

import java.util.List;

/**
 * {@code FOR i IN [REVERSE] lower .. upper [BY step] LOOP}. The loop variable is declared implicitly.
 */
public class ForIntegerStmt extends LoopStatement {

    private final int varno;
    private final PlExpression lower;
    private final PlExpression upper;
    private final PlExpression step;
    private final boolean reverse;

    public ForIntegerStmt(int lineno, String label, int varno, PlExpression lower, PlExpression upper,
                          PlExpression step, boolean reverse, List<PlStatement> body) {
        super(StatementKind.FORI, lineno, label, body);
        this.varno = varno;
        this.lower = lower;
        this.upper = upper;
        this.step = step;
        this.reverse = reverse;
    }

    public int getVarno() {
        return varno;
    }

    public PlExpression getLower() {
        return lower;
    }

    public PlExpression getUpper() {
        return upper;
    }

    public PlExpression getStep() {
        return step;
    }

    public boolean isReverse() {
        return reverse;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitForInteger(this);
    }
}
