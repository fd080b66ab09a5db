package me.christianrobert.plpgcheck.ast;

import java.util.List;

/**
 * Simple ({@code CASE x WHEN 1 THEN}) or searched ({@code CASE WHEN x = 1 THEN}) CASE statement.
 */
public class CaseStmt extends PlStatement {

    public static class CaseWhen {
        private final int lineno;
        private final PlExpression expression;
        private final List<PlStatement> body;

        public CaseWhen(int lineno, PlExpression expression, List<PlStatement> body) {
            this.lineno = lineno;
            this.expression = expression;
            this.body = body;
        }

        public int getLineno() {
            return lineno;
        }

        public PlExpression getExpression() {
            return expression;
        }

        public List<PlStatement> getBody() {
            return body;
        }
    }

    private final PlExpression testExpression;
    private final List<CaseWhen> whens;
    private final List<PlStatement> elseBody;

    public CaseStmt(int lineno, PlExpression testExpression, List<CaseWhen> whens, List<PlStatement> elseBody) {
        super(StatementKind.CASE, lineno);
        this.testExpression = testExpression;
        this.whens = whens;
        this.elseBody = elseBody;
    }

    /**
     * @return the tested expression, or {@code null} for a searched CASE
     */
    public PlExpression getTestExpression() {
        return testExpression;
    }

    public List<CaseWhen> getWhens() {
        return whens;
    }

    public List<PlStatement> getElseBody() {
        return elseBody;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitCase(this);
    }
}
