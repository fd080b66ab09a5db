package me.christianrobert.plpgcheck.ast;

import java.util.List;

public class IfStmt extends PlStatement {

    public static class ElsifClause {
        private final int lineno;
        private final PlExpression condition;
        private final List<PlStatement> body;

        public ElsifClause(int lineno, PlExpression condition, List<PlStatement> body) {
            this.lineno = lineno;
            this.condition = condition;
            this.body = body;
        }

        public int getLineno() {
            return lineno;
        }

        public PlExpression getCondition() {
            return condition;
        }

        public List<PlStatement> getBody() {
            return body;
        }
    }

    private final PlExpression condition;
    private final List<PlStatement> thenBody;
    private final List<ElsifClause> elsifs;
    private final List<PlStatement> elseBody;

    public IfStmt(int lineno, PlExpression condition, List<PlStatement> thenBody, List<ElsifClause> elsifs,
                  List<PlStatement> elseBody) {
        super(StatementKind.IF, lineno);
        this.condition = condition;
        this.thenBody = thenBody;
        this.elsifs = elsifs;
        this.elseBody = elseBody;
    }

    public PlExpression getCondition() {
        return condition;
    }

    public List<PlStatement> getThenBody() {
        return thenBody;
    }

    public List<ElsifClause> getElsifs() {
        return elsifs;
    }

    /**
     * @return the ELSE branch, or {@code null} when there is none
     */
    public List<PlStatement> getElseBody() {
        return elseBody;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
