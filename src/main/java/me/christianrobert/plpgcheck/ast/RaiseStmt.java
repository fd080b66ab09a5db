package me.christianrobert.plpgcheck.ast;

import java.util.List;

public class RaiseStmt extends PlStatement {

    public static class RaiseOption {
        private final String name;
        private final PlExpression expression;

        public RaiseOption(String name, PlExpression expression) {
            this.name = name;
            this.expression = expression;
        }

        public String getName() {
            return name;
        }

        public PlExpression getExpression() {
            return expression;
        }
    }

    private final String level;
    private final String conditionName;
    private final String sqlState;
    private final String message;
    private final List<PlExpression> params;
    private final List<RaiseOption> options;

    public RaiseStmt(int lineno, String level, String conditionName, String sqlState, String message,
                     List<PlExpression> params, List<RaiseOption> options) {
        super(StatementKind.RAISE, lineno);
        this.level = level;
        this.conditionName = conditionName;
        this.sqlState = sqlState;
        this.message = message;
        this.params = params;
        this.options = options;
    }

    /**
     * Lower-case level: {@code exception} (the default), {@code warning}, {@code notice}, ...
     */
    public String getLevel() {
        return level;
    }

    public boolean isException() {
        return "exception".equals(level);
    }

    public String getConditionName() {
        return conditionName;
    }

    public String getSqlState() {
        return sqlState;
    }

    /**
     * The format string without its quotes, or {@code null}.
     */
    public String getMessage() {
        return message;
    }

    public List<PlExpression> getParams() {
        return params;
    }

    public List<RaiseOption> getOptions() {
        return options;
    }

    /**
     * A bare {@code RAISE;} re-throws the exception being handled.
     */
    public boolean isReraise() {
        return conditionName == null && sqlState == null && message == null && options.isEmpty();
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitRaise(this);
    }
}
