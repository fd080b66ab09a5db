package me.christianrobert.plpgcheck.diagnostic;

import java.util.Objects;

/**
 * One issue found in a routine, attributed to the statement it was found in.
 */
public class Diagnostic {

    private final Severity severity;
    private final String sqlState;
    private final int lineno;
    private final String statement;
    private final String message;
    private final String detail;
    private final String hint;
    private final String query;
    private final int position;
    private final String context;

    private Diagnostic(Builder builder) {
        this.severity = builder.severity;
        this.sqlState = builder.sqlState;
        this.lineno = builder.lineno;
        this.statement = builder.statement;
        this.message = builder.message;
        this.detail = builder.detail;
        this.hint = builder.hint;
        this.query = builder.query;
        this.position = builder.position;
        this.context = builder.context;
    }

    public static Builder builder(Severity severity, String message) {
        return new Builder(severity, message);
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getSqlState() {
        return sqlState;
    }

    /**
     * Source line of the statement; 0 for routine level issues.
     */
    public int getLineno() {
        return lineno;
    }

    /**
     * Statement kind as PL/pgSQL names it, {@code null} for routine level issues.
     */
    public String getStatement() {
        return statement;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    public String getHint() {
        return hint;
    }

    public String getQuery() {
        return query;
    }

    /**
     * 1-based character offset into {@link #getQuery()}, 0 when unknown.
     */
    public int getPosition() {
        return position;
    }

    public String getContext() {
        return context;
    }

    public boolean isError() {
        return severity.isError();
    }

    /**
     * Two diagnostics with the same key describe the same issue.
     */
    public String dedupKey() {
        return lineno + "|" + statement + "|" + sqlState + "|" + message + "|" + position;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return lineno == that.lineno && position == that.position && severity == that.severity
                && Objects.equals(sqlState, that.sqlState) && Objects.equals(statement, that.statement)
                && Objects.equals(message, that.message) && Objects.equals(detail, that.detail)
                && Objects.equals(hint, that.hint) && Objects.equals(query, that.query);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, sqlState, lineno, statement, message, position);
    }

    @Override
    public String toString() {
        return severity.getLabel() + ":" + sqlState + ":" + lineno + ":" + (statement != null ? statement : "")
                + ":" + message;
    }

    public static class Builder {
        private final Severity severity;
        private final String message;
        private String sqlState = "00000";
        private int lineno;
        private String statement;
        private String detail;
        private String hint;
        private String query;
        private int position;
        private String context;

        private Builder(Severity severity, String message) {
            this.severity = severity;
            this.message = message;
        }

        public Builder sqlState(String sqlState) {
            this.sqlState = sqlState;
            return this;
        }

        public Builder statement(int lineno, String statement) {
            this.lineno = lineno;
            this.statement = statement;
            return this;
        }

        public Builder detail(String detail) {
            this.detail = detail;
            return this;
        }

        public Builder hint(String hint) {
            this.hint = hint;
            return this;
        }

        public Builder query(String query, int position) {
            this.query = query;
            this.position = position;
            return this;
        }

        public Builder context(String context) {
            this.context = context;
            return this;
        }

        public Diagnostic build() {
            return new Diagnostic(this);
        }
    }
}
