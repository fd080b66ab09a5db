package me.christianrobert.plpgcheck.sql;

/**
 * A query rejected by the analyzer, carrying the fields of a PostgreSQL error report.
 */
public class SqlAnalysisException extends Exception {

    private final String sqlState;
    private final String detail;
    private final String hint;
    private final int position;

    public SqlAnalysisException(String sqlState, String message) {
        this(sqlState, message, null, null, 0);
    }

    public SqlAnalysisException(String sqlState, String message, int position) {
        this(sqlState, message, null, null, position);
    }

    public SqlAnalysisException(String sqlState, String message, String detail, String hint, int position) {
        super(message);
        this.sqlState = sqlState;
        this.detail = detail;
        this.hint = hint;
        this.position = position;
    }

    public String getSqlState() {
        return sqlState;
    }

    public String getDetail() {
        return detail;
    }

    public String getHint() {
        return hint;
    }

    /**
     * 1-based character offset into the query text, 0 when unknown.
     */
    public int getPosition() {
        return position;
    }

    /**
     * Copy of this error positioned at {@code newPosition}, used when the error surfaced
     * inside a rewritten query.
     */
    public SqlAnalysisException withPosition(int newPosition) {
        return new SqlAnalysisException(sqlState, getMessage(), detail, hint, newPosition);
    }
}
