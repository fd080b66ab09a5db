package me.christianrobert.plpgcheck.parser;

/**
 * The routine cannot be compiled: a syntax error, an unknown type or an unknown target.
 * The checker turns it into a single error diagnostic.
 */
public class RoutineCompileException extends RuntimeException {

    private final String sqlState;
    private final int lineno;
    private final String detail;

    public RoutineCompileException(String sqlState, String message, int lineno) {
        this(sqlState, message, lineno, null);
    }

    public RoutineCompileException(String sqlState, String message, int lineno, String detail) {
        super(message);
        this.sqlState = sqlState;
        this.lineno = lineno;
        this.detail = detail;
    }

    public String getSqlState() {
        return sqlState;
    }

    public int getLineno() {
        return lineno;
    }

    public String getDetail() {
        return detail;
    }
}
