package me.christianrobert.plpgcheck.checker;

/**
 * Usage error detected before any statement of the routine is examined: wrong language,
 * missing or extraneous trigger relation, unknown routine, invalid type substitution.
 */
public class InvalidInputException extends RuntimeException {

    private final String sqlState;

    public InvalidInputException(String message) {
        this("22023", message);
    }

    public InvalidInputException(String sqlState, String message) {
        super(message);
        this.sqlState = sqlState;
    }

    public String getSqlState() {
        return sqlState;
    }
}
