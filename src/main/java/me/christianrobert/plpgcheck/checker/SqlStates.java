package me.christianrobert.plpgcheck.checker;

/**
 * SQLSTATE codes of the diagnostics the checker raises itself.
 */
final class SqlStates {

    static final String SUCCESSFUL_COMPLETION = "00000";
    static final String FEATURE_NOT_SUPPORTED = "0A000";
    static final String RERAISE_OUTSIDE_HANDLER = "0Z002";
    static final String INVALID_PARAMETER_VALUE = "22023";
    static final String INVALID_TRANSACTION_TERMINATION = "2D000";
    static final String RETURN_NOT_PERFORMED = "2F005";
    static final String SYNTAX_ERROR = "42601";
    static final String UNDEFINED_COLUMN = "42703";
    static final String DATATYPE_MISMATCH = "42804";
    static final String WRONG_OBJECT_TYPE = "42809";
    static final String UNDEFINED_TABLE = "42P01";
    static final String INTERNAL_ERROR = "XX000";

    private SqlStates() {
    }
}
