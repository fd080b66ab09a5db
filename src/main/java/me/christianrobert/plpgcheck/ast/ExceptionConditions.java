package me.christianrobert.plpgcheck.ast;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Named exception conditions usable in {@code WHEN} clauses and RAISE, and the rules for
 * which raised codes a handler condition catches.
 */
public final class ExceptionConditions {

    public static final String OTHERS = "others";
    public static final String RERAISE = "reraise";
    public static final String QUERY_CANCELED = "57014";
    public static final String ASSERT_FAILURE = "P0004";
    public static final String RAISE_EXCEPTION = "P0001";
    public static final String CASE_NOT_FOUND = "20000";

    private static final Map<String, String> CODES = new HashMap<>();

    static {
        CODES.put("sql_statement_not_yet_complete", "03000");
        CODES.put("feature_not_supported", "0A000");
        CODES.put("invalid_transaction_initiation", "0B000");
        CODES.put("case_not_found", "20000");
        CODES.put("cardinality_violation", "21000");
        CODES.put("data_exception", "22000");
        CODES.put("string_data_right_truncation", "22001");
        CODES.put("numeric_value_out_of_range", "22003");
        CODES.put("null_value_not_allowed", "22004");
        CODES.put("error_in_assignment", "22005");
        CODES.put("invalid_datetime_format", "22007");
        CODES.put("datetime_field_overflow", "22008");
        CODES.put("division_by_zero", "22012");
        CODES.put("character_not_in_repertoire", "22021");
        CODES.put("invalid_parameter_value", "22023");
        CODES.put("invalid_text_representation", "22P02");
        CODES.put("integrity_constraint_violation", "23000");
        CODES.put("restrict_violation", "23001");
        CODES.put("not_null_violation", "23502");
        CODES.put("foreign_key_violation", "23503");
        CODES.put("unique_violation", "23505");
        CODES.put("check_violation", "23514");
        CODES.put("exclusion_violation", "23P01");
        CODES.put("invalid_cursor_state", "24000");
        CODES.put("invalid_transaction_state", "25000");
        CODES.put("read_only_sql_transaction", "25006");
        CODES.put("invalid_authorization_specification", "28000");
        CODES.put("invalid_transaction_termination", "2D000");
        CODES.put("invalid_cursor_name", "34000");
        CODES.put("transaction_rollback", "40000");
        CODES.put("serialization_failure", "40001");
        CODES.put("deadlock_detected", "40P01");
        CODES.put("syntax_error_or_access_rule_violation", "42000");
        CODES.put("insufficient_privilege", "42501");
        CODES.put("syntax_error", "42601");
        CODES.put("undefined_column", "42703");
        CODES.put("undefined_object", "42704");
        CODES.put("undefined_function", "42883");
        CODES.put("undefined_table", "42P01");
        CODES.put("duplicate_table", "42P07");
        CODES.put("duplicate_object", "42710");
        CODES.put("ambiguous_column", "42702");
        CODES.put("datatype_mismatch", "42804");
        CODES.put("wrong_object_type", "42809");
        CODES.put("object_not_in_prerequisite_state", "55000");
        CODES.put("object_in_use", "55006");
        CODES.put("lock_not_available", "55P03");
        CODES.put("query_canceled", "57014");
        CODES.put("internal_error", "XX000");
        CODES.put("plpgsql_error", "P0000");
        CODES.put("raise_exception", "P0001");
        CODES.put("no_data_found", "P0002");
        CODES.put("too_many_rows", "P0003");
        CODES.put("assert_failure", "P0004");
    }

    private ExceptionConditions() {
    }

    /**
     * @return the SQLSTATE of a named condition, or {@code null} when the name is unknown
     */
    public static String codeOf(String conditionName) {
        return CODES.get(conditionName);
    }

    public static boolean isValidSqlState(String sqlState) {
        return sqlState != null && sqlState.matches("[0-9A-Z]{5}") && !sqlState.startsWith("00");
    }

    /**
     * Whether a handler condition catches a raised code. OTHERS catches everything except
     * query cancel and assert failure; a class code ({@code xx000}) catches its whole class.
     */
    public static boolean catches(String handlerCode, String raisedCode) {
        if (OTHERS.equals(handlerCode)) {
            return !QUERY_CANCELED.equals(raisedCode) && !ASSERT_FAILURE.equals(raisedCode);
        }
        if (RERAISE.equals(raisedCode)) {
            return false;
        }
        if (handlerCode.equals(raisedCode)) {
            return true;
        }
        return handlerCode.endsWith("000")
                && raisedCode.length() == 5
                && handlerCode.regionMatches(0, raisedCode, 0, 2);
    }

    public static boolean catchesAny(List<String> handlerCodes, String raisedCode) {
        for (String handlerCode : handlerCodes) {
            if (catches(handlerCode, raisedCode)) {
                return true;
            }
        }
        return false;
    }
}
