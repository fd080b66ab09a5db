package me.christianrobert.plpgcheck.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static me.christianrobert.plpgcheck.catalog.BuiltinTypes.*;

/**
 * The subset of {@code pg_catalog} functions the checker resolves without a live server.
 */
public class BuiltinCatalog implements Catalog {

    private static final Map<String, List<FunctionInfo>> FUNCTIONS = new HashMap<>();
    private static long nextOid = 5000;

    static {
        immutable("length", INT4, TEXT);
        immutable("char_length", INT4, TEXT);
        immutable("octet_length", INT4, TEXT);
        immutable("lower", TEXT, TEXT);
        immutable("upper", TEXT, TEXT);
        immutable("initcap", TEXT, TEXT);
        immutable("btrim", TEXT, TEXT);
        immutable("ltrim", TEXT, TEXT);
        immutable("rtrim", TEXT, TEXT);
        immutable("md5", TEXT, TEXT);
        immutable("reverse", TEXT, TEXT);
        immutable("substr", TEXT, TEXT, INT4);
        immutable("substr", TEXT, TEXT, INT4, INT4);
        immutable("substring", TEXT, TEXT, INT4);
        immutable("substring", TEXT, TEXT, INT4, INT4);
        immutable("left", TEXT, TEXT, INT4);
        immutable("right", TEXT, TEXT, INT4);
        immutable("lpad", TEXT, TEXT, INT4);
        immutable("lpad", TEXT, TEXT, INT4, TEXT);
        immutable("rpad", TEXT, TEXT, INT4);
        immutable("rpad", TEXT, TEXT, INT4, TEXT);
        immutable("replace", TEXT, TEXT, TEXT, TEXT);
        immutable("split_part", TEXT, TEXT, TEXT, INT4);
        immutable("strpos", INT4, TEXT, TEXT);
        immutable("repeat", TEXT, TEXT, INT4);
        immutable("regexp_replace", TEXT, TEXT, TEXT, TEXT);
        immutable("regexp_replace", TEXT, TEXT, TEXT, TEXT, TEXT);
        immutable("quote_ident", TEXT, TEXT);
        immutable("quote_literal", TEXT, TEXT);
        immutable("quote_nullable", TEXT, TEXT);
        immutable("abs", INT4, INT4);
        immutable("abs", INT8, INT8);
        immutable("abs", NUMERIC, NUMERIC);
        immutable("abs", FLOAT8, FLOAT8);
        immutable("mod", INT4, INT4, INT4);
        immutable("mod", INT8, INT8, INT8);
        immutable("mod", NUMERIC, NUMERIC, NUMERIC);
        immutable("round", NUMERIC, NUMERIC);
        immutable("round", NUMERIC, NUMERIC, INT4);
        immutable("round", FLOAT8, FLOAT8);
        immutable("trunc", NUMERIC, NUMERIC);
        immutable("trunc", NUMERIC, NUMERIC, INT4);
        immutable("floor", NUMERIC, NUMERIC);
        immutable("floor", FLOAT8, FLOAT8);
        immutable("ceil", NUMERIC, NUMERIC);
        immutable("ceil", FLOAT8, FLOAT8);
        immutable("power", FLOAT8, FLOAT8, FLOAT8);
        immutable("power", NUMERIC, NUMERIC, NUMERIC);
        immutable("sqrt", FLOAT8, FLOAT8);
        immutable("sqrt", NUMERIC, NUMERIC);
        immutable("sign", NUMERIC, NUMERIC);
        immutable("array_length", INT4, ANYARRAY, INT4);
        immutable("array_upper", INT4, ANYARRAY, INT4);
        immutable("array_lower", INT4, ANYARRAY, INT4);
        immutable("cardinality", INT4, ANYARRAY);
        immutable("array_append", ANYARRAY, ANYARRAY, ANYELEMENT);
        immutable("array_prepend", ANYARRAY, ANYELEMENT, ANYARRAY);
        immutable("array_cat", ANYARRAY, ANYARRAY, ANYARRAY);
        immutable("array_position", INT4, ANYARRAY, ANYELEMENT);
        immutable("array_to_string", TEXT, ANYARRAY, TEXT);
        immutable("string_to_array", arrayOf(TEXT), TEXT, TEXT);
        immutable("date_part", FLOAT8, TEXT, TIMESTAMP);
        immutable("date_part", FLOAT8, TEXT, INTERVAL);
        immutable("date_trunc", TIMESTAMP, TEXT, TIMESTAMP);
        immutable("to_char", TEXT, NUMERIC, TEXT);
        immutable("to_char", TEXT, TIMESTAMP, TEXT);
        immutable("to_char", TEXT, INTERVAL, TEXT);
        define("plpgsql_check_pragma", FunctionInfo.Kind.FUNCTION, Volatility.IMMUTABLE, false, true, INT4, arrayOf(TEXT));

        stable("now", TIMESTAMPTZ);
        stable("statement_timestamp", TIMESTAMPTZ);
        stable("transaction_timestamp", TIMESTAMPTZ);
        stable("to_char", TEXT, TIMESTAMPTZ, TEXT);
        stable("to_date", DATE, TEXT, TEXT);
        stable("to_timestamp", TIMESTAMPTZ, TEXT, TEXT);
        stable("to_timestamp", TIMESTAMPTZ, FLOAT8);
        stable("to_number", NUMERIC, TEXT, TEXT);
        stable("date_trunc", TIMESTAMPTZ, TEXT, TIMESTAMPTZ);
        stable("date_part", FLOAT8, TEXT, TIMESTAMPTZ);
        stable("age", INTERVAL, TIMESTAMP);
        stable("age", INTERVAL, TIMESTAMP, TIMESTAMP);
        stable("current_setting", TEXT, TEXT);
        stable("current_setting", TEXT, TEXT, BOOL);
        stable("current_schema", NAME);
        stable("current_database", NAME);
        stable("current_user", NAME);
        stable("session_user", NAME);
        stable("current_role", NAME);
        stableVariadic("concat", TEXT, ANY);
        stableVariadic("concat_ws", TEXT, TEXT, ANY);
        stable("format", TEXT, TEXT);
        stableVariadic("format", TEXT, TEXT, ANY);
        stable("to_json", JSON, ANYELEMENT);
        stable("to_jsonb", JSONB, ANYELEMENT);
        stable("row_to_json", JSON, RECORD);
        stableVariadic("json_build_object", JSON, ANY);
        stableVariadic("jsonb_build_object", JSONB, ANY);
        stableVariadic("json_build_array", JSON, ANY);
        stableVariadic("jsonb_build_array", JSONB, ANY);
        stable("pg_typeof", REGTYPE, ANY);

        volatileFn("random", FLOAT8);
        volatileFn("clock_timestamp", TIMESTAMPTZ);
        volatileFn("timeofday", TEXT);
        volatileFn("gen_random_uuid", UUID);
        volatileFn("pg_sleep", VOID, FLOAT8);
        volatileFn("nextval", INT8, REGCLASS);
        volatileFn("currval", INT8, REGCLASS);
        volatileFn("lastval", INT8);
        volatileFn("setval", INT8, REGCLASS, INT8);
        volatileFn("setval", INT8, REGCLASS, INT8, BOOL);
        volatileFn("set_config", TEXT, TEXT, TEXT, BOOL);
        volatileFn("txid_current", INT8);

        setReturning("unnest", ANYELEMENT, ANYARRAY);
        setReturning("generate_series", INT4, INT4, INT4);
        setReturning("generate_series", INT4, INT4, INT4, INT4);
        setReturning("generate_series", INT8, INT8, INT8);
        setReturning("generate_series", TIMESTAMP, TIMESTAMP, TIMESTAMP, INTERVAL);
        setReturning("generate_subscripts", INT4, ANYARRAY, INT4);
        setReturning("regexp_split_to_table", TEXT, TEXT, TEXT);

        aggregate("count", INT8);
        aggregate("count", INT8, ANY);
        aggregate("sum", INT8, INT4);
        aggregate("sum", INT8, INT2);
        aggregate("sum", NUMERIC, INT8);
        aggregate("sum", NUMERIC, NUMERIC);
        aggregate("sum", FLOAT8, FLOAT8);
        aggregate("sum", INTERVAL, INTERVAL);
        aggregate("avg", NUMERIC, INT4);
        aggregate("avg", NUMERIC, INT8);
        aggregate("avg", NUMERIC, NUMERIC);
        aggregate("avg", FLOAT8, FLOAT8);
        aggregate("min", ANYELEMENT, ANYELEMENT);
        aggregate("max", ANYELEMENT, ANYELEMENT);
        aggregate("array_agg", ANYARRAY, ANYNONARRAY);
        aggregate("string_agg", TEXT, TEXT, TEXT);
        aggregate("bool_and", BOOL, BOOL);
        aggregate("bool_or", BOOL, BOOL);
        aggregate("json_agg", JSON, ANYELEMENT);
        aggregate("jsonb_agg", JSONB, ANYELEMENT);
        window("row_number", INT8);
        window("rank", INT8);
        window("dense_rank", INT8);
        window("lag", ANYELEMENT, ANYELEMENT);
        window("lead", ANYELEMENT, ANYELEMENT);
    }

    private static void immutable(String name, PgType returns, PgType... args) {
        define(name, FunctionInfo.Kind.FUNCTION, Volatility.IMMUTABLE, false, false, returns, args);
    }

    private static void stable(String name, PgType returns, PgType... args) {
        define(name, FunctionInfo.Kind.FUNCTION, Volatility.STABLE, false, false, returns, args);
    }

    private static void stableVariadic(String name, PgType returns, PgType... args) {
        define(name, FunctionInfo.Kind.FUNCTION, Volatility.STABLE, false, true, returns, args);
    }

    private static void volatileFn(String name, PgType returns, PgType... args) {
        define(name, FunctionInfo.Kind.FUNCTION, Volatility.VOLATILE, false, false, returns, args);
    }

    private static void setReturning(String name, PgType returns, PgType... args) {
        define(name, FunctionInfo.Kind.FUNCTION, Volatility.IMMUTABLE, true, false, returns, args);
    }

    private static void aggregate(String name, PgType returns, PgType... args) {
        define(name, FunctionInfo.Kind.AGGREGATE, Volatility.IMMUTABLE, false, false, returns, args);
    }

    private static void window(String name, PgType returns, PgType... args) {
        define(name, FunctionInfo.Kind.WINDOW, Volatility.IMMUTABLE, false, false, returns, args);
    }

    private static void define(String name, FunctionInfo.Kind kind, Volatility volatility, boolean returnsSet,
                               boolean variadic, PgType returns, PgType... args) {
        FunctionInfo function = FunctionInfo.builder("pg_catalog", name)
                .oid(nextOid++)
                .returns(returns)
                .returnsSet(returnsSet)
                .volatility(volatility)
                .kind(kind)
                .variadic(variadic)
                .args(args)
                .build();
        FUNCTIONS.computeIfAbsent(name, key -> new ArrayList<>()).add(function);
    }

    @Override
    public RelationInfo findRelation(QualifiedName name) {
        return null;
    }

    @Override
    public List<FunctionInfo> findFunctions(QualifiedName name) {
        if (name.isQualified() && !"pg_catalog".equals(name.getSchema())) {
            return Collections.emptyList();
        }
        return FUNCTIONS.getOrDefault(name.getName(), Collections.emptyList());
    }

    @Override
    public OperatorInfo findOperator(String symbol, PgType left, PgType right) {
        return null;
    }
}
