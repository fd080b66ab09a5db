package me.christianrobert.plpgcheck.catalog;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the built-in types of {@code pg_catalog} with their real oids and the
 * SQL-standard aliases the grammar accepts ({@code int}, {@code character varying}, ...).
 */
public final class BuiltinTypes {

    private static final Map<String, PgType> BY_NAME = new HashMap<>();
    private static final Map<Long, PgType> BY_OID = new HashMap<>();
    private static final Map<PgType, PgType> ARRAY_OF = new ConcurrentHashMap<>();

    public static final PgType BOOL = register(PgType.base(16, "boolean", "bool", TypeCategory.BOOLEAN, true));
    public static final PgType BYTEA = register(PgType.base(17, "bytea", "bytea", TypeCategory.USER, false));
    public static final PgType CHAR = register(PgType.base(18, "\"char\"", "char", TypeCategory.STRING, false));
    public static final PgType NAME = register(PgType.base(19, "name", "name", TypeCategory.STRING, false));
    public static final PgType INT8 = register(PgType.base(20, "bigint", "int8", TypeCategory.NUMERIC, false));
    public static final PgType INT2 = register(PgType.base(21, "smallint", "int2", TypeCategory.NUMERIC, false));
    public static final PgType INT4 = register(PgType.base(23, "integer", "int4", TypeCategory.NUMERIC, false));
    public static final PgType REGPROC = register(PgType.base(24, "regproc", "regproc", TypeCategory.NUMERIC, false));
    public static final PgType TEXT = register(PgType.base(25, "text", "text", TypeCategory.STRING, true));
    public static final PgType OID = register(PgType.base(26, "oid", "oid", TypeCategory.NUMERIC, true));
    public static final PgType JSON = register(PgType.base(114, "json", "json", TypeCategory.USER, false));
    public static final PgType XML = register(PgType.base(142, "xml", "xml", TypeCategory.USER, false));
    public static final PgType CIDR = register(PgType.base(650, "cidr", "cidr", TypeCategory.NETWORK, false));
    public static final PgType FLOAT4 = register(PgType.base(700, "real", "float4", TypeCategory.NUMERIC, false));
    public static final PgType FLOAT8 = register(PgType.base(701, "double precision", "float8", TypeCategory.NUMERIC, true));
    public static final PgType UNKNOWN = register(PgType.base(705, "unknown", "unknown", TypeCategory.UNKNOWN, false));
    public static final PgType MONEY = register(PgType.base(790, "money", "money", TypeCategory.NUMERIC, false));
    public static final PgType INET = register(PgType.base(869, "inet", "inet", TypeCategory.NETWORK, true));
    public static final PgType BPCHAR = register(PgType.base(1042, "character", "bpchar", TypeCategory.STRING, false));
    public static final PgType VARCHAR = register(PgType.base(1043, "character varying", "varchar", TypeCategory.STRING, false));
    public static final PgType DATE = register(PgType.base(1082, "date", "date", TypeCategory.DATETIME, false));
    public static final PgType TIME = register(PgType.base(1083, "time without time zone", "time", TypeCategory.DATETIME, false));
    public static final PgType TIMESTAMP = register(PgType.base(1114, "timestamp without time zone", "timestamp", TypeCategory.DATETIME, false));
    public static final PgType TIMESTAMPTZ = register(PgType.base(1184, "timestamp with time zone", "timestamptz", TypeCategory.DATETIME, true));
    public static final PgType INTERVAL = register(PgType.base(1186, "interval", "interval", TypeCategory.TIMESPAN, true));
    public static final PgType TIMETZ = register(PgType.base(1266, "time with time zone", "timetz", TypeCategory.DATETIME, false));
    public static final PgType BIT = register(PgType.base(1560, "bit", "bit", TypeCategory.BITSTRING, false));
    public static final PgType VARBIT = register(PgType.base(1562, "bit varying", "varbit", TypeCategory.BITSTRING, true));
    public static final PgType NUMERIC = register(PgType.base(1700, "numeric", "numeric", TypeCategory.NUMERIC, false));
    public static final PgType REFCURSOR = register(PgType.base(1790, "refcursor", "refcursor", TypeCategory.USER, false));
    public static final PgType REGCLASS = register(PgType.base(2205, "regclass", "regclass", TypeCategory.NUMERIC, false));
    public static final PgType REGTYPE = register(PgType.base(2206, "regtype", "regtype", TypeCategory.NUMERIC, false));
    public static final PgType RECORD = register(PgType.base(2249, "record", "record", TypeCategory.PSEUDO, false));
    public static final PgType CSTRING = register(PgType.base(2275, "cstring", "cstring", TypeCategory.PSEUDO, false));
    public static final PgType ANY = register(PgType.base(2276, "\"any\"", "any", TypeCategory.PSEUDO, false));
    public static final PgType ANYARRAY = register(PgType.base(2277, "anyarray", "anyarray", TypeCategory.PSEUDO, false));
    public static final PgType VOID = register(PgType.base(2278, "void", "void", TypeCategory.PSEUDO, false));
    public static final PgType TRIGGER = register(PgType.base(2279, "trigger", "trigger", TypeCategory.PSEUDO, false));
    public static final PgType ANYELEMENT = register(PgType.base(2283, "anyelement", "anyelement", TypeCategory.PSEUDO, false));
    public static final PgType ANYNONARRAY = register(PgType.base(2776, "anynonarray", "anynonarray", TypeCategory.PSEUDO, false));
    public static final PgType UUID = register(PgType.base(2950, "uuid", "uuid", TypeCategory.USER, false));
    public static final PgType ANYENUM = register(PgType.base(3500, "anyenum", "anyenum", TypeCategory.PSEUDO, false));
    public static final PgType JSONB = register(PgType.base(3802, "jsonb", "jsonb", TypeCategory.USER, false));
    public static final PgType ANYRANGE = register(PgType.base(3831, "anyrange", "anyrange", TypeCategory.PSEUDO, false));
    public static final PgType EVENT_TRIGGER = register(PgType.base(3838, "event_trigger", "event_trigger", TypeCategory.PSEUDO, false));
    public static final PgType INT4RANGE = register(PgType.base(3904, "int4range", "int4range", TypeCategory.RANGE, false));
    public static final PgType NUMRANGE = register(PgType.base(3906, "numrange", "numrange", TypeCategory.RANGE, false));
    public static final PgType TSRANGE = register(PgType.base(3908, "tsrange", "tsrange", TypeCategory.RANGE, false));
    public static final PgType TSTZRANGE = register(PgType.base(3910, "tstzrange", "tstzrange", TypeCategory.RANGE, false));
    public static final PgType DATERANGE = register(PgType.base(3912, "daterange", "daterange", TypeCategory.RANGE, false));
    public static final PgType INT8RANGE = register(PgType.base(3926, "int8range", "int8range", TypeCategory.RANGE, false));
    public static final PgType ANYCOMPATIBLE = register(PgType.base(5077, "anycompatible", "anycompatible", TypeCategory.PSEUDO, false));
    public static final PgType ANYCOMPATIBLEARRAY = register(PgType.base(5078, "anycompatiblearray", "anycompatiblearray", TypeCategory.PSEUDO, false));
    public static final PgType ANYCOMPATIBLENONARRAY = register(PgType.base(5079, "anycompatiblenonarray", "anycompatiblenonarray", TypeCategory.PSEUDO, false));
    public static final PgType ANYCOMPATIBLERANGE = register(PgType.base(5080, "anycompatiblerange", "anycompatiblerange", TypeCategory.PSEUDO, false));

    static {
        registerArray(1000, BOOL);
        registerArray(1001, BYTEA);
        registerArray(1005, INT2);
        registerArray(1007, INT4);
        registerArray(1009, TEXT);
        registerArray(1014, BPCHAR);
        registerArray(1015, VARCHAR);
        registerArray(1016, INT8);
        registerArray(1021, FLOAT4);
        registerArray(1022, FLOAT8);
        registerArray(1028, OID);
        registerArray(1115, TIMESTAMP);
        registerArray(1182, DATE);
        registerArray(1185, TIMESTAMPTZ);
        registerArray(1187, INTERVAL);
        registerArray(1231, NUMERIC);
        registerArray(199, JSON);
        registerArray(2201, REFCURSOR);
        registerArray(2287, RECORD);
        registerArray(2951, UUID);
        registerArray(3807, JSONB);

        alias("int", INT4);
        alias("integer", INT4);
        alias("serial", INT4);
        alias("smallint", INT2);
        alias("bigint", INT8);
        alias("bigserial", INT8);
        alias("real", FLOAT4);
        alias("float", FLOAT8);
        alias("double precision", FLOAT8);
        alias("decimal", NUMERIC);
        alias("boolean", BOOL);
        alias("character varying", VARCHAR);
        alias("char varying", VARCHAR);
        alias("character", BPCHAR);
        alias("char", BPCHAR);
        alias("\"char\"", CHAR);
        alias("timestamp without time zone", TIMESTAMP);
        alias("timestamp with time zone", TIMESTAMPTZ);
        alias("time without time zone", TIME);
        alias("time with time zone", TIMETZ);
        alias("bit varying", VARBIT);
        alias("\"any\"", ANY);
    }

    private BuiltinTypes() {
    }

    private static PgType register(PgType type) {
        BY_NAME.put(type.getInternalName(), type);
        BY_NAME.put(type.getName(), type);
        BY_OID.put(type.getOid(), type);
        return type;
    }

    private static void registerArray(long oid, PgType element) {
        PgType array = PgType.arrayOf(oid, element);
        BY_NAME.put(array.getInternalName(), array);
        BY_OID.put(oid, array);
        ARRAY_OF.put(element, array);
    }

    private static void alias(String alias, PgType type) {
        BY_NAME.put(alias, type);
    }

    /**
     * Looks up a built-in type by any of its names. Typmods, a {@code pg_catalog.}
     * prefix and array decorations ({@code []}, {@code [10]}, {@code ARRAY}) are accepted.
     *
     * @return the type, or {@code null} when the name is not a built-in type
     */
    public static PgType lookup(String typeName) {
        if (typeName == null) {
            return null;
        }
        String normalized = normalize(typeName);
        int arrayDims = 0;
        while (normalized.endsWith("[]")) {
            normalized = normalized.substring(0, normalized.length() - 2).trim();
            arrayDims++;
        }
        if (normalized.endsWith(" array")) {
            normalized = normalized.substring(0, normalized.length() - 6).trim();
            arrayDims++;
        }
        PgType type = BY_NAME.get(normalized);
        if (type == null) {
            return null;
        }
        return arrayDims > 0 ? arrayOf(type) : type;
    }

    public static PgType byOid(long oid) {
        return BY_OID.get(oid);
    }

    /**
     * Returns the array type whose elements are {@code element}. Multidimensional arrays
     * share the type of their one-dimensional counterpart, as in PostgreSQL.
     */
    public static PgType arrayOf(PgType element) {
        if (element.isArray()) {
            return element;
        }
        return ARRAY_OF.computeIfAbsent(element, e -> PgType.arrayOf(0, e));
    }

    /**
     * Lower-cases a type name, strips typmods and a {@code pg_catalog.} prefix and
     * collapses whitespace, so that {@code "NUMERIC(10, 2)"} becomes {@code "numeric"}.
     */
    public static String normalize(String typeName) {
        StringBuilder sb = new StringBuilder();
        int depth = 0;
        for (char c : typeName.trim().toCharArray()) {
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (depth == 0) {
                sb.append(c);
            }
        }
        String result = sb.toString().toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", " ")
                .replaceAll("\\[\\s*\\d*\\s*]", "[]")
                .replaceAll("\\s+\\[", "[")
                .trim();
        if (result.startsWith("pg_catalog.")) {
            result = result.substring("pg_catalog.".length());
        }
        return result;
    }
}
