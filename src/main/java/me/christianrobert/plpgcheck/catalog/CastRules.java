package me.christianrobert.plpgcheck.catalog;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cast lookup modeled on the built-in rows of {@code pg_cast} plus the automatic I/O
 * conversion casts PostgreSQL adds to and from the string types.
 */
public final class CastRules {

    private static final List<PgType> NUMERIC_RANK = List.of(
            BuiltinTypes.INT2, BuiltinTypes.INT4, BuiltinTypes.INT8,
            BuiltinTypes.NUMERIC, BuiltinTypes.FLOAT4, BuiltinTypes.FLOAT8);

    private static final Set<String> STRING_FAMILY = Set.of("text", "varchar", "bpchar", "name", "char");

    private static final Set<String> OID_FAMILY = Set.of("oid", "regclass", "regproc", "regtype");

    private static final Map<String, CastContext> DATETIME_CASTS = Map.ofEntries(
            Map.entry("date>timestamp", CastContext.IMPLICIT),
            Map.entry("date>timestamptz", CastContext.IMPLICIT),
            Map.entry("timestamp>timestamptz", CastContext.IMPLICIT),
            Map.entry("timestamptz>timestamp", CastContext.ASSIGNMENT),
            Map.entry("timestamp>date", CastContext.ASSIGNMENT),
            Map.entry("timestamptz>date", CastContext.ASSIGNMENT),
            Map.entry("timestamp>time", CastContext.ASSIGNMENT),
            Map.entry("timestamptz>time", CastContext.ASSIGNMENT),
            Map.entry("timestamptz>timetz", CastContext.ASSIGNMENT),
            Map.entry("time>timetz", CastContext.IMPLICIT),
            Map.entry("timetz>time", CastContext.ASSIGNMENT),
            Map.entry("time>interval", CastContext.IMPLICIT),
            Map.entry("interval>time", CastContext.ASSIGNMENT));

    private CastRules() {
    }

    /**
     * Returns the context in which {@code source} can be cast to {@code target}.
     * Identical types and {@code unknown} literals always coerce implicitly.
     */
    public static CastContext castContext(PgType source, PgType target) {
        if (source == null || target == null || source.equals(target)) {
            return CastContext.IMPLICIT;
        }
        if (source.isUnknown() || target.isPolymorphic()) {
            return CastContext.IMPLICIT;
        }
        String from = source.getInternalName();
        String to = target.getInternalName();

        if (STRING_FAMILY.contains(from) && STRING_FAMILY.contains(to)) {
            return CastContext.IMPLICIT;
        }
        int fromRank = NUMERIC_RANK.indexOf(source);
        int toRank = NUMERIC_RANK.indexOf(target);
        if (fromRank >= 0 && toRank >= 0) {
            return fromRank < toRank ? CastContext.IMPLICIT : CastContext.ASSIGNMENT;
        }
        if (OID_FAMILY.contains(to) && (fromRank >= 0 && fromRank <= 2 || OID_FAMILY.contains(from))) {
            return CastContext.IMPLICIT;
        }
        if (OID_FAMILY.contains(from) && (toRank == 1 || toRank == 2)) {
            return CastContext.ASSIGNMENT;
        }
        CastContext datetime = DATETIME_CASTS.get(from + ">" + to);
        if (datetime != null) {
            return datetime;
        }
        if (source.isArray() && target.isArray()) {
            return castContext(source.getElementType(), target.getElementType());
        }
        if (source.isComposite() && target.isComposite()) {
            return target.isRecord() ? CastContext.IMPLICIT : CastContext.EXPLICIT;
        }
        if (source.isComposite() || target.isComposite()) {
            return STRING_FAMILY.contains(to) ? CastContext.ASSIGNMENT : CastContext.NONE;
        }
        if (isNumericOrBool(source) && isNumericOrBool(target)) {
            // int4 <-> bool and the like
            return CastContext.EXPLICIT;
        }
        if (isJson(source) && isJson(target)) {
            return CastContext.EXPLICIT;
        }
        if (isJson(source) && (toRank >= 0 || to.equals("bool"))) {
            return CastContext.EXPLICIT;
        }
        if (source.getCategory() == TypeCategory.BITSTRING && target.getCategory() == TypeCategory.BITSTRING) {
            return CastContext.IMPLICIT;
        }
        if (STRING_FAMILY.contains(to)) {
            // automatic I/O conversion to a string type
            return CastContext.ASSIGNMENT;
        }
        if (STRING_FAMILY.contains(from)) {
            // automatic I/O conversion from a string type
            return CastContext.EXPLICIT;
        }
        return CastContext.NONE;
    }

    /**
     * True when the conversion is a relabeling that needs no cast function.
     */
    public static boolean isBinaryCoercible(PgType source, PgType target) {
        if (source == null || target == null || source.equals(target)) {
            return true;
        }
        String from = source.getInternalName();
        String to = target.getInternalName();
        if (to.equals("text") && (from.equals("varchar") || from.equals("bpchar"))) {
            return true;
        }
        if (to.equals("varchar") && (from.equals("text") || from.equals("bpchar"))) {
            return true;
        }
        if (OID_FAMILY.contains(from) && OID_FAMILY.contains(to)) {
            return true;
        }
        if (from.equals("int4") && OID_FAMILY.contains(to)) {
            return true;
        }
        if (target.isRecord() && source.isComposite()) {
            return true;
        }
        return target.isPolymorphic();
    }

    /**
     * True for the string types that the SQL injection heuristics treat as text.
     */
    public static boolean isStringType(PgType type) {
        return type != null && (type.getCategory() == TypeCategory.STRING || type.isUnknown());
    }

    /**
     * Picks the common type two operands are coerced to, or {@code null} when neither
     * side can be implicitly cast to the other.
     */
    public static PgType commonType(PgType left, PgType right) {
        if (left == null || left.isUnknown()) {
            return right == null || right.isUnknown() ? BuiltinTypes.TEXT : right;
        }
        if (right == null || right.isUnknown() || left.equals(right)) {
            return left;
        }
        int leftRank = NUMERIC_RANK.indexOf(left);
        int rightRank = NUMERIC_RANK.indexOf(right);
        if (leftRank >= 0 && rightRank >= 0) {
            return leftRank >= rightRank ? left : right;
        }
        if (STRING_FAMILY.contains(left.getInternalName()) && STRING_FAMILY.contains(right.getInternalName())) {
            return BuiltinTypes.TEXT;
        }
        if (castContext(right, left).allowsImplicit()) {
            return left;
        }
        if (castContext(left, right).allowsImplicit()) {
            return right;
        }
        return null;
    }

    private static boolean isNumericOrBool(PgType type) {
        return type.getCategory() == TypeCategory.NUMERIC || type.getCategory() == TypeCategory.BOOLEAN;
    }

    private static boolean isJson(PgType type) {
        return type.equals(BuiltinTypes.JSON) || type.equals(BuiltinTypes.JSONB);
    }
}
