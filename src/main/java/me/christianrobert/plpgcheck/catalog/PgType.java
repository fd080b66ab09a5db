package me.christianrobert.plpgcheck.catalog;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A PostgreSQL data type as far as the checker needs to know it: identity, category,
 * element type for arrays and the field list for composite types.
 */
public class PgType {

    private final long oid;
    private final String schema;
    private final String name;
    private final String internalName;
    private final TypeCategory category;
    private final boolean preferred;
    private final PgType elementType;
    private final List<ColumnInfo> fields;

    private PgType(long oid, String schema, String name, String internalName, TypeCategory category,
                   boolean preferred, PgType elementType, List<ColumnInfo> fields) {
        this.oid = oid;
        this.schema = schema;
        this.name = name;
        this.internalName = internalName;
        this.category = category;
        this.preferred = preferred;
        this.elementType = elementType;
        this.fields = fields;
    }

    public static PgType base(long oid, String name, String internalName, TypeCategory category, boolean preferred) {
        return new PgType(oid, "pg_catalog", name, internalName, category, preferred, null, null);
    }

    public static PgType arrayOf(long oid, PgType element) {
        return new PgType(oid, element.schema, element.name + "[]", "_" + element.internalName,
                TypeCategory.ARRAY, false, element, null);
    }

    public static PgType composite(long oid, String schema, String name, List<ColumnInfo> fields) {
        return new PgType(oid, schema, name, name, TypeCategory.COMPOSITE, false, null, List.copyOf(fields));
    }

    public static PgType userType(long oid, String schema, String name, TypeCategory category) {
        return new PgType(oid, schema, name, name, category, false, null, null);
    }

    public long getOid() {
        return oid;
    }

    public String getSchema() {
        return schema;
    }

    /**
     * Display name in {@code format_type} style, e.g. {@code integer}, {@code character varying}.
     */
    public String getName() {
        return name;
    }

    public String getInternalName() {
        return internalName;
    }

    public TypeCategory getCategory() {
        return category;
    }

    public boolean isPreferred() {
        return preferred;
    }

    public PgType getElementType() {
        return elementType;
    }

    /**
     * Fields of a composite type; empty for scalars and for the anonymous {@code record} type.
     */
    public List<ColumnInfo> getFields() {
        return fields != null ? fields : Collections.emptyList();
    }

    public boolean isArray() {
        return elementType != null;
    }

    public boolean isComposite() {
        return category == TypeCategory.COMPOSITE || isRecord();
    }

    public boolean isRecord() {
        return "record".equals(internalName);
    }

    public boolean isUnknown() {
        return category == TypeCategory.UNKNOWN;
    }

    public boolean isVoid() {
        return "void".equals(internalName);
    }

    public boolean isString() {
        return category == TypeCategory.STRING;
    }

    public boolean isPolymorphic() {
        switch (internalName) {
            case "anyelement":
            case "anyarray":
            case "anynonarray":
            case "anyenum":
            case "anyrange":
            case "anycompatible":
            case "anycompatiblearray":
            case "anycompatiblenonarray":
            case "anycompatiblerange":
            case "any":
                return true;
            default:
                return false;
        }
    }

    public boolean isBuiltin() {
        return "pg_catalog".equals(schema);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PgType)) return false;
        PgType pgType = (PgType) o;
        return oid == pgType.oid && Objects.equals(internalName, pgType.internalName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(oid, internalName);
    }

    @Override
    public String toString() {
        return name;
    }
}
