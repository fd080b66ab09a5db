package me.christianrobert.plpgcheck.dependency;

import java.util.Objects;

/**
 * A catalog object a routine refers to. Identity is (type, oid).
 */
public class DependencyRecord {

    private final DependencyType type;
    private final long oid;
    private final String schema;
    private final String name;
    private final String params;

    public DependencyRecord(DependencyType type, long oid, String schema, String name, String params) {
        this.type = type;
        this.oid = oid;
        this.schema = schema;
        this.name = name;
        this.params = params;
    }

    public DependencyType getType() {
        return type;
    }

    public long getOid() {
        return oid;
    }

    public String getSchema() {
        return schema;
    }

    public String getName() {
        return name;
    }

    /**
     * Rendered argument types for functions and operators, {@code null} for relations.
     */
    public String getParams() {
        return params;
    }

    public String key() {
        return type + ":" + oid;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DependencyRecord)) return false;
        DependencyRecord that = (DependencyRecord) o;
        return oid == that.oid && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, oid);
    }

    @Override
    public String toString() {
        return type + " " + schema + "." + name + (params != null ? params : "");
    }
}
