package me.christianrobert.plpgcheck.catalog;

import java.util.Objects;

/**
 * One attribute of a tuple shape: a relation column, a composite type field or a query output column.
 */
public class ColumnInfo {

    private final String name;
    private final PgType type;
    private final boolean notNull;

    public ColumnInfo(String name, PgType type) {
        this(name, type, false);
    }

    public ColumnInfo(String name, PgType type, boolean notNull) {
        this.name = name;
        this.type = type;
        this.notNull = notNull;
    }

    public String getName() {
        return name;
    }

    public PgType getType() {
        return type;
    }

    public boolean isNotNull() {
        return notNull;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnInfo)) return false;
        ColumnInfo that = (ColumnInfo) o;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + " " + type;
    }
}
