package me.christianrobert.plpgcheck.catalog;

import java.util.List;

/**
 * A relation known to the catalog with its ordered columns.
 */
public class RelationInfo {

    private final long oid;
    private final String schema;
    private final String name;
    private final RelationKind kind;
    private final List<ColumnInfo> columns;
    private final PgType rowType;

    public RelationInfo(long oid, String schema, String name, RelationKind kind, List<ColumnInfo> columns) {
        this.oid = oid;
        this.schema = schema;
        this.name = name;
        this.kind = kind;
        this.columns = List.copyOf(columns);
        this.rowType = PgType.composite(oid, schema, name, this.columns);
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

    public String getQualifiedName() {
        return schema + "." + name;
    }

    public RelationKind getKind() {
        return kind;
    }

    public List<ColumnInfo> getColumns() {
        return columns;
    }

    public ColumnInfo findColumn(String columnName) {
        for (ColumnInfo column : columns) {
            if (column.getName().equals(columnName)) {
                return column;
            }
        }
        return null;
    }

    /**
     * The composite type every relation implicitly defines.
     */
    public PgType getRowType() {
        return rowType;
    }

    public boolean isSequence() {
        return kind == RelationKind.SEQUENCE;
    }

    @Override
    public String toString() {
        return getQualifiedName() + columns;
    }
}
