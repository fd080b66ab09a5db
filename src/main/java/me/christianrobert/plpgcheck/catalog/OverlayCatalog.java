package me.christianrobert.plpgcheck.catalog;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Layers relations declared by {@code table} and {@code sequence} pragmas over another catalog.
 * Overlay relations live in {@code pg_temp}, which is searched first, and get negative oids
 * that no server object can have.
 */
public class OverlayCatalog implements Catalog {

    public static final String TEMP_SCHEMA = "pg_temp";

    private final Catalog base;
    private final Map<String, RelationInfo> overlay = new HashMap<>();
    private long nextOid = -1;

    public OverlayCatalog(Catalog base) {
        this.base = base;
    }

    public Catalog getBase() {
        return base;
    }

    public RelationInfo addTemporaryTable(String name, List<ColumnInfo> columns) {
        RelationInfo relation = new RelationInfo(nextOid--, TEMP_SCHEMA, name, RelationKind.TABLE,
                new ArrayList<>(columns));
        overlay.put(name, relation);
        return relation;
    }

    public RelationInfo addTemporarySequence(String name) {
        List<ColumnInfo> columns = List.of(
                new ColumnInfo("last_value", BuiltinTypes.INT8),
                new ColumnInfo("log_cnt", BuiltinTypes.INT8),
                new ColumnInfo("is_called", BuiltinTypes.BOOL));
        RelationInfo relation = new RelationInfo(nextOid--, TEMP_SCHEMA, name, RelationKind.SEQUENCE, columns);
        overlay.put(name, relation);
        return relation;
    }

    public boolean isTemporary(RelationInfo relation) {
        return relation != null && TEMP_SCHEMA.equals(relation.getSchema());
    }

    @Override
    public RelationInfo findRelation(QualifiedName name) {
        if (!name.isQualified() || TEMP_SCHEMA.equals(name.getSchema())) {
            RelationInfo relation = overlay.get(name.getName());
            if (relation != null) {
                return relation;
            }
        }
        return base.findRelation(name);
    }

    @Override
    public PgType findType(String typeName) {
        PgType type = Catalog.super.findType(typeName);
        return type != null ? type : base.findType(typeName);
    }

    @Override
    public List<FunctionInfo> findFunctions(QualifiedName name) {
        return base.findFunctions(name);
    }

    @Override
    public OperatorInfo findOperator(String symbol, PgType left, PgType right) {
        return base.findOperator(symbol, left, right);
    }
}
