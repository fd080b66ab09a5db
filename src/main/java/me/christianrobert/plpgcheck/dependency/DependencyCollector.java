package me.christianrobert.plpgcheck.dependency;

import me.christianrobert.plpgcheck.catalog.FunctionInfo;
import me.christianrobert.plpgcheck.catalog.OperatorInfo;
import me.christianrobert.plpgcheck.catalog.PgType;
import me.christianrobert.plpgcheck.catalog.RelationInfo;
import me.christianrobert.plpgcheck.sql.ResolvedQuery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates the relations, non built-in functions and operators referenced by the
 * resolved queries of one run. The first occurrence of each object wins.
 */
public class DependencyCollector {

    private final Map<String, DependencyRecord> records = new LinkedHashMap<>();

    public void collect(ResolvedQuery query) {
        for (RelationInfo relation : query.getRelations()) {
            add(new DependencyRecord(DependencyType.RELATION, relation.getOid(), relation.getSchema(),
                    relation.getName(), null));
        }
        for (FunctionInfo function : query.getFunctions()) {
            if (function.isBuiltin()) {
                continue;
            }
            add(new DependencyRecord(function.isProcedure() ? DependencyType.PROCEDURE : DependencyType.FUNCTION,
                    function.getOid(), function.getSchema(), function.getName(), renderArguments(function)));
        }
        for (OperatorInfo operator : query.getOperators()) {
            if (operator.isBuiltin()) {
                continue;
            }
            add(new DependencyRecord(DependencyType.OPERATOR, operator.getOid(), operator.getSchema(),
                    operator.getSymbol(), "(" + typeName(operator.getLeft()) + "," + typeName(operator.getRight())
                    + ")"));
        }
    }

    private void add(DependencyRecord record) {
        records.putIfAbsent(record.key(), record);
    }

    /**
     * Records in discovery order.
     */
    public List<DependencyRecord> getRecords() {
        return Collections.unmodifiableList(new ArrayList<>(records.values()));
    }

    public int size() {
        return records.size();
    }

    static String renderArguments(FunctionInfo function) {
        StringBuilder sb = new StringBuilder("(");
        List<PgType> types = function.getArgTypes();
        boolean first = true;
        for (int i = 0; i < types.size(); i++) {
            String mode = i < function.getArgModes().size() ? function.getArgModes().get(i) : "i";
            if (!function.isProcedure() && ("o".equals(mode) || "t".equals(mode))) {
                continue;
            }
            if (!first) {
                sb.append(',');
            }
            sb.append(types.get(i).getName());
            first = false;
        }
        return sb.append(')').toString();
    }

    private static String typeName(PgType type) {
        return type != null ? type.getName() : "-";
    }
}
