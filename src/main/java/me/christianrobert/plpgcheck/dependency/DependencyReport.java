package me.christianrobert.plpgcheck.dependency;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Dependency table ordered for display by type, schema and name.
 */
public class DependencyReport {

    private static final Comparator<DependencyRecord> DISPLAY_ORDER = Comparator
            .comparing(DependencyRecord::getType)
            .thenComparing(DependencyRecord::getSchema, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(DependencyRecord::getName)
            .thenComparing(DependencyRecord::getParams, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final String functionId;
    private final List<DependencyRecord> rows;

    public DependencyReport(String functionId, List<DependencyRecord> records) {
        this.functionId = functionId;
        this.rows = new ArrayList<>(records);
        this.rows.sort(DISPLAY_ORDER);
    }

    public String getFunctionId() {
        return functionId;
    }

    public List<DependencyRecord> getRows() {
        return rows;
    }

    public String render() {
        StringBuilder sb = new StringBuilder("type|oid|schema|name|params");
        for (DependencyRecord row : rows) {
            sb.append('\n').append(row.getType()).append('|').append(row.getOid()).append('|')
                    .append(row.getSchema()).append('|').append(row.getName()).append('|')
                    .append(row.getParams() != null ? row.getParams() : "");
        }
        return sb.toString();
    }
}
