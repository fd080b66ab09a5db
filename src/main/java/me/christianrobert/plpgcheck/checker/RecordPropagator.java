package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.ast.CompiledRoutine;
import me.christianrobert.plpgcheck.ast.Datum;
import me.christianrobert.plpgcheck.ast.RecordDatum;
import me.christianrobert.plpgcheck.catalog.BuiltinTypes;
import me.christianrobert.plpgcheck.catalog.ColumnInfo;
import me.christianrobert.plpgcheck.catalog.PgType;
import me.christianrobert.plpgcheck.sql.SqlAnalysisException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks the tuple shape of record variables. Untyped records start unassigned and take
 * the shape of the first value assigned to them. A record filled by dynamic SQL or from
 * an unbound cursor is degraded: its fields are accepted with unknown type.
 */
public class RecordPropagator {

    public enum ShapeState {
        UNASSIGNED,
        SHAPED,
        DEGRADED
    }

    private static final class Shape {
        private final ShapeState state;
        private final List<ColumnInfo> fields;
        private final boolean hinted;

        Shape(ShapeState state, List<ColumnInfo> fields, boolean hinted) {
            this.state = state;
            this.fields = fields;
            this.hinted = hinted;
        }
    }

    private static final Shape UNASSIGNED = new Shape(ShapeState.UNASSIGNED, List.of(), false);

    private final CompiledRoutine routine;
    private final Map<Integer, Shape> shapes = new HashMap<>();

    public RecordPropagator(CompiledRoutine routine) {
        this.routine = routine;
    }

    private Shape shape(int varno) {
        Datum datum = routine.getDatum(varno);
        if (datum instanceof RecordDatum && ((RecordDatum) datum).isTyped()) {
            return new Shape(ShapeState.SHAPED, ((RecordDatum) datum).getDeclaredType().getFields(), false);
        }
        return shapes.getOrDefault(varno, UNASSIGNED);
    }

    public ShapeState stateOf(int varno) {
        return shape(varno).state;
    }

    public boolean isHinted(int varno) {
        return shape(varno).hinted;
    }

    /**
     * Fields of a shaped record, empty otherwise.
     */
    public List<ColumnInfo> fieldsOf(int varno) {
        return shape(varno).fields;
    }

    /**
     * Fixes the shape from an assigned value.
     *
     * @return {@code true} when a different shape was known before
     */
    public boolean assign(int varno, List<ColumnInfo> fields) {
        if (isTypedRecord(varno)) {
            return false;
        }
        Shape previous = shapes.get(varno);
        if (previous != null && previous.hinted) {
            return false;
        }
        shapes.put(varno, new Shape(ShapeState.SHAPED, List.copyOf(fields), false));
        return previous != null && previous.state == ShapeState.SHAPED && !sameShape(previous.fields, fields);
    }

    /**
     * The value comes from a source whose shape is not known before run time.
     */
    public void degrade(int varno) {
        if (isTypedRecord(varno)) {
            return;
        }
        Shape previous = shapes.get(varno);
        if (previous != null && previous.hinted) {
            return;
        }
        shapes.put(varno, new Shape(ShapeState.DEGRADED, List.of(), false));
    }

    /**
     * Shape supplied by a {@code type:} pragma; later assignments do not change it.
     */
    public void hint(int varno, List<ColumnInfo> fields) {
        shapes.put(varno, new Shape(ShapeState.SHAPED, List.copyOf(fields), true));
    }

    /**
     * Type of the whole record value.
     */
    public PgType typeOf(int varno) {
        Datum datum = routine.getDatum(varno);
        if (datum instanceof RecordDatum && ((RecordDatum) datum).isTyped()) {
            return ((RecordDatum) datum).getDeclaredType();
        }
        Shape shape = shape(varno);
        if (shape.state == ShapeState.SHAPED) {
            return PgType.composite(0, null, "record", shape.fields);
        }
        return BuiltinTypes.RECORD;
    }

    /**
     * Type of {@code record.field}.
     *
     * @throws SqlAnalysisException when the record has no shape yet or lacks the field
     */
    public PgType fieldType(int varno, String field) throws SqlAnalysisException {
        Datum datum = routine.getDatum(varno);
        Shape shape = shape(varno);
        switch (shape.state) {
            case UNASSIGNED:
                throw new SqlAnalysisException("55000", "record \"" + datum.getRefname() + "\" is not assigned yet",
                        "The tuple structure of a not-yet-assigned record is indeterminate.", null, 0);
            case DEGRADED:
                return BuiltinTypes.UNKNOWN;
            default:
                for (ColumnInfo column : shape.fields) {
                    if (column.getName().equals(field)) {
                        return column.getType();
                    }
                }
                throw new SqlAnalysisException("42703", "record \"" + datum.getRefname() + "\" has no field \""
                        + field + "\"", 0);
        }
    }

    private boolean isTypedRecord(int varno) {
        Datum datum = routine.getDatum(varno);
        return datum instanceof RecordDatum && ((RecordDatum) datum).isTyped();
    }

    static boolean sameShape(List<ColumnInfo> a, List<ColumnInfo> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!a.get(i).getName().equals(b.get(i).getName())
                    || !a.get(i).getType().equals(b.get(i).getType())) {
                return false;
            }
        }
        return true;
    }
}
