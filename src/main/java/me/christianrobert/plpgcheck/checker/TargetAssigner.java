package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.ast.Datum;
import me.christianrobert.plpgcheck.ast.RecordDatum;
import me.christianrobert.plpgcheck.ast.RecordFieldDatum;
import me.christianrobert.plpgcheck.ast.RowDatum;
import me.christianrobert.plpgcheck.ast.Variable;
import me.christianrobert.plpgcheck.catalog.BuiltinTypes;
import me.christianrobert.plpgcheck.catalog.CastContext;
import me.christianrobert.plpgcheck.catalog.CastRules;
import me.christianrobert.plpgcheck.catalog.ColumnInfo;
import me.christianrobert.plpgcheck.catalog.PgType;
import me.christianrobert.plpgcheck.diagnostic.Diagnostic;
import me.christianrobert.plpgcheck.diagnostic.Severity;
import me.christianrobert.plpgcheck.sql.ResolvedColumn;
import me.christianrobert.plpgcheck.sql.SqlAnalysisException;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves the shape of a value into an assignment target: checks scalar types, row
 * arity and fixes the shape of record variables.
 */
class TargetAssigner {

    private final CheckState state;

    TargetAssigner(CheckState state) {
        this.state = state;
    }

    /**
     * Records a write of the datum. Rows mark their fields, record fields their record.
     */
    void markTarget(int varno) {
        Datum datum = state.getCompiled().getDatum(varno);
        markWritten(datum);
        if (datum instanceof RowDatum) {
            for (RowDatum.RowField field : ((RowDatum) datum).getFields()) {
                markWritten(state.getCompiled().getDatum(field.getVarno()));
            }
        } else if (datum instanceof RecordFieldDatum) {
            state.markWritten(((RecordFieldDatum) datum).getRecordVarno());
        }
    }

    private void markWritten(Datum datum) {
        state.markWritten(datum.getVarno());
        if (datum.isAutoVariable()) {
            state.report(Diagnostic.builder(Severity.WARNING_EXTRA,
                    "auto varible \"" + datum.getRefname() + "\" should not be modified by user"));
        }
    }

    /**
     * Assigns a single value of the given type.
     */
    void assignValue(int varno, PgType type, boolean isNull) {
        List<ResolvedColumn> columns = new ArrayList<>();
        columns.add(new ResolvedColumn("?column?", type, null));
        assignColumns(varno, columns, isNull);
    }

    /**
     * Assigns a query result. A single composite column is expanded when the target
     * is a row or a record.
     */
    void assignColumns(int varno, List<ResolvedColumn> columns, boolean isNull) {
        markTarget(varno);
        if (columns.isEmpty()) {
            return;
        }
        Datum datum = state.getCompiled().getDatum(varno);
        switch (datum.getKind()) {
            case VAR:
                assignScalar(((Variable) datum).getType(), columns, isNull);
                break;
            case RECFIELD:
                assignField((RecordFieldDatum) datum, columns, isNull);
                break;
            case ROW:
                assignRow((RowDatum) datum, expand(columns), isNull);
                break;
            case RECORD:
                assignRecord((RecordDatum) datum, columns, isNull);
                break;
            default:
                break;
        }
    }

    private void assignScalar(PgType target, List<ResolvedColumn> columns, boolean isNull) {
        checkTypes(target, columns.get(0).getType(), isNull);
    }

    private void assignField(RecordFieldDatum field, List<ResolvedColumn> columns, boolean isNull) {
        PgType target;
        try {
            target = state.getRecords().fieldType(field.getRecordVarno(), field.getFieldName());
        } catch (SqlAnalysisException e) {
            state.report(Diagnostic.builder(Severity.ERROR, e.getMessage())
                    .sqlState(e.getSqlState())
                    .detail(e.getDetail()));
            return;
        }
        if (target.isUnknown()) {
            return;
        }
        assignScalar(target, columns, isNull);
    }

    private void assignRow(RowDatum row, List<ColumnInfo> fields, boolean isNull) {
        List<RowDatum.RowField> targets = row.getFields();
        int count = Math.min(targets.size(), fields.size());
        for (int i = 0; i < count; i++) {
            int fieldVarno = targets.get(i).getVarno();
            Datum target = state.getCompiled().getDatum(fieldVarno);
            if (target instanceof Variable) {
                checkTypes(((Variable) target).getType(), fields.get(i).getType(), isNull);
            } else if (target instanceof RecordFieldDatum) {
                List<ResolvedColumn> single = new ArrayList<>();
                single.add(new ResolvedColumn(fields.get(i).getName(), fields.get(i).getType(), null));
                assignField((RecordFieldDatum) target, single, isNull);
            }
        }
        if (targets.size() > fields.size()) {
            state.report(Diagnostic.builder(Severity.WARNING_OTHERS, "too few attributes for target variables")
                    .detail("There are more target variables than output columns in query.")
                    .hint("Check target variables in SELECT INTO statement."));
        } else if (targets.size() < fields.size()) {
            state.report(Diagnostic.builder(Severity.WARNING_OTHERS, "too many attributes for target variables")
                    .detail("There are less target variables than output columns in query.")
                    .hint("Check target variables in SELECT INTO statement"));
        }
    }

    private void assignRecord(RecordDatum record, List<ResolvedColumn> columns, boolean isNull) {
        if (isNull && columns.size() == 1) {
            return;
        }
        List<ColumnInfo> fields = expand(columns);
        if (record.isTyped()) {
            PgType declared = record.getDeclaredType();
            if (columns.size() == 1 && declared.equals(columns.get(0).getType())) {
                return;
            }
            if (columns.size() == 1 && !columns.get(0).getType().isComposite()
                    && !columns.get(0).getType().isUnknown()) {
                state.report(Diagnostic.builder(Severity.ERROR, "cannot assign scalar variable to composite target")
                        .sqlState(SqlStates.DATATYPE_MISMATCH));
                return;
            }
            checkCompositeFields(declared.getFields(), fields);
            return;
        }
        if (columns.size() == 1 && isOpaqueRecord(columns.get(0).getType())) {
            state.getRecords().degrade(record.getVarno());
            return;
        }
        if (state.getRecords().assign(record.getVarno(), fields)) {
            state.report(Diagnostic.builder(Severity.WARNING_EXTRA,
                    "record \"" + record.getRefname() + "\" is assigned a value of different structure")
                    .detail("The record variable is used for tuples of different shape."));
        }
    }

    private void checkCompositeFields(List<ColumnInfo> targets, List<ColumnInfo> sources) {
        int count = Math.min(targets.size(), sources.size());
        for (int i = 0; i < count; i++) {
            checkTypes(targets.get(i).getType(), sources.get(i).getType(), false);
        }
        if (sources.size() < targets.size()) {
            state.report(Diagnostic.builder(Severity.WARNING_OTHERS, "too few attributes for composite variable"));
        } else if (sources.size() > targets.size()) {
            state.report(Diagnostic.builder(Severity.WARNING_OTHERS, "too many attributes for composite variable"));
        }
    }

    /**
     * A single composite column stands for its fields.
     */
    private static List<ColumnInfo> expand(List<ResolvedColumn> columns) {
        if (columns.size() == 1) {
            PgType type = columns.get(0).getType();
            if (type != null && type.isComposite() && !type.getFields().isEmpty()) {
                return type.getFields();
            }
        }
        List<ColumnInfo> fields = new ArrayList<>();
        for (ResolvedColumn column : columns) {
            fields.add(new ColumnInfo(column.getName(), column.getType()));
        }
        return fields;
    }

    private static boolean isOpaqueRecord(PgType type) {
        return type != null && type.isRecord() && type.getFields().isEmpty();
    }

    /**
     * Checks that a value of type {@code source} can be stored in {@code target}.
     */
    void checkTypes(PgType target, PgType source, boolean isNull) {
        if (target == null || source == null) {
            return;
        }
        if (target.equals(BuiltinTypes.TEXT) && source.isUnknown()) {
            return;
        }
        if (source.isComposite() && !target.isComposite() && !target.isPolymorphic()) {
            state.report(Diagnostic.builder(Severity.ERROR, "cannot cast composite value to a scalar type")
                    .sqlState(SqlStates.DATATYPE_MISMATCH));
            return;
        }
        if (target.equals(source) || isNull || source.isUnknown() || target.isPolymorphic()) {
            return;
        }
        String detail = "cast \"" + source.getName() + "\" value to \"" + target.getName() + "\" type";
        CastContext context = CastRules.castContext(source, target);
        Diagnostic.Builder builder;
        if (context == CastContext.NONE) {
            builder = Diagnostic.builder(Severity.WARNING_OTHERS, "target type is different type than source type")
                    .hint("There are no possible explicit coercion between those types, possibly bug!");
        } else if (!context.allowsAssignment()) {
            builder = Diagnostic.builder(Severity.WARNING_OTHERS, "target type is different type than source type")
                    .hint("The input expression type does not have an assignment cast to the target type.");
        } else {
            builder = Diagnostic.builder(Severity.WARNING_PERFORMANCE,
                    "target type is different type than source type")
                    .hint("Hidden casting can be a performance issue.");
        }
        state.report(builder.sqlState(SqlStates.DATATYPE_MISMATCH).detail(detail));
    }
}
