package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.ast.Datum;
import me.christianrobert.plpgcheck.ast.Namespace;
import me.christianrobert.plpgcheck.ast.RecordDatum;
import me.christianrobert.plpgcheck.ast.RecordFieldDatum;
import me.christianrobert.plpgcheck.ast.RowDatum;
import me.christianrobert.plpgcheck.ast.Variable;
import me.christianrobert.plpgcheck.catalog.BuiltinTypes;
import me.christianrobert.plpgcheck.catalog.PgType;
import me.christianrobert.plpgcheck.sql.ParamRef;
import me.christianrobert.plpgcheck.sql.ParamResolver;
import me.christianrobert.plpgcheck.sql.SqlAnalysisException;

import java.util.List;

/**
 * Resolves the names of a query against the variables visible at one point of the routine.
 * Positional parameters resolve to the routine's {@code $n} aliases, or to the USING list
 * when the query is run by EXECUTE.
 */
class VariableResolver implements ParamResolver {

    private final CheckState state;
    private final Namespace namespace;
    private final List<PgType> usingTypes;

    VariableResolver(CheckState state, Namespace namespace) {
        this(state, namespace, null);
    }

    VariableResolver(CheckState state, Namespace namespace, List<PgType> usingTypes) {
        this.state = state;
        this.namespace = namespace;
        this.usingTypes = usingTypes;
    }

    @Override
    public ParamRef resolveName(List<String> nameParts) throws SqlAnalysisException {
        if (namespace == null || nameParts.isEmpty()) {
            return null;
        }
        String first = nameParts.get(0);
        if (nameParts.size() == 1) {
            int varno = namespace.lookupVariable(first);
            return varno >= 0 ? reference(varno, first) : null;
        }
        if (nameParts.size() == 2) {
            int qualified = namespace.lookupQualified(first, nameParts.get(1));
            int varno = namespace.lookupVariable(first);
            if (varno >= 0 && hasFields(varno)) {
                return field(varno, nameParts.get(1), first + "." + nameParts.get(1));
            }
            if (qualified >= 0) {
                return reference(qualified, first + "." + nameParts.get(1));
            }
            return null;
        }
        if (nameParts.size() == 3) {
            int varno = namespace.lookupQualified(first, nameParts.get(1));
            if (varno >= 0 && hasFields(varno)) {
                return field(varno, nameParts.get(2), String.join(".", nameParts));
            }
        }
        return null;
    }

    @Override
    public ParamRef resolveNumber(int number) throws SqlAnalysisException {
        if (usingTypes != null) {
            if (number < 1 || number > usingTypes.size()) {
                return null;
            }
            return new ParamRef(number, "$" + number, usingTypes.get(number - 1), true);
        }
        if (namespace == null) {
            return null;
        }
        int varno = namespace.lookupVariable("$" + number);
        return varno >= 0 ? reference(varno, "$" + number) : null;
    }

    private boolean hasFields(int varno) {
        Datum datum = state.getCompiled().getDatum(varno);
        return datum instanceof RecordDatum || datum instanceof RowDatum;
    }

    private ParamRef reference(int varno, String name) {
        return new ParamRef(varno, name, typeOf(varno), false);
    }

    private ParamRef field(int varno, String fieldName, String display) throws SqlAnalysisException {
        Datum datum = state.getCompiled().getDatum(varno);
        if (datum instanceof RowDatum) {
            for (RowDatum.RowField rowField : ((RowDatum) datum).getFields()) {
                if (rowField.getName().equals(fieldName)) {
                    return reference(rowField.getVarno(), display);
                }
            }
            throw new SqlAnalysisException("42703", "record \"" + datum.getRefname() + "\" has no field \""
                    + fieldName + "\"", 0);
        }
        PgType type = state.getRecords().fieldType(varno, fieldName);
        return new ParamRef(varno, display, type, false);
    }

    /**
     * Current type of a datum; records report the shape known at this point of the walk.
     */
    PgType typeOf(int varno) {
        Datum datum = state.getCompiled().getDatum(varno);
        if (datum instanceof Variable) {
            return ((Variable) datum).getType();
        }
        if (datum instanceof RowDatum) {
            PgType rowType = ((RowDatum) datum).getRowType();
            return rowType != null ? rowType : BuiltinTypes.RECORD;
        }
        if (datum instanceof RecordDatum) {
            return state.getRecords().typeOf(varno);
        }
        if (datum instanceof RecordFieldDatum) {
            RecordFieldDatum field = (RecordFieldDatum) datum;
            try {
                return state.getRecords().fieldType(field.getRecordVarno(), field.getFieldName());
            } catch (SqlAnalysisException e) {
                return BuiltinTypes.UNKNOWN;
            }
        }
        return BuiltinTypes.UNKNOWN;
    }
}
