package me.christianrobert.plpgcheck.parser;

import me.christianrobert.plpgcheck.ast.Datum;
import me.christianrobert.plpgcheck.ast.Namespace;
import me.christianrobert.plpgcheck.ast.RecordDatum;
import me.christianrobert.plpgcheck.ast.RecordFieldDatum;
import me.christianrobert.plpgcheck.ast.RowDatum;
import me.christianrobert.plpgcheck.ast.Variable;
import me.christianrobert.plpgcheck.catalog.BuiltinTypes;
import me.christianrobert.plpgcheck.catalog.Catalog;
import me.christianrobert.plpgcheck.catalog.ColumnInfo;
import me.christianrobert.plpgcheck.catalog.PgType;
import me.christianrobert.plpgcheck.catalog.QualifiedName;
import me.christianrobert.plpgcheck.catalog.RelationInfo;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mutable state of one compilation: the datum table, the current namespace and type resolution.
 */
class CompileContext {

    private static final Pattern TYPE_REFERENCE = Pattern.compile("(?is)^(.+?)\\s*%\\s*(type|rowtype)\\s*(\\[\\s*\\])?$");

    private final Catalog catalog;
    private final Map<String, PgType> polymorphicTypes;
    private final List<Datum> datums = new ArrayList<>();
    private final Map<String, Integer> recordFields = new HashMap<>();
    private Namespace namespace = Namespace.empty();

    CompileContext(Catalog catalog, Map<String, PgType> polymorphicTypes) {
        this.catalog = catalog;
        this.polymorphicTypes = polymorphicTypes;
    }

    Catalog getCatalog() {
        return catalog;
    }

    List<Datum> getDatums() {
        return datums;
    }

    Datum getDatum(int varno) {
        return datums.get(varno);
    }

    Namespace getNamespace() {
        return namespace;
    }

    void setNamespace(Namespace namespace) {
        this.namespace = namespace;
    }

    void addToNamespace(String name, int varno) {
        namespace = namespace.withVariable(name, varno);
    }

    Variable newVariable(String name, int lineno, PgType type) {
        Variable variable = new Variable(datums.size(), name, lineno, type);
        datums.add(variable);
        return variable;
    }

    RecordDatum newRecord(String name, int lineno, PgType declaredType) {
        RecordDatum record = new RecordDatum(datums.size(), name, lineno, declaredType);
        datums.add(record);
        return record;
    }

    RowDatum newRow(String name, int lineno, List<RowDatum.RowField> fields, PgType rowType) {
        RowDatum row = new RowDatum(datums.size(), name, lineno, fields, rowType);
        datums.add(row);
        return row;
    }

    /**
     * Creates the datum matching a type: records for composite and {@code record} types,
     * scalar variables for everything else.
     */
    Datum newDatumOfType(String name, int lineno, PgType type) {
        if (type.isComposite()) {
            return newRecord(name, lineno, type.isRecord() ? null : type);
        }
        return newVariable(name, lineno, type);
    }

    /**
     * The datum for {@code record.field}, shared by all references to the same field.
     */
    int recordField(int recordVarno, String field, int lineno) {
        String key = recordVarno + "." + field;
        Integer existing = recordFields.get(key);
        if (existing != null) {
            return existing;
        }
        Datum record = datums.get(recordVarno);
        RecordFieldDatum datum = new RecordFieldDatum(datums.size(), recordVarno, field,
                record.getRefname() + "." + field, lineno);
        datum.setInternal(true);
        datums.add(datum);
        recordFields.put(key, datum.getVarno());
        return datum.getVarno();
    }

    /**
     * Resolves a declared type: {@code %TYPE} and {@code %ROWTYPE} references, catalog types
     * and polymorphic pseudo types.
     */
    PgType resolveType(String typeText, int lineno) {
        String text = typeText.trim().replaceAll("\\s+", " ");
        Matcher reference = TYPE_REFERENCE.matcher(text);
        if (reference.matches()) {
            PgType referenced = "rowtype".equalsIgnoreCase(reference.group(2))
                    ? resolveRowtype(reference.group(1), lineno)
                    : resolveTypeReference(reference.group(1), lineno);
            return reference.group(3) != null ? BuiltinTypes.arrayOf(referenced) : referenced;
        }
        PgType type = catalog.findType(text);
        if (type == null) {
            throw new RoutineCompileException("42704", "type \"" + text + "\" does not exist", lineno);
        }
        return substitutePolymorphic(type);
    }

    PgType substitutePolymorphic(PgType type) {
        if (!type.isPolymorphic()) {
            return type;
        }
        PgType substitute = polymorphicTypes.get(type.getInternalName());
        if (substitute != null) {
            return substitute;
        }
        if (type.isArray() && type.getElementType() != null) {
            PgType element = polymorphicTypes.get(type.getElementType().getInternalName());
            if (element != null) {
                return BuiltinTypes.arrayOf(element);
            }
        }
        return type;
    }

    private PgType resolveRowtype(String relationName, int lineno) {
        RelationInfo relation = catalog.findRelation(QualifiedName.parse(relationName));
        if (relation == null) {
            throw new RoutineCompileException("42P01", "relation \"" + relationName + "\" does not exist", lineno);
        }
        return relation.getRowType();
    }

    private PgType resolveTypeReference(String reference, int lineno) {
        List<String> parts = splitName(reference);
        if (parts.size() == 1) {
            int varno = namespace.lookupVariable(parts.get(0));
            if (varno >= 0) {
                return typeOfDatum(datums.get(varno));
            }
        } else if (parts.size() == 2) {
            int varno = namespace.lookupQualified(parts.get(0), parts.get(1));
            if (varno >= 0) {
                return typeOfDatum(datums.get(varno));
            }
            RelationInfo relation = catalog.findRelation(new QualifiedName(null, parts.get(0)));
            if (relation != null) {
                return columnType(relation, parts.get(1), reference, lineno);
            }
        } else if (parts.size() == 3) {
            RelationInfo relation = catalog.findRelation(new QualifiedName(parts.get(0), parts.get(1)));
            if (relation != null) {
                return columnType(relation, parts.get(2), reference, lineno);
            }
        }
        throw new RoutineCompileException("42704", "variable \"" + reference + "\" does not exist", lineno);
    }

    private static PgType columnType(RelationInfo relation, String column, String reference, int lineno) {
        ColumnInfo info = relation.findColumn(column);
        if (info == null) {
            throw new RoutineCompileException("42703", "column \"" + column + "\" of relation \""
                    + relation.getName() + "\" does not exist", lineno, "referenced by " + reference + "%TYPE");
        }
        return info.getType();
    }

    PgType typeOfDatum(Datum datum) {
        if (datum instanceof Variable) {
            return ((Variable) datum).getType();
        }
        if (datum instanceof RecordDatum) {
            RecordDatum record = (RecordDatum) datum;
            return record.getDeclaredType() != null ? record.getDeclaredType() : BuiltinTypes.RECORD;
        }
        if (datum instanceof RowDatum && ((RowDatum) datum).getRowType() != null) {
            return ((RowDatum) datum).getRowType();
        }
        return BuiltinTypes.RECORD;
    }

    static List<String> splitName(String name) {
        List<String> parts = new ArrayList<>();
        for (String part : SqlText.splitTopLevel(name, '.')) {
            parts.add(QualifiedName.normalizeIdentifier(part));
        }
        return parts;
    }

    static String lower(String text) {
        return text.toLowerCase(Locale.ROOT);
    }
}
