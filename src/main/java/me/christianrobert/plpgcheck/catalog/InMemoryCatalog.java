package me.christianrobert.plpgcheck.catalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A catalog built up in code. Used for offline checks and throughout the tests.
 *
 * <pre>
 * Catalog catalog = new InMemoryCatalog()
 *         .addTable("public.t1", "a integer", "b text")
 *         .addSequence("public.s1");
 * </pre>
 */
public class InMemoryCatalog implements Catalog {

    private final BuiltinCatalog builtins = new BuiltinCatalog();
    private final Map<String, RelationInfo> relations = new LinkedHashMap<>();
    private final List<FunctionInfo> functions = new ArrayList<>();
    private final List<OperatorInfo> operators = new ArrayList<>();
    private final List<String> searchPath;
    private long nextOid = 16384;

    public InMemoryCatalog() {
        this(List.of("public"));
    }

    public InMemoryCatalog(List<String> searchPath) {
        this.searchPath = List.copyOf(searchPath);
    }

    public InMemoryCatalog addTable(String name, String... columnDefinitions) {
        return addRelation(name, RelationKind.TABLE, columnDefinitions);
    }

    public InMemoryCatalog addView(String name, String... columnDefinitions) {
        return addRelation(name, RelationKind.VIEW, columnDefinitions);
    }

    public InMemoryCatalog addCompositeType(String name, String... fieldDefinitions) {
        return addRelation(name, RelationKind.COMPOSITE_TYPE, fieldDefinitions);
    }

    public InMemoryCatalog addSequence(String name) {
        return addRelation(name, RelationKind.SEQUENCE,
                "last_value bigint", "log_cnt bigint", "is_called boolean");
    }

    /**
     * Registers a function or procedure; the builder receives a fresh oid.
     */
    public InMemoryCatalog addFunction(FunctionInfo.Builder function) {
        functions.add(function.oid(nextOid++).build());
        return this;
    }

    public InMemoryCatalog addOperator(String schema, String symbol, PgType left, PgType right, PgType result,
                                       Volatility volatility) {
        operators.add(new OperatorInfo(nextOid++, schema, symbol, left, right, result, volatility));
        return this;
    }

    private InMemoryCatalog addRelation(String name, RelationKind kind, String... columnDefinitions) {
        QualifiedName qualified = QualifiedName.parse(name);
        String schema = qualified.isQualified() ? qualified.getSchema() : searchPath.get(0);
        List<ColumnInfo> columns = new ArrayList<>();
        for (String definition : columnDefinitions) {
            columns.add(parseColumn(definition));
        }
        relations.put(schema + "." + qualified.getName(),
                new RelationInfo(nextOid++, schema, qualified.getName(), kind, columns));
        return this;
    }

    private ColumnInfo parseColumn(String definition) {
        String trimmed = definition.trim();
        int space = trimmed.indexOf(' ');
        if (space < 0) {
            throw new IllegalArgumentException("Column definition needs a name and a type: " + definition);
        }
        String columnName = QualifiedName.normalizeIdentifier(trimmed.substring(0, space));
        String typeText = trimmed.substring(space + 1).trim();
        boolean notNull = false;
        if (typeText.toLowerCase(Locale.ROOT).endsWith(" not null")) {
            notNull = true;
            typeText = typeText.substring(0, typeText.length() - " not null".length()).trim();
        }
        PgType type = findType(typeText);
        if (type == null) {
            throw new IllegalArgumentException("Unknown column type: " + typeText);
        }
        return new ColumnInfo(columnName, type, notNull);
    }

    @Override
    public RelationInfo findRelation(QualifiedName name) {
        if (name.isQualified()) {
            return relations.get(name.getSchema() + "." + name.getName());
        }
        for (String schema : searchPath) {
            RelationInfo relation = relations.get(schema + "." + name.getName());
            if (relation != null) {
                return relation;
            }
        }
        return null;
    }

    @Override
    public List<FunctionInfo> findFunctions(QualifiedName name) {
        List<FunctionInfo> result = new ArrayList<>(builtins.findFunctions(name));
        for (FunctionInfo function : functions) {
            if (!function.getName().equals(name.getName())) {
                continue;
            }
            boolean visible = name.isQualified()
                    ? function.getSchema().equals(name.getSchema())
                    : searchPath.contains(function.getSchema());
            if (visible) {
                result.add(function);
            }
        }
        return result;
    }

    @Override
    public OperatorInfo findOperator(String symbol, PgType left, PgType right) {
        for (OperatorInfo operator : operators) {
            if (operator.getSymbol().equals(symbol)
                    && sameType(operator.getLeft(), left)
                    && sameType(operator.getRight(), right)) {
                return operator;
            }
        }
        return null;
    }

    private static boolean sameType(PgType declared, PgType actual) {
        if (declared == null || actual == null) {
            return declared == actual;
        }
        return declared.equals(actual);
    }
}
