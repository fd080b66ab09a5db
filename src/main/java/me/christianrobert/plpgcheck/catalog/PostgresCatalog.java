package me.christianrobert.plpgcheck.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog lookups against a live PostgreSQL server. Results are memoised for the
 * lifetime of the instance, which is meant to be one check run or one batch.
 */
public class PostgresCatalog implements Catalog {

    private static final Logger log = LoggerFactory.getLogger(PostgresCatalog.class);

    private static final String RELATION_COLUMNS = """
            SELECT c.oid, n.nspname, c.relname, c.relkind
            FROM pg_catalog.pg_class c
                JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
            """;

    private static final String FUNCTION_COLUMNS = """
            SELECT p.oid, n.nspname, p.proname, p.prokind, p.provolatile, p.proretset, p.prorettype,
                   p.provariadic <> 0 AS is_variadic, p.pronargdefaults,
                   array_to_string(p.proargtypes::oid[], ',') AS arg_types,
                   array_to_string(p.proallargtypes, ',') AS all_arg_types,
                   array_to_string(p.proargmodes, ',') AS arg_modes
            FROM pg_catalog.pg_proc p
                JOIN pg_catalog.pg_namespace n ON n.oid = p.pronamespace
            """;

    private final Connection connection;
    private final BuiltinCatalog builtins = new BuiltinCatalog();
    private final Map<QualifiedName, Optional<RelationInfo>> relations = new HashMap<>();
    private final Map<QualifiedName, List<FunctionInfo>> functions = new HashMap<>();
    private final Map<String, Optional<PgType>> typesByName = new HashMap<>();
    private final Map<Long, PgType> typesByOid = new HashMap<>();
    private final Map<String, Optional<OperatorInfo>> operators = new HashMap<>();

    public PostgresCatalog(Connection connection) {
        this.connection = connection;
    }

    @Override
    public RelationInfo findRelation(QualifiedName name) {
        return relations.computeIfAbsent(name, key -> Optional.ofNullable(loadRelation(key))).orElse(null);
    }

    @Override
    public PgType findType(String typeName) {
        PgType builtin = BuiltinTypes.lookup(typeName);
        if (builtin != null) {
            return builtin;
        }
        return typesByName.computeIfAbsent(typeName, key -> Optional.ofNullable(loadTypeByName(key))).orElse(null);
    }

    @Override
    public List<FunctionInfo> findFunctions(QualifiedName name) {
        return functions.computeIfAbsent(name, this::loadFunctions);
    }

    @Override
    public OperatorInfo findOperator(String symbol, PgType left, PgType right) {
        String key = symbol + "(" + (left != null ? left.getOid() : 0) + "," + (right != null ? right.getOid() : 0) + ")";
        return operators.computeIfAbsent(key, k -> Optional.ofNullable(loadOperator(symbol, left, right))).orElse(null);
    }

    private RelationInfo loadRelation(QualifiedName name) {
        String sql = name.isQualified()
                ? RELATION_COLUMNS + " WHERE c.relname = ? AND n.nspname = ?"
                : RELATION_COLUMNS + " WHERE c.relname = ? AND pg_catalog.pg_table_is_visible(c.oid)";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, name.getName());
            if (name.isQualified()) {
                stmt.setString(2, name.getSchema());
            }
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    log.debug("Relation {} not found", name);
                    return null;
                }
                long oid = rs.getLong("oid");
                RelationKind kind = RelationKind.fromRelkind(rs.getString("relkind"));
                return new RelationInfo(oid, rs.getString("nspname"), rs.getString("relname"), kind,
                        loadColumns(oid));
            }
        } catch (SQLException e) {
            log.error("Failed to load relation " + name, e);
            throw new IllegalStateException("Failed to load relation " + name + ": " + e.getMessage(), e);
        }
    }

    private List<ColumnInfo> loadColumns(long relationOid) throws SQLException {
        String sql = """
                SELECT a.attname, a.atttypid, a.attnotnull
                FROM pg_catalog.pg_attribute a
                WHERE a.attrelid = ? AND a.attnum > 0 AND NOT a.attisdropped
                ORDER BY a.attnum
                """;
        List<ColumnInfo> columns = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, relationOid);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    columns.add(new ColumnInfo(rs.getString("attname"), typeByOid(rs.getLong("atttypid")),
                            rs.getBoolean("attnotnull")));
                }
            }
        }
        return columns;
    }

    private PgType loadTypeByName(String typeName) {
        try (PreparedStatement stmt = connection.prepareStatement("SELECT pg_catalog.to_regtype(?)::oid AS oid")) {
            stmt.setString(1, typeName);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                long oid = rs.getLong("oid");
                if (rs.wasNull()) {
                    log.debug("Type {} not found", typeName);
                    return null;
                }
                return typeByOid(oid);
            }
        } catch (SQLException e) {
            log.error("Failed to resolve type " + typeName, e);
            throw new IllegalStateException("Failed to resolve type " + typeName + ": " + e.getMessage(), e);
        }
    }

    PgType typeByOid(long oid) throws SQLException {
        PgType builtin = BuiltinTypes.byOid(oid);
        if (builtin != null) {
            return builtin;
        }
        PgType cached = typesByOid.get(oid);
        if (cached != null) {
            return cached;
        }
        String sql = """
                SELECT n.nspname, t.typname, t.typtype, t.typcategory, t.typelem, t.typrelid, t.typbasetype
                FROM pg_catalog.pg_type t
                    JOIN pg_catalog.pg_namespace n ON n.oid = t.typnamespace
                WHERE t.oid = ?
                """;
        PgType type;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, oid);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return BuiltinTypes.UNKNOWN;
                }
                String schema = rs.getString("nspname");
                String name = rs.getString("typname");
                String typtype = rs.getString("typtype");
                long element = rs.getLong("typelem");
                long relationOid = rs.getLong("typrelid");
                long baseType = rs.getLong("typbasetype");
                TypeCategory category = TypeCategory.fromCode(rs.getString("typcategory"));
                if ("d".equals(typtype)) {
                    type = typeByOid(baseType);
                } else if (category == TypeCategory.ARRAY && element != 0) {
                    type = BuiltinTypes.arrayOf(typeByOid(element));
                } else if (relationOid != 0) {
                    type = PgType.composite(oid, schema, name, loadColumns(relationOid));
                } else {
                    type = PgType.userType(oid, schema, name, category);
                }
            }
        }
        typesByOid.put(oid, type);
        return type;
    }

    private List<FunctionInfo> loadFunctions(QualifiedName name) {
        if (!name.isQualified() || "pg_catalog".equals(name.getSchema())) {
            List<FunctionInfo> builtin = builtins.findFunctions(name);
            if (!builtin.isEmpty()) {
                return builtin;
            }
        }
        String sql = name.isQualified()
                ? FUNCTION_COLUMNS + " WHERE p.proname = ? AND n.nspname = ?"
                : FUNCTION_COLUMNS + " WHERE p.proname = ? AND pg_catalog.pg_function_is_visible(p.oid)";
        List<FunctionInfo> result = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, name.getName());
            if (name.isQualified()) {
                stmt.setString(2, name.getSchema());
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(mapFunction(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to load functions named " + name, e);
            throw new IllegalStateException("Failed to load functions named " + name + ": " + e.getMessage(), e);
        }
        log.debug("Loaded {} candidates for function {}", result.size(), name);
        return result;
    }

    private FunctionInfo mapFunction(ResultSet rs) throws SQLException {
        String prokind = rs.getString("prokind");
        FunctionInfo.Kind kind;
        switch (prokind) {
            case "p":
                kind = FunctionInfo.Kind.PROCEDURE;
                break;
            case "a":
                kind = FunctionInfo.Kind.AGGREGATE;
                break;
            case "w":
                kind = FunctionInfo.Kind.WINDOW;
                break;
            default:
                kind = FunctionInfo.Kind.FUNCTION;
        }
        FunctionInfo.Builder builder = FunctionInfo.builder(rs.getString("nspname"), rs.getString("proname"))
                .oid(rs.getLong("oid"))
                .kind(kind)
                .volatility(Volatility.fromCode(rs.getString("provolatile")))
                .returnsSet(rs.getBoolean("proretset"))
                .returns(typeByOid(rs.getLong("prorettype")))
                .variadic(rs.getBoolean("is_variadic"))
                .defaults(rs.getInt("pronargdefaults"));

        String allArgTypes = rs.getString("all_arg_types");
        String argModes = rs.getString("arg_modes");
        if (kind == FunctionInfo.Kind.PROCEDURE && allArgTypes != null && !allArgTypes.isEmpty()) {
            String[] types = allArgTypes.split(",");
            String[] modes = argModes.split(",");
            for (int i = 0; i < types.length; i++) {
                builder.arg(typeByOid(Long.parseLong(types[i])), modes[i]);
            }
        } else {
            String argTypes = rs.getString("arg_types");
            if (argTypes != null && !argTypes.isEmpty()) {
                for (String type : argTypes.split(",")) {
                    builder.arg(typeByOid(Long.parseLong(type)));
                }
            }
        }
        return builder.build();
    }

    private OperatorInfo loadOperator(String symbol, PgType left, PgType right) {
        String sql = """
                SELECT o.oid, n.nspname, o.oprresult, p.provolatile
                FROM pg_catalog.pg_operator o
                    JOIN pg_catalog.pg_namespace n ON n.oid = o.oprnamespace
                    JOIN pg_catalog.pg_proc p ON p.oid = o.oprcode
                WHERE o.oprname = ? AND o.oprleft = ? AND o.oprright = ?
                  AND n.nspname <> 'pg_catalog'
                """;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, symbol);
            stmt.setLong(2, left != null ? left.getOid() : 0);
            stmt.setLong(3, right != null ? right.getOid() : 0);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return new OperatorInfo(rs.getLong("oid"), rs.getString("nspname"), symbol, left, right,
                        typeByOid(rs.getLong("oprresult")), Volatility.fromCode(rs.getString("provolatile")));
            }
        } catch (SQLException e) {
            log.error("Failed to load operator " + symbol, e);
            throw new IllegalStateException("Failed to load operator " + symbol + ": " + e.getMessage(), e);
        }
    }
}
