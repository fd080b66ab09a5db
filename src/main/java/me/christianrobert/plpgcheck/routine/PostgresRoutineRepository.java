package me.christianrobert.plpgcheck.routine;

import me.christianrobert.plpgcheck.catalog.QualifiedName;
import me.christianrobert.plpgcheck.catalog.Volatility;
import me.christianrobert.plpgcheck.checker.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads routine definitions from {@code pg_proc}.
 */
public class PostgresRoutineRepository implements RoutineRepository {

    private static final Logger log = LoggerFactory.getLogger(PostgresRoutineRepository.class);

    private static final String ROUTINE_COLUMNS = """
            SELECT p.oid, n.nspname, p.proname, l.lanname, p.prokind, p.prosrc, p.proretset, p.provolatile,
                   pg_catalog.format_type(p.prorettype, NULL) AS return_type,
                   p.proargnames,
                   ARRAY(SELECT pg_catalog.format_type(a.t, NULL)
                         FROM unnest(coalesce(p.proallargtypes, p.proargtypes::oid[])) WITH ORDINALITY AS a(t, i)
                         ORDER BY a.i) AS arg_types,
                   array_to_string(p.proargmodes, ',') AS arg_modes,
                   p.proconfig
            FROM pg_catalog.pg_proc p
                JOIN pg_catalog.pg_namespace n ON n.oid = p.pronamespace
                JOIN pg_catalog.pg_language l ON l.oid = p.prolang
            """;

    private final Connection connection;

    public PostgresRoutineRepository(Connection connection) {
        this.connection = connection;
    }

    @Override
    public RoutineDefinition findRoutine(String nameOrSignature) {
        String text = nameOrSignature.trim();
        if (text.matches("\\d+")) {
            List<RoutineDefinition> found = query(ROUTINE_COLUMNS + " WHERE p.oid = ?", Long.parseLong(text));
            if (found.isEmpty()) {
                throw new InvalidInputException("42883", "function with OID " + text + " does not exist");
            }
            return found.get(0);
        }
        if (text.indexOf('(') >= 0) {
            List<RoutineDefinition> found = query(ROUTINE_COLUMNS
                    + " WHERE p.oid = pg_catalog.to_regprocedure(?)::oid", text);
            if (found.isEmpty()) {
                throw new InvalidInputException("42883", "function \"" + text + "\" does not exist");
            }
            return found.get(0);
        }
        QualifiedName name = QualifiedName.parse(text);
        List<RoutineDefinition> found = name.isQualified()
                ? query(ROUTINE_COLUMNS + " WHERE p.proname = ? AND n.nspname = ?", name.getName(), name.getSchema())
                : query(ROUTINE_COLUMNS + " WHERE p.proname = ? AND pg_catalog.pg_function_is_visible(p.oid)",
                        name.getName());
        if (found.isEmpty()) {
            throw new InvalidInputException("42883", "function \"" + text + "\" does not exist");
        }
        if (found.size() > 1) {
            throw new InvalidInputException("42725", "more than one function is named \"" + text + "\"");
        }
        return found.get(0);
    }

    @Override
    public List<RoutineDefinition> findRoutines(String schema, String language) {
        return query(ROUTINE_COLUMNS + " WHERE n.nspname = ? AND l.lanname = ? AND p.prokind IN ('f', 'p')"
                + " ORDER BY p.proname, p.oid", schema, language);
    }

    private List<RoutineDefinition> query(String sql, Object... params) {
        List<RoutineDefinition> routines = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    routines.add(map(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to load routine definitions", e);
            throw new IllegalStateException("Failed to load routine definitions: " + e.getMessage(), e);
        }
        log.debug("Loaded {} routine definitions", routines.size());
        return routines;
    }

    private static RoutineDefinition map(ResultSet rs) throws SQLException {
        RoutineDefinition routine = new RoutineDefinition(rs.getString("nspname"), rs.getString("proname"),
                rs.getString("prosrc"));
        routine.setId(String.valueOf(rs.getLong("oid")));
        routine.setLanguage(rs.getString("lanname"));
        routine.setKind("p".equals(rs.getString("prokind")) ? RoutineKind.PROCEDURE : RoutineKind.FUNCTION);
        routine.setReturnsSet(rs.getBoolean("proretset"));
        routine.setVolatility(Volatility.fromCode(rs.getString("provolatile")));
        routine.setReturnType(rs.getString("return_type"));

        String[] names = stringArray(rs.getArray("proargnames"));
        String[] types = stringArray(rs.getArray("arg_types"));
        String modes = rs.getString("arg_modes");
        String[] modeCodes = modes != null && !modes.isEmpty() ? modes.split(",") : new String[0];
        for (int i = 0; i < types.length; i++) {
            String name = i < names.length && !names[i].isEmpty() ? names[i] : null;
            ParamMode mode = i < modeCodes.length ? ParamMode.fromCode(modeCodes[i]) : ParamMode.IN;
            routine.addParameter(new RoutineParameter(name, types[i], mode));
        }

        Map<String, String> settings = new LinkedHashMap<>();
        for (String setting : stringArray(rs.getArray("proconfig"))) {
            int eq = setting.indexOf('=');
            if (eq > 0) {
                settings.put(setting.substring(0, eq), setting.substring(eq + 1));
            }
        }
        routine.setSettings(settings);
        return routine;
    }

    private static String[] stringArray(Array array) throws SQLException {
        if (array == null) {
            return new String[0];
        }
        Object[] values = (Object[]) array.getArray();
        String[] strings = new String[values.length];
        for (int i = 0; i < values.length; i++) {
            strings[i] = values[i] != null ? values[i].toString() : "";
        }
        return strings;
    }
}
