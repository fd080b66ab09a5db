package me.christianrobert.plpgcheck.database.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.plpgcheck.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Opens connections to the PostgreSQL database whose routines and catalog are checked.
 */
@ApplicationScoped
public class PostgresConnectionService {

    private static final Logger log = LoggerFactory.getLogger(PostgresConnectionService.class);

    /** {@code pg_proc.prokind} exists since PostgreSQL 11. */
    static final int MINIMUM_SERVER_VERSION = 110000;

    private static final String SERVER_INFO_SQL = """
            SELECT pg_catalog.current_setting('server_version_num')::int AS version_num,
                   pg_catalog.current_setting('server_version') AS version,
                   EXISTS (SELECT 1 FROM pg_catalog.pg_language WHERE lanname = 'plpgsql') AS has_plpgsql,
                   (SELECT count(*) FROM pg_catalog.pg_proc p
                        JOIN pg_catalog.pg_language l ON l.oid = p.prolang
                    WHERE l.lanname = 'plpgsql'
                      AND p.pronamespace <> 'pg_catalog'::regnamespace) AS plpgsql_routines
            """;

    @Inject
    ConfigService configService;

    /**
     * Connects and reports whether the server can be checked: its version and whether
     * PL/pgSQL is installed.
     */
    public Map<String, Object> testConnection() {
        Map<String, Object> result = new LinkedHashMap<>();
        long startTime = System.currentTimeMillis();

        try (Connection connection = getConnection();
             PreparedStatement stmt = connection.prepareStatement(SERVER_INFO_SQL);
             ResultSet rs = stmt.executeQuery()) {
            long connectionTime = System.currentTimeMillis() - startTime;
            rs.next();
            int versionNum = rs.getInt("version_num");
            boolean hasPlpgsql = rs.getBoolean("has_plpgsql");
            boolean supported = versionNum >= MINIMUM_SERVER_VERSION;

            result.put("status", supported && hasPlpgsql ? "success" : "error");
            result.put("connected", true);
            result.put("connectionTimeMs", connectionTime);
            result.put("serverVersion", rs.getString("version"));
            result.put("plpgsqlInstalled", hasPlpgsql);
            result.put("plpgsqlRoutines", rs.getLong("plpgsql_routines"));
            result.put("url", connection.getMetaData().getURL());
            if (!supported) {
                result.put("message", "PostgreSQL " + rs.getString("version") + " is not supported, 11 or newer is required");
            } else if (!hasPlpgsql) {
                result.put("message", "Language plpgsql is not installed");
            } else {
                result.put("message", "Connected, ready to check routines");
            }
            log.info("PostgreSQL connection test finished in {}ms: {}", connectionTime, result.get("message"));
        } catch (SQLException e) {
            log.error("PostgreSQL connection test failed", e);
            result.put("status", "error");
            result.put("connected", false);
            result.put("message", "Database connection failed: " + e.getMessage());
            result.put("sqlState", e.getSQLState());
        } catch (IllegalStateException e) {
            result.put("status", "error");
            result.put("connected", false);
            result.put("message", e.getMessage());
        }
        return result;
    }

    public Connection getConnection() throws SQLException {
        if (!isConfigured()) {
            throw new IllegalStateException("PostgreSQL connection parameters not configured");
        }
        String url = configService.getConfigValueAsString(ConfigService.POSTGRES_URL);
        log.debug("Opening PostgreSQL connection to {}", url);
        Connection connection = DriverManager.getConnection(url,
                configService.getConfigValueAsString(ConfigService.POSTGRES_USERNAME),
                configService.getConfigValueAsString(ConfigService.POSTGRES_PASSWORD));
        connection.setReadOnly(true);
        return connection;
    }

    public boolean isConfigured() {
        return hasText(ConfigService.POSTGRES_URL) && hasText(ConfigService.POSTGRES_USERNAME)
                && hasText(ConfigService.POSTGRES_PASSWORD);
    }

    private boolean hasText(String key) {
        String value = configService.getConfigValueAsString(key);
        return value != null && !value.trim().isEmpty();
    }
}
