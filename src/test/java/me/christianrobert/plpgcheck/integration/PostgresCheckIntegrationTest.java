package me.christianrobert.plpgcheck.integration;

import me.christianrobert.plpgcheck.cache.CheckCache;
import me.christianrobert.plpgcheck.catalog.PostgresCatalog;
import me.christianrobert.plpgcheck.check.service.CheckService;
import me.christianrobert.plpgcheck.checker.CheckOptions;
import me.christianrobert.plpgcheck.checker.CheckResult;
import me.christianrobert.plpgcheck.checker.InvalidInputException;
import me.christianrobert.plpgcheck.config.service.ConfigService;
import me.christianrobert.plpgcheck.routine.PostgresRoutineRepository;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;
import me.christianrobert.plpgcheck.routine.TriggerType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.lang.reflect.Field;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks routines stored in a real PostgreSQL database: routines are loaded from
 * {@code pg_proc} and their embedded SQL is resolved against the live catalog.
 */
@Testcontainers(disabledWithoutDocker = true)
class PostgresCheckIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    private Connection connection;
    private CheckService checkService;

    @BeforeEach
    void setup() throws Exception {
        connection = DriverManager.getConnection(postgres.getJdbcUrl(), postgres.getUsername(),
                postgres.getPassword());
        executeUpdate("DROP SCHEMA IF EXISTS app CASCADE");
        executeUpdate("CREATE SCHEMA app");
        executeUpdate("CREATE TABLE app.t1 (a integer, b text)");

        checkService = new CheckService();
        injectDependency(checkService, "configService", new ConfigService());
        injectDependency(checkService, "checkCache", new CheckCache());
    }

    @AfterEach
    void cleanup() throws SQLException {
        if (connection != null && !connection.isClosed()) {
            connection.close();
        }
    }

    // ========== Routine loading ==========

    @Test
    void testFindRoutine_LoadsDefinition() throws SQLException {
        executeUpdate("""
                CREATE FUNCTION app.add_one(p integer) RETURNS integer LANGUAGE plpgsql AS $$
                BEGIN
                  RETURN p + 1;
                END;
                $$
                """);

        RoutineDefinition routine = new PostgresRoutineRepository(connection).findRoutine("app.add_one(integer)");

        assertEquals("app", routine.getSchema());
        assertEquals("add_one", routine.getName());
        assertEquals("plpgsql", routine.getLanguage());
        assertEquals("integer", routine.getReturnType());
        assertEquals(1, routine.getParameters().size());
        assertEquals("p", routine.getParameters().get(0).getName());
        assertEquals(TriggerType.NONE, routine.getTriggerType());
    }

    @Test
    void testFindRoutine_Unknown() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> new PostgresRoutineRepository(connection).findRoutine("app.nosuch"));
        assertEquals("42883", e.getSqlState());
    }

    @Test
    void testFindRoutines_BySchemaAndLanguage() throws SQLException {
        executeUpdate("CREATE FUNCTION app.f_plpgsql() RETURNS integer LANGUAGE plpgsql AS $$ BEGIN RETURN 1; END $$");
        executeUpdate("CREATE FUNCTION app.f_sql() RETURNS integer LANGUAGE sql AS $$ SELECT 1 $$");

        List<RoutineDefinition> routines = new PostgresRoutineRepository(connection).findRoutines("app", "plpgsql");

        assertEquals(1, routines.size());
        assertEquals("f_plpgsql", routines.get(0).getName());
    }

    // ========== Checking against the live catalog ==========

    @Test
    void testCheck_CleanRoutine() throws SQLException {
        executeUpdate("""
                CREATE FUNCTION app.first_a() RETURNS integer LANGUAGE plpgsql AS $$
                DECLARE
                  r integer;
                BEGIN
                  SELECT a INTO r FROM app.t1 WHERE a = 1;
                  RETURN r;
                END;
                $$
                """);

        CheckResult result = check("app.first_a()");

        assertFalse(result.hasErrors(), "Unexpected errors: " + result.getDiagnostics());
    }

    @Test
    void testCheck_MissingRelation() throws SQLException {
        executeUpdate("""
                CREATE FUNCTION app.broken() RETURNS integer LANGUAGE plpgsql AS $$
                BEGIN
                  PERFORM 1 FROM app.nosuch;
                  RETURN 1;
                END;
                $$
                """);

        CheckResult result = check("app.broken()");

        assertTrue(result.getDiagnostics().stream()
                        .anyMatch(d -> "42P01".equals(d.getSqlState())),
                "Expected missing relation error: " + result.getDiagnostics());
    }

    @Test
    void testCheck_MissingColumn() throws SQLException {
        executeUpdate("""
                CREATE FUNCTION app.bad_column() RETURNS text LANGUAGE plpgsql AS $$
                DECLARE
                  v text;
                BEGIN
                  SELECT zz INTO v FROM app.t1;
                  RETURN v;
                END;
                $$
                """);

        CheckResult result = check("app.bad_column()");

        assertTrue(result.hasErrors());
        assertTrue(result.getDiagnostics().stream().anyMatch(d -> "42703".equals(d.getSqlState())),
                "Expected undefined column error: " + result.getDiagnostics());
    }

    // ========== Helpers ==========

    private CheckResult check(String signature) {
        RoutineDefinition routine = new PostgresRoutineRepository(connection).findRoutine(signature);
        return checkService.checkSource(routine, new PostgresCatalog(connection), null, CheckOptions.defaults());
    }

    private void executeUpdate(String sql) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
        }
    }

    private void injectDependency(Object target, String fieldName, Object dependency) throws Exception {
        Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, dependency);
    }
}
