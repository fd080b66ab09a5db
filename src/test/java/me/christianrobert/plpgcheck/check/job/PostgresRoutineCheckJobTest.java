package me.christianrobert.plpgcheck.check.job;

import me.christianrobert.plpgcheck.catalog.Catalog;
import me.christianrobert.plpgcheck.catalog.Volatility;
import me.christianrobert.plpgcheck.check.service.CheckService;
import me.christianrobert.plpgcheck.checker.CheckOptions;
import me.christianrobert.plpgcheck.checker.CheckResult;
import me.christianrobert.plpgcheck.config.service.ConfigService;
import me.christianrobert.plpgcheck.core.job.model.JobProgress;
import me.christianrobert.plpgcheck.core.job.model.check.RoutineCheckSummary;
import me.christianrobert.plpgcheck.core.job.model.check.RoutineCheckSummary.RoutineOutcome;
import me.christianrobert.plpgcheck.database.service.PostgresConnectionService;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for PostgresRoutineCheckJob with a mocked JDBC connection.
 * The connection answers the schema query, the routine query and the trigger lookup
 * with separate result sets.
 */
class PostgresRoutineCheckJobTest {

    private PostgresRoutineCheckJob job;
    private CheckService checkService;
    private Connection connection;

    @BeforeEach
    void setUp() throws Exception {
        job = new PostgresRoutineCheckJob();
        PostgresConnectionService connectionService = mock(PostgresConnectionService.class);
        checkService = mock(CheckService.class);
        connection = mock(Connection.class);

        injectDependency(job, "configService", new ConfigService());
        injectDependency(job, "postgresConnectionService", connectionService);
        injectDependency(job, "checkService", checkService);

        when(connectionService.getConnection()).thenReturn(connection);
        stubQuery("nspname NOT IN", schemaResultSet());
        stubQuery("l.lanname = ?", routineResultSet());
        stubQuery("tgfoid", emptyResultSet());
    }

    // ========== Getters ==========

    @Test
    void testGetters() {
        assertEquals("ROUTINE_CHECK", job.getCheckType());
        assertEquals("POSTGRES_ROUTINE_CHECK", job.getJobType());
        assertEquals(RoutineCheckSummary.class, job.getResultType());
        assertTrue(job.getJobId().startsWith("postgres-routine-check-"));
    }

    // ========== Execution ==========

    @Test
    void testExecute_ChecksRoutinesAndFailsOrphanTrigger() throws Exception {
        when(checkService.checkSource(any(RoutineDefinition.class), any(Catalog.class), any(), any(CheckOptions.class)))
                .thenReturn(new CheckResult("100", List.of(), List.of(), List.of(), Volatility.IMMUTABLE, null, false));
        List<JobProgress> progress = new ArrayList<>();

        List<RoutineCheckSummary> results = job.execute(progress::add).get(10, TimeUnit.SECONDS);

        assertEquals(1, results.size());
        RoutineCheckSummary summary = results.get(0);
        assertEquals(2, summary.getTotalRoutines());
        assertEquals(1, summary.getCleanCount());
        assertEquals(1, summary.getFailedCount());
        assertEquals(0, summary.getErrorCount());

        List<RoutineOutcome> outcomes = summary.getSchemas().get("public");
        assertNotNull(outcomes);
        RoutineOutcome trigger = outcomes.stream()
                .filter(o -> o.getStatus() == RoutineCheckSummary.Status.FAILED)
                .findFirst()
                .orElseThrow();
        assertEquals("trigger function is not used by any trigger", trigger.getFailureMessage());

        assertFalse(progress.isEmpty());
        assertEquals(100, progress.get(progress.size() - 1).getPercentage());
        verify(checkService, times(1)).checkSource(any(RoutineDefinition.class), any(Catalog.class), isNull(),
                argThat(options -> !options.isFatalErrors()));
    }

    @Test
    void testExecute_CheckerFailureIsRecordedPerRoutine() throws Exception {
        when(checkService.checkSource(any(RoutineDefinition.class), any(Catalog.class), any(), any(CheckOptions.class)))
                .thenThrow(new IllegalStateException("catalog lookup failed"));

        List<RoutineCheckSummary> results = job.execute(null).get(10, TimeUnit.SECONDS);

        RoutineCheckSummary summary = results.get(0);
        assertEquals(2, summary.getTotalRoutines());
        assertEquals(2, summary.getFailedCount());
        assertTrue(summary.getSchemas().get("public").stream()
                .anyMatch(o -> "catalog lookup failed".equals(o.getFailureMessage())));
    }

    @Test
    void testExecute_NoConfiguredSchema() throws Exception {
        ConfigService config = new ConfigService();
        config.updateConfiguration(Map.of(ConfigService.CHECK_SCHEMAS, ""));
        injectDependency(job, "configService", config);

        Exception e = assertThrows(Exception.class, () -> job.execute(null).get(10, TimeUnit.SECONDS));
        assertTrue(e.getCause().getMessage().contains("No schema configured"));
        verifyNoInteractions(checkService);
    }

    // ========== Helpers ==========

    private void stubQuery(String marker, ResultSet rs) throws Exception {
        PreparedStatement stmt = mock(PreparedStatement.class);
        when(stmt.executeQuery()).thenReturn(rs);
        when(connection.prepareStatement(contains(marker))).thenReturn(stmt);
    }

    private static ResultSet schemaResultSet() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(true, false);
        when(rs.getString(1)).thenReturn("public");
        return rs;
    }

    private static ResultSet routineResultSet() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(true, true, false);
        when(rs.getLong("oid")).thenReturn(100L, 101L);
        when(rs.getString("nspname")).thenReturn("public");
        when(rs.getString("proname")).thenReturn("f_ok", "trg_fn");
        when(rs.getString("prosrc")).thenReturn("begin return 1; end", "begin return new; end");
        when(rs.getString("lanname")).thenReturn("plpgsql");
        when(rs.getString("prokind")).thenReturn("f");
        when(rs.getString("provolatile")).thenReturn("v");
        when(rs.getString("return_type")).thenReturn("integer", "trigger");
        when(rs.getBoolean("proretset")).thenReturn(false);
        when(rs.getString("arg_modes")).thenReturn(null);
        when(rs.getArray(anyString())).thenReturn(null);
        return rs;
    }

    private static ResultSet emptyResultSet() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(false);
        return rs;
    }

    private void injectDependency(Object target, String fieldName, Object dependency) throws Exception {
        Class<?> type = target.getClass();
        while (type != null) {
            try {
                Field field = type.getDeclaredField(fieldName);
                field.setAccessible(true);
                field.set(target, dependency);
                return;
            } catch (NoSuchFieldException e) {
                type = type.getSuperclass();
            }
        }
        throw new NoSuchFieldException(fieldName);
    }
}
