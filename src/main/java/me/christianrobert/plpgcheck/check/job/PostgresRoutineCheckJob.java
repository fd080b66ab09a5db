package me.christianrobert.plpgcheck.check.job;

import jakarta.enterprise.context.Dependent;
import jakarta.inject.Inject;
import me.christianrobert.plpgcheck.catalog.PostgresCatalog;
import me.christianrobert.plpgcheck.check.service.CheckService;
import me.christianrobert.plpgcheck.checker.CheckOptions;
import me.christianrobert.plpgcheck.checker.CheckResult;
import me.christianrobert.plpgcheck.core.job.AbstractDatabaseCheckJob;
import me.christianrobert.plpgcheck.core.job.model.JobProgress;
import me.christianrobert.plpgcheck.core.job.model.check.RoutineCheckSummary;
import me.christianrobert.plpgcheck.core.job.model.check.RoutineCheckSummary.RoutineOutcome;
import me.christianrobert.plpgcheck.database.service.PostgresConnectionService;
import me.christianrobert.plpgcheck.routine.PostgresRoutineRepository;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;
import me.christianrobert.plpgcheck.routine.TriggerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Checks every PL/pgSQL routine of the configured schemas.
 * <p>
 * Trigger functions are checked against the first table that has a trigger using them.
 * A trigger function with no such table is reported as failed.
 */
@Dependent
public class PostgresRoutineCheckJob extends AbstractDatabaseCheckJob<RoutineCheckSummary> {

    private static final Logger log = LoggerFactory.getLogger(PostgresRoutineCheckJob.class);

    private static final String SCHEMA_SQL = """
            SELECT nspname FROM pg_catalog.pg_namespace
            WHERE nspname NOT IN ('pg_catalog', 'information_schema', 'pg_toast')
              AND nspname NOT LIKE 'pg_temp_%' AND nspname NOT LIKE 'pg_toast_temp_%'
            ORDER BY nspname
            """;

    private static final String TRIGGER_RELATION_SQL = """
            SELECT n.nspname, c.relname
            FROM pg_catalog.pg_trigger t
            JOIN pg_catalog.pg_class c ON c.oid = t.tgrelid
            JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
            WHERE t.tgfoid = ?::oid AND NOT t.tgisinternal
            ORDER BY t.oid
            LIMIT 1
            """;

    @Inject
    PostgresConnectionService postgresConnectionService;

    @Inject
    CheckService checkService;

    @Override
    public String getCheckType() {
        return "ROUTINE_CHECK";
    }

    @Override
    public Class<RoutineCheckSummary> getResultType() {
        return RoutineCheckSummary.class;
    }

    @Override
    protected List<RoutineCheckSummary> performCheck(Consumer<JobProgress> progressCallback) throws Exception {
        log.info("Starting PL/pgSQL routine check");
        updateProgress(progressCallback, 0, "Initializing", "Connecting to PostgreSQL");

        RoutineCheckSummary summary = new RoutineCheckSummary();
        CheckOptions options = CheckOptions.defaults();
        options.setFatalErrors(false);

        try (Connection connection = postgresConnectionService.getConnection()) {
            List<String> schemas = determineSchemasToProcess(querySchemas(connection), progressCallback);
            PostgresRoutineRepository repository = new PostgresRoutineRepository(connection);
            PostgresCatalog catalog = new PostgresCatalog(connection);

            List<RoutineDefinition> routines = new ArrayList<>();
            for (String schema : schemas) {
                routines.addAll(repository.findRoutines(schema, "plpgsql"));
            }
            log.info("Found {} PL/pgSQL routine(s) in {} schema(s)", routines.size(), schemas.size());

            int processed = 0;
            for (RoutineDefinition routine : routines) {
                updateProgress(progressCallback,
                        JobProgress.ofItems(processed, routines.size(), "Checking " + routine.getSignature()));
                summary.addOutcome(routine.getSchema(), checkOne(connection, catalog, routine, options));
                processed++;
            }
        }

        updateProgress(progressCallback, 95, "Finalizing", generateSummaryMessage(List.of(summary)));
        return List.of(summary);
    }

    private RoutineOutcome checkOne(Connection connection, PostgresCatalog catalog, RoutineDefinition routine,
                                    CheckOptions options) {
        RoutineOutcome outcome = new RoutineOutcome(routine.getSignature());
        try {
            String relation = null;
            if (routine.getTriggerType() == TriggerType.DML) {
                relation = findTriggerRelation(connection, routine.getId());
                if (relation == null) {
                    outcome.fail("trigger function is not used by any trigger");
                    return outcome;
                }
            }
            CheckResult result = checkService.checkSource(routine, catalog, relation, options);
            outcome.addDiagnostics(result.getDiagnostics());
        } catch (RuntimeException e) {
            log.error("Failed to check routine " + routine.getSignature(), e);
            outcome.fail(e.getMessage());
        }
        return outcome;
    }

    private List<String> querySchemas(Connection connection) throws SQLException {
        List<String> schemas = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(SCHEMA_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                schemas.add(rs.getString(1));
            }
        }
        return schemas;
    }

    private String findTriggerRelation(Connection connection, String routineOid) {
        try (PreparedStatement stmt = connection.prepareStatement(TRIGGER_RELATION_SQL)) {
            stmt.setString(1, routineOid);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return rs.getString(1) + "." + rs.getString(2);
                }
            }
        } catch (SQLException e) {
            log.error("Failed to look up trigger relation for routine " + routineOid, e);
            throw new IllegalStateException("Failed to look up trigger relation: " + e.getMessage(), e);
        }
        return null;
    }

    @Override
    protected String generateSummaryMessage(List<RoutineCheckSummary> results) {
        if (results.isEmpty()) {
            return "No routines checked";
        }
        RoutineCheckSummary summary = results.get(0);
        return String.format("Checked %d routine(s): %d clean, %d with warnings, %d with errors, %d failed",
                summary.getTotalRoutines(), summary.getCleanCount(), summary.getWarningCount(),
                summary.getErrorCount(), summary.getFailedCount());
    }
}
