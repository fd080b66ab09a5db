package me.christianrobert.plpgcheck.check.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.plpgcheck.ast.CompiledRoutine;
import me.christianrobert.plpgcheck.cache.CheckCache;
import me.christianrobert.plpgcheck.catalog.Catalog;
import me.christianrobert.plpgcheck.catalog.PostgresCatalog;
import me.christianrobert.plpgcheck.checker.CheckOptions;
import me.christianrobert.plpgcheck.checker.CheckRequest;
import me.christianrobert.plpgcheck.checker.CheckResult;
import me.christianrobert.plpgcheck.checker.InvalidInputException;
import me.christianrobert.plpgcheck.checker.PlPgSqlChecker;
import me.christianrobert.plpgcheck.checker.RoutineCheckException;
import me.christianrobert.plpgcheck.config.service.ConfigService;
import me.christianrobert.plpgcheck.coverage.CoverageCalculator;
import me.christianrobert.plpgcheck.coverage.ProfileStore;
import me.christianrobert.plpgcheck.coverage.StatementCounters;
import me.christianrobert.plpgcheck.database.service.PostgresConnectionService;
import me.christianrobert.plpgcheck.dependency.DependencyReport;
import me.christianrobert.plpgcheck.diagnostic.Diagnostic;
import me.christianrobert.plpgcheck.diagnostic.DiagnosticReporter;
import me.christianrobert.plpgcheck.diagnostic.OutputFormat;
import me.christianrobert.plpgcheck.parser.RoutineCompileException;
import me.christianrobert.plpgcheck.parser.RoutineCompiler;
import me.christianrobert.plpgcheck.routine.PostgresRoutineRepository;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Checks routines on request or passively when they start, and reports dependencies and
 * profiler coverage. Defaults come from {@link ConfigService}.
 */
@ApplicationScoped
public class CheckService {

    private static final Logger log = LoggerFactory.getLogger(CheckService.class);

    @Inject
    ConfigService configService;

    @Inject
    PostgresConnectionService postgresConnectionService;

    @Inject
    CheckCache checkCache;

    private final PlPgSqlChecker checker = new PlPgSqlChecker();
    private final RoutineCompiler compiler = new RoutineCompiler();
    private final DiagnosticReporter reporter = new DiagnosticReporter();
    private final CoverageCalculator coverageCalculator = new CoverageCalculator();
    private ProfileStore profileStore;

    public CheckMode getMode() {
        String value = configService.getConfigValueAsString(ConfigService.MODE);
        CheckMode mode = CheckMode.fromConfig(value);
        if (mode == null) {
            log.warn("Unknown check mode '{}', using BY_FUNCTION", value);
            return CheckMode.BY_FUNCTION;
        }
        return mode;
    }

    /**
     * Options of a passive check, taken from the configuration.
     */
    public CheckOptions passiveOptions() {
        CheckOptions options = CheckOptions.defaults();
        boolean nonPerformance = configService.isEnabled(ConfigService.SHOW_NONPERFORMANCE_WARNINGS);
        options.setFatalErrors(configService.isEnabled(ConfigService.FATAL_ERRORS));
        options.setOtherWarnings(nonPerformance);
        options.setExtraWarnings(nonPerformance);
        options.setPerformanceWarnings(configService.isEnabled(ConfigService.SHOW_PERFORMANCE_WARNINGS));
        options.setCompatibilityWarnings(configService.isEnabled(ConfigService.COMPATIBILITY_WARNINGS));
        return options;
    }

    // ------------------------------------------------------------------ active checks

    /**
     * Checks a routine definition against the given catalog.
     */
    public CheckResult checkSource(RoutineDefinition routine, Catalog catalog, String relation, CheckOptions options) {
        if (getMode() == CheckMode.DISABLED) {
            log.info("Checking is disabled, skipping {}", routine.getSignature());
            return CheckResult.disabled(routine.getId());
        }
        log.info("Checking routine {}", routine.getSignature());
        CheckResult result = checker.check(new CheckRequest(routine, catalog)
                .relation(relation)
                .options(options != null ? options : CheckOptions.defaults()));
        log.info("Check of {} finished with {} diagnostics ({} errors)", routine.getSignature(),
                result.getDiagnostics().size(), result.countErrors());
        return result;
    }

    /**
     * Checks a routine definition against the configured database.
     */
    public CheckResult checkSource(RoutineDefinition routine, String relation, CheckOptions options) {
        try (Connection connection = postgresConnectionService.getConnection()) {
            return checkSource(routine, new PostgresCatalog(connection), relation, options);
        } catch (SQLException e) {
            log.error("Failed to connect for checking " + routine.getSignature(), e);
            throw new IllegalStateException("Failed to connect to PostgreSQL: " + e.getMessage(), e);
        }
    }

    /**
     * Loads a stored routine by oid, signature or unique name and checks it.
     */
    public CheckResult checkRoutine(String nameOrSignature, String relation, CheckOptions options) {
        try (Connection connection = postgresConnectionService.getConnection()) {
            RoutineDefinition routine = new PostgresRoutineRepository(connection).findRoutine(nameOrSignature);
            return checkSource(routine, new PostgresCatalog(connection), relation, options);
        } catch (SQLException e) {
            log.error("Failed to connect for checking " + nameOrSignature, e);
            throw new IllegalStateException("Failed to connect to PostgreSQL: " + e.getMessage(), e);
        }
    }

    public String render(CheckResult result, OutputFormat format) {
        return reporter.render(result.getRoutineId(), result.getDiagnostics(), format);
    }

    // ------------------------------------------------------------------ dependencies

    public DependencyReport showDependencies(RoutineDefinition routine, Catalog catalog, String relation,
                                             CheckOptions options) {
        CheckOptions effective = options != null ? options : CheckOptions.defaults();
        effective.setShowDependencies(true);
        CheckResult result = checker.check(new CheckRequest(routine, catalog).relation(relation).options(effective));
        return new DependencyReport(routine.getId(), result.getDependencies());
    }

    public DependencyReport showDependencies(String nameOrSignature, String relation) {
        try (Connection connection = postgresConnectionService.getConnection()) {
            RoutineDefinition routine = new PostgresRoutineRepository(connection).findRoutine(nameOrSignature);
            return showDependencies(routine, new PostgresCatalog(connection), relation, null);
        } catch (SQLException e) {
            log.error("Failed to connect for dependencies of " + nameOrSignature, e);
            throw new IllegalStateException("Failed to connect to PostgreSQL: " + e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------ passive mode

    /**
     * Called when a routine is about to run. Depending on the mode it is checked once per
     * definition, on every start, or not at all.
     *
     * @throws RoutineCheckException when the check found an error and errors are fatal
     */
    public CheckResult onCall(RoutineDefinition routine, Catalog catalog, String relation) {
        CheckMode mode = getMode();
        if (mode == CheckMode.DISABLED || mode == CheckMode.BY_FUNCTION
                || !"plpgsql".equalsIgnoreCase(routine.getLanguage())) {
            return null;
        }
        if (mode == CheckMode.FRESH_START && checkCache.isChecked(routine.getId(), routine.getFingerprint())) {
            log.debug("Routine {} already checked", routine.getSignature());
            return null;
        }
        CheckOptions options = passiveOptions();
        CheckResult result = checker.check(new CheckRequest(routine, catalog).relation(relation).options(options));
        checkCache.markChecked(routine.getId(), routine.getFingerprint());
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            if (diagnostic.isError() && options.isFatalErrors()) {
                throw new RoutineCheckException(routine.getSignature(), diagnostic);
            }
        }
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            log.warn("Routine {}: {}", routine.getSignature(), diagnostic);
        }
        return result;
    }

    // ------------------------------------------------------------------ profiler

    /**
     * Adds one statement execution to the profile, when the profiler is on.
     */
    public boolean recordExecution(RoutineDefinition routine, int statementCount, int stmtId, long micros) {
        if (!configService.isEnabled(ConfigService.PROFILER)) {
            return false;
        }
        return getProfileStore().record(routine.getId(), routine.getFingerprint(), statementCount, stmtId, micros);
    }

    /**
     * Coverage of the recorded profile.
     *
     * @param type {@code statement} or {@code branches}
     */
    public double coverage(RoutineDefinition routine, Catalog catalog, String type) {
        CompiledRoutine compiled;
        try {
            compiled = compiler.compile(routine, catalog);
        } catch (RoutineCompileException e) {
            throw new InvalidInputException(e.getSqlState(), e.getMessage());
        }
        StatementCounters counters = getProfileStore().get(routine.getId(), routine.getFingerprint());
        if (counters == null) {
            counters = new StatementCounters(compiled.getStatementCount());
        }
        String kind = type != null ? type.toLowerCase(Locale.ROOT) : "statement";
        switch (kind) {
            case "statement":
            case "statements":
                return coverageCalculator.statements(compiled, counters);
            case "branch":
            case "branches":
                return coverageCalculator.branches(compiled, counters);
            default:
                throw new InvalidInputException("unknown coverage type \"" + type + "\"");
        }
    }

    public double coverage(String nameOrSignature, String type) {
        try (Connection connection = postgresConnectionService.getConnection()) {
            RoutineDefinition routine = new PostgresRoutineRepository(connection).findRoutine(nameOrSignature);
            return coverage(routine, new PostgresCatalog(connection), type);
        } catch (SQLException e) {
            log.error("Failed to connect for coverage of " + nameOrSignature, e);
            throw new IllegalStateException("Failed to connect to PostgreSQL: " + e.getMessage(), e);
        }
    }

    public void resetProfile(String routineId) {
        if (routineId == null) {
            getProfileStore().resetAll();
        } else {
            getProfileStore().reset(routineId);
        }
    }

    synchronized ProfileStore getProfileStore() {
        if (profileStore == null) {
            int capacity = configService.getConfigValueAsInt(ConfigService.PROFILER_MAX_SHARED_CHUNKS, 15000);
            profileStore = new ProfileStore(capacity);
            log.info("Profile store created with capacity {}", capacity);
        }
        return profileStore;
    }
}
