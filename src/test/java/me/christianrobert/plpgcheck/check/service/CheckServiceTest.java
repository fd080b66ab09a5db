package me.christianrobert.plpgcheck.check.service;

import me.christianrobert.plpgcheck.cache.CheckCache;
import me.christianrobert.plpgcheck.catalog.BuiltinTypes;
import me.christianrobert.plpgcheck.catalog.FunctionInfo;
import me.christianrobert.plpgcheck.catalog.InMemoryCatalog;
import me.christianrobert.plpgcheck.catalog.Volatility;
import me.christianrobert.plpgcheck.checker.CheckOptions;
import me.christianrobert.plpgcheck.checker.CheckResult;
import me.christianrobert.plpgcheck.checker.InvalidInputException;
import me.christianrobert.plpgcheck.checker.RoutineCheckException;
import me.christianrobert.plpgcheck.config.service.ConfigService;
import me.christianrobert.plpgcheck.dependency.DependencyRecord;
import me.christianrobert.plpgcheck.dependency.DependencyReport;
import me.christianrobert.plpgcheck.dependency.DependencyType;
import me.christianrobert.plpgcheck.diagnostic.OutputFormat;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CheckService against an in-memory catalog: active and passive checks,
 * dependency reports and profiler coverage.
 */
class CheckServiceTest {

    private ConfigService configService;
    private CheckCache checkCache;
    private CheckService checkService;

    private final InMemoryCatalog catalog = new InMemoryCatalog()
            .addTable("public.t1", "a integer", "b text")
            .addFunction(FunctionInfo.builder("public", "total")
                    .args(BuiltinTypes.INT8)
                    .returns(BuiltinTypes.NUMERIC)
                    .volatility(Volatility.STABLE));

    @BeforeEach
    void setUp() throws Exception {
        configService = new ConfigService();
        checkCache = new CheckCache();

        checkService = new CheckService();
        injectDependency(checkService, "configService", configService);
        injectDependency(checkService, "checkCache", checkCache);
    }

    private void injectDependency(Object target, String fieldName, Object dependency) throws Exception {
        Field field = null;
        Class<?> clazz = target.getClass();

        while (clazz != null && field == null) {
            try {
                field = clazz.getDeclaredField(fieldName);
            } catch (NoSuchFieldException e) {
                clazz = clazz.getSuperclass();
            }
        }

        if (field != null) {
            field.setAccessible(true);
            field.set(target, dependency);
        } else {
            throw new NoSuchFieldException("Field " + fieldName + " not found in class hierarchy");
        }
    }

    private static RoutineDefinition routine(String returnType, String source) {
        RoutineDefinition definition = new RoutineDefinition("public", "f1", source);
        definition.setReturnType(returnType);
        return definition;
    }

    private static RoutineDefinition brokenRoutine() {
        return routine("void", """
                begin
                  exit;
                end;
                """);
    }

    // ========== Configuration ==========

    @Test
    void testGetMode_DefaultIsByFunction() {
        assertEquals(CheckMode.BY_FUNCTION, checkService.getMode());
    }

    @Test
    void testSetMode_UnknownValueRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> configService.setConfigValue(ConfigService.MODE, "sometimes"));
        assertEquals(CheckMode.BY_FUNCTION, checkService.getMode());
    }

    @Test
    void testCheckModeFromConfig() {
        assertEquals(CheckMode.FRESH_START, CheckMode.fromConfig("fresh_start"));
        assertEquals(CheckMode.EVERY_START, CheckMode.fromConfig(" every-start "));
        assertNull(CheckMode.fromConfig("never"));
    }

    @Test
    void testPassiveOptions_FollowConfiguration() {
        configService.setConfigValue(ConfigService.SHOW_PERFORMANCE_WARNINGS, true);
        configService.setConfigValue(ConfigService.FATAL_ERRORS, "false");

        CheckOptions options = checkService.passiveOptions();

        assertTrue(options.isPerformanceWarnings());
        assertFalse(options.isFatalErrors(), "string values are parsed as booleans");
        assertFalse(options.isOtherWarnings(), "non performance warnings are off by default");
    }

    // ========== Active checks ==========

    @Test
    void testCheckSource_ReportsDiagnostics() {
        CheckResult result = checkService.checkSource(brokenRoutine(), catalog, null, null);

        assertTrue(result.hasErrors());
        String text = checkService.render(result, OutputFormat.TEXT);
        assertTrue(text.startsWith("error:42601:2:EXIT:"), "rendered: " + text);
    }

    @Test
    void testCheckSource_DisabledMode() {
        configService.setConfigValue(ConfigService.MODE, "disabled");

        CheckResult result = checkService.checkSource(brokenRoutine(), catalog, null, null);

        assertTrue(result.isNotChecked());
        assertTrue(result.getDiagnostics().isEmpty());
        assertEquals(List.of("plpgsql_check is disabled"), result.getNotices());
    }

    // ========== Dependencies ==========

    @Test
    void testShowDependencies_ListsRelationsAndFunctions() {
        RoutineDefinition definition = routine("numeric", """
                declare
                  x numeric;
                begin
                  select total(a) into x from t1;
                  return x;
                end;
                """);

        DependencyReport report = checkService.showDependencies(definition, catalog, null, null);
        List<DependencyRecord> rows = report.getRows();

        assertEquals(2, rows.size(), "rows: " + rows);
        assertEquals(DependencyType.RELATION, rows.get(0).getType());
        assertEquals("t1", rows.get(0).getName());
        assertEquals(DependencyType.FUNCTION, rows.get(1).getType());
        assertEquals("total", rows.get(1).getName());
        assertEquals("(bigint)", rows.get(1).getParams());
        assertTrue(report.render().startsWith("type|oid|schema|name|params"));
    }

    // ========== Passive mode ==========

    @Test
    void testOnCall_ByFunctionDoesNothing() {
        assertNull(checkService.onCall(brokenRoutine(), catalog, null));
        assertEquals(0, checkCache.size());
    }

    @Test
    void testOnCall_FreshStartChecksOnce() {
        configService.setConfigValue(ConfigService.MODE, "fresh_start");
        RoutineDefinition definition = brokenRoutine();

        RoutineCheckException e = assertThrows(RoutineCheckException.class,
                () -> checkService.onCall(definition, catalog, null));
        assertEquals("EXIT cannot be used outside a loop, unless it has a label", e.getDiagnostic().getMessage());

        assertNull(checkService.onCall(definition, catalog, null), "the same definition is not checked again");
    }

    @Test
    void testOnCall_ChangedDefinitionIsCheckedAgain() {
        configService.setConfigValue(ConfigService.MODE, "fresh_start");
        RoutineDefinition clean = routine("void", """
                begin
                  null;
                end;
                """);
        assertNotNull(checkService.onCall(clean, catalog, null));

        clean.setSource("""
                begin
                  exit;
                end;
                """);
        assertThrows(RoutineCheckException.class, () -> checkService.onCall(clean, catalog, null));
    }

    @Test
    void testOnCall_EveryStartChecksAlways() {
        configService.setConfigValue(ConfigService.MODE, "every_start");
        RoutineDefinition definition = brokenRoutine();

        assertThrows(RoutineCheckException.class, () -> checkService.onCall(definition, catalog, null));
        assertThrows(RoutineCheckException.class, () -> checkService.onCall(definition, catalog, null));
    }

    @Test
    void testOnCall_NonFatalErrorsAreReturned() {
        configService.setConfigValue(ConfigService.MODE, "every_start");
        configService.setConfigValue(ConfigService.FATAL_ERRORS, false);

        CheckResult result = checkService.onCall(brokenRoutine(), catalog, null);

        assertNotNull(result);
        assertTrue(result.hasErrors());
    }

    // ========== Profiler ==========

    @Test
    void testRecordExecution_NeedsProfiler() {
        assertFalse(checkService.recordExecution(brokenRoutine(), 3, 1, 10));
    }

    @Test
    void testCoverage_FromRecordedExecutions() {
        configService.setConfigValue(ConfigService.PROFILER, true);
        RoutineDefinition definition = routine("void", """
                begin
                  perform 1;
                end;
                """);

        assertEquals(0.0, checkService.coverage(definition, catalog, "statement"), 0.0001);

        assertTrue(checkService.recordExecution(definition, 3, 1, 10));
        assertEquals(0.5, checkService.coverage(definition, catalog, "statement"), 0.0001,
                "block executed, PERFORM not");
        assertEquals(1.0, checkService.coverage(definition, catalog, "branches"), 0.0001,
                "no branches at all");

        checkService.resetProfile(definition.getId());
        assertEquals(0.0, checkService.coverage(definition, catalog, "statement"), 0.0001);
    }

    @Test
    void testCoverage_UnknownType() {
        RoutineDefinition definition = routine("void", """
                begin
                  perform 1;
                end;
                """);
        assertThrows(InvalidInputException.class, () -> checkService.coverage(definition, catalog, "paths"));
    }
}
