package me.christianrobert.plpgcheck.config.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigService defaults and typed accessors.
 */
class ConfigServiceTest {

    @Test
    void testDefaults() {
        ConfigService config = new ConfigService();

        assertEquals("by_function", config.getConfigValueAsString(ConfigService.MODE));
        assertTrue(config.isEnabled(ConfigService.FATAL_ERRORS));
        assertFalse(config.isEnabled(ConfigService.PROFILER));
        assertEquals(15000, config.getConfigValueAsInt(ConfigService.PROFILER_MAX_SHARED_CHUNKS, 0));
        assertEquals(List.of("public"), config.getConfigValueAsStringList(ConfigService.CHECK_SCHEMAS));
    }

    @Test
    void testStringValuesAreParsed() {
        ConfigService config = new ConfigService();
        config.updateConfiguration(Map.of(
                ConfigService.PROFILER, "true",
                ConfigService.PROFILER_MAX_SHARED_CHUNKS, " 200 ",
                ConfigService.CHECK_SCHEMAS, " public, billing ,, audit"));

        assertTrue(config.isEnabled(ConfigService.PROFILER));
        assertEquals(200, config.getConfigValueAsInt(ConfigService.PROFILER_MAX_SHARED_CHUNKS, 0));
        assertEquals(List.of("public", "billing", "audit"),
                config.getConfigValueAsStringList(ConfigService.CHECK_SCHEMAS));
    }

    @Test
    void testBooleanSpellings() {
        ConfigService config = new ConfigService();

        config.setConfigValue(ConfigService.PROFILER, "on");
        assertEquals(Boolean.TRUE, config.getConfigValue(ConfigService.PROFILER));
        config.setConfigValue(ConfigService.PROFILER, "off");
        assertFalse(config.isEnabled(ConfigService.PROFILER));
        config.setConfigValue(ConfigService.PROFILER, "y");
        assertTrue(config.isEnabled(ConfigService.PROFILER));
        config.setConfigValue(ConfigService.PROFILER, "0");
        assertFalse(config.isEnabled(ConfigService.PROFILER));
    }

    @Test
    void testInvalidValuesAreRejected() {
        ConfigService config = new ConfigService();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> config.setConfigValue(ConfigService.PROFILER_MAX_SHARED_CHUNKS, "many"));
        assertTrue(e.getMessage().contains("plpgsql_check.profiler_max_shared_chunks"));
        assertThrows(IllegalArgumentException.class,
                () -> config.setConfigValue(ConfigService.PROFILER_MAX_SHARED_CHUNKS, 0));
        assertThrows(IllegalArgumentException.class,
                () -> config.setConfigValue(ConfigService.FATAL_ERRORS, "maybe"));
        assertThrows(IllegalArgumentException.class,
                () -> config.setConfigValue(ConfigService.MODE, "never"));

        assertEquals(15000, config.getConfigValueAsInt(ConfigService.PROFILER_MAX_SHARED_CHUNKS, 0));
        assertEquals(7, config.getConfigValueAsInt("missing.key", 7));
    }

    @Test
    void testUpdateIsAllOrNothing() {
        ConfigService config = new ConfigService();

        assertThrows(IllegalArgumentException.class, () -> config.updateConfiguration(Map.of(
                ConfigService.PROFILER, true,
                ConfigService.MODE, "sometimes")));

        assertFalse(config.isEnabled(ConfigService.PROFILER));
    }

    @Test
    void testModeIsNormalized() {
        ConfigService config = new ConfigService();
        config.setConfigValue(ConfigService.MODE, " Fresh-Start ");

        assertEquals("fresh_start", config.getConfigValueAsString(ConfigService.MODE));
    }

    @Test
    void testResetToDefaults() {
        ConfigService config = new ConfigService();
        config.setConfigValue(ConfigService.MODE, "disabled");
        config.setConfigValue("custom.key", "x");

        config.resetToDefaults();

        assertEquals("by_function", config.getConfigValueAsString(ConfigService.MODE));
        assertFalse(config.hasConfigKey("custom.key"));
    }
}
