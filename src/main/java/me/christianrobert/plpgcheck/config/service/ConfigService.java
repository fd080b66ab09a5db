package me.christianrobert.plpgcheck.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.plpgcheck.check.service.CheckMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory settings of the checker. The {@code plpgsql_check.*} keys mirror the server
 * side settings of the extension and are validated the way PostgreSQL validates them;
 * other keys are stored as given.
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String MODE = "plpgsql_check.mode";
    public static final String FATAL_ERRORS = "plpgsql_check.fatal_errors";
    public static final String SHOW_NONPERFORMANCE_WARNINGS = "plpgsql_check.show_nonperformance_warnings";
    public static final String SHOW_PERFORMANCE_WARNINGS = "plpgsql_check.show_performance_warnings";
    public static final String COMPATIBILITY_WARNINGS = "plpgsql_check.compatibility_warnings";
    public static final String PROFILER = "plpgsql_check.profiler";
    public static final String PROFILER_MAX_SHARED_CHUNKS = "plpgsql_check.profiler_max_shared_chunks";
    public static final String CHECK_SCHEMAS = "check.schemas";
    public static final String POSTGRES_URL = "postgres.url";
    public static final String POSTGRES_USERNAME = "postgres.username";
    public static final String POSTGRES_PASSWORD = "postgres.password";

    private enum Kind { BOOL, INT, MODE, TEXT }

    private static final Map<String, Kind> KNOWN_SETTINGS = new LinkedHashMap<>();

    static {
        KNOWN_SETTINGS.put(MODE, Kind.MODE);
        KNOWN_SETTINGS.put(FATAL_ERRORS, Kind.BOOL);
        KNOWN_SETTINGS.put(SHOW_NONPERFORMANCE_WARNINGS, Kind.BOOL);
        KNOWN_SETTINGS.put(SHOW_PERFORMANCE_WARNINGS, Kind.BOOL);
        KNOWN_SETTINGS.put(COMPATIBILITY_WARNINGS, Kind.BOOL);
        KNOWN_SETTINGS.put(PROFILER, Kind.BOOL);
        KNOWN_SETTINGS.put(PROFILER_MAX_SHARED_CHUNKS, Kind.INT);
        KNOWN_SETTINGS.put(CHECK_SCHEMAS, Kind.TEXT);
    }

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(MODE, CheckMode.BY_FUNCTION.getConfigName());
        configuration.put(FATAL_ERRORS, true);
        configuration.put(SHOW_NONPERFORMANCE_WARNINGS, false);
        configuration.put(SHOW_PERFORMANCE_WARNINGS, false);
        configuration.put(COMPATIBILITY_WARNINGS, false);
        configuration.put(PROFILER, false);
        configuration.put(PROFILER_MAX_SHARED_CHUNKS, 15000);
        configuration.put(CHECK_SCHEMAS, "public");
        configuration.put(POSTGRES_URL, "jdbc:postgresql://localhost:5432/postgres");
        configuration.put(POSTGRES_USERNAME, "postgres");
        configuration.put(POSTGRES_PASSWORD, "xxx");

        log.info("Configuration initialized with {} default settings", configuration.size());
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null ? parseBoolean(value.toString()) : null;
    }

    public boolean isEnabled(String key) {
        return Boolean.TRUE.equals(getConfigValueAsBoolean(key));
    }

    /**
     * Gets a configuration value as an integer, or {@code defaultValue} when it is not set
     * or not a number.
     */
    public int getConfigValueAsInt(String key, int defaultValue) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        Integer parsed = value != null ? parseInt(value.toString()) : null;
        return parsed != null ? parsed : defaultValue;
    }

    /**
     * Gets a comma separated value as a list, e.g. {@code "public,billing"} for {@code check.schemas}.
     * Blank entries are dropped.
     */
    public List<String> getConfigValueAsStringList(String key) {
        String value = getConfigValueAsString(key);
        if (value == null || value.trim().isEmpty()) {
            return new ArrayList<>();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * Applies several settings at once. Nothing is changed when one of them is invalid.
     *
     * @throws IllegalArgumentException when a {@code plpgsql_check.*} value cannot be parsed
     */
    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());
        Map<String, Object> normalized = new HashMap<>();
        newConfig.forEach((key, value) -> normalized.put(key, normalize(key, value)));
        normalized.forEach(this::store);
    }

    /**
     * @throws IllegalArgumentException when a {@code plpgsql_check.*} value cannot be parsed
     */
    public void setConfigValue(String key, Object value) {
        store(key, normalize(key, value));
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }

    private void store(String key, Object value) {
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    private static Object normalize(String key, Object value) {
        Kind kind = KNOWN_SETTINGS.get(key);
        if (kind == null) {
            if (value == null) {
                throw new IllegalArgumentException("parameter \"" + key + "\" requires a value");
            }
            return value;
        }
        String text = value != null ? value.toString().trim() : null;
        switch (kind) {
            case BOOL:
                if (value instanceof Boolean) {
                    return value;
                }
                Boolean bool = text != null ? parseBoolean(text) : null;
                if (bool == null) {
                    throw invalidValue(key, value, "requires a Boolean value");
                }
                return bool;
            case INT:
                Integer number = value instanceof Number ? Integer.valueOf(((Number) value).intValue())
                        : text != null ? parseInt(text) : null;
                if (number == null || number < 1) {
                    throw invalidValue(key, value, "requires a positive integer value");
                }
                return number;
            case MODE:
                CheckMode mode = CheckMode.fromConfig(text);
                if (mode == null) {
                    throw invalidValue(key, value, "Available values: disabled, by_function, fresh_start, every_start");
                }
                return mode.getConfigName();
            default:
                return text != null ? text : "";
        }
    }

    private static IllegalArgumentException invalidValue(String key, Object value, String hint) {
        return new IllegalArgumentException(
                "invalid value for parameter \"" + key + "\": \"" + value + "\". " + hint);
    }

    /**
     * Boolean spellings accepted by PostgreSQL settings, unique prefixes included.
     */
    static Boolean parseBoolean(String text) {
        String value = text.trim().toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            return null;
        }
        if ("on".equals(value) || "1".equals(value) || "true".startsWith(value) || "yes".startsWith(value)) {
            return Boolean.TRUE;
        }
        if ("off".equals(value) || "0".equals(value)
                || "false".startsWith(value) || "no".startsWith(value)) {
            return Boolean.FALSE;
        }
        return null;
    }

    private static Integer parseInt(String text) {
        try {
            return Integer.valueOf(text.trim());
        } catch (NumberFormatException e) {
            log.warn("'{}' is not an integer", text);
            return null;
        }
    }
}
