package me.christianrobert.plpgcheck.routine;

import me.christianrobert.plpgcheck.catalog.Volatility;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.zip.CRC32;

/**
 * Everything the checker needs to know about a stored routine: its body, signature,
 * declared volatility and per-routine settings. Loaded from {@code pg_proc} or posted
 * directly by a client.
 */
public class RoutineDefinition {
    private String id;
    private String schema = "public";
    private String name;
    private String language = "plpgsql";
    private RoutineKind kind = RoutineKind.FUNCTION;
    private List<RoutineParameter> parameters = new ArrayList<>();
    private String returnType = "void";
    private boolean returnsSet;
    private Volatility volatility = Volatility.VOLATILE;
    private Map<String, String> settings = new LinkedHashMap<>();
    private String source;

    public RoutineDefinition() {
    }

    public RoutineDefinition(String schema, String name, String source) {
        this.schema = schema;
        this.name = name;
        this.source = source;
    }

    // Getters and setters
    /**
     * Identity used in reports and caches; the oid for catalog routines, otherwise the qualified name.
     */
    public String getId() {
        return id != null ? id : getQualifiedName();
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSchema() {
        return schema;
    }

    public void setSchema(String schema) {
        this.schema = schema;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public RoutineKind getKind() {
        return kind;
    }

    public void setKind(RoutineKind kind) {
        this.kind = kind;
    }

    public List<RoutineParameter> getParameters() {
        return parameters;
    }

    public void setParameters(List<RoutineParameter> parameters) {
        this.parameters = parameters;
    }

    public void addParameter(RoutineParameter parameter) {
        parameters.add(parameter);
    }

    public String getReturnType() {
        return returnType;
    }

    public void setReturnType(String returnType) {
        this.returnType = returnType;
    }

    public boolean isReturnsSet() {
        return returnsSet;
    }

    public void setReturnsSet(boolean returnsSet) {
        this.returnsSet = returnsSet;
    }

    public Volatility getVolatility() {
        return volatility;
    }

    public void setVolatility(Volatility volatility) {
        this.volatility = volatility;
    }

    public Map<String, String> getSettings() {
        return settings;
    }

    public void setSettings(Map<String, String> settings) {
        this.settings = settings;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public boolean isProcedure() {
        return kind == RoutineKind.PROCEDURE;
    }

    public TriggerType getTriggerType() {
        if (returnType == null || returnsSet) {
            return TriggerType.NONE;
        }
        switch (returnType.trim().toLowerCase(Locale.ROOT)) {
            case "trigger":
            case "pg_catalog.trigger":
                return TriggerType.DML;
            case "event_trigger":
            case "pg_catalog.event_trigger":
                return TriggerType.EVENT;
            default:
                return TriggerType.NONE;
        }
    }

    public String getQualifiedName() {
        return schema != null ? schema + "." + name : name;
    }

    /**
     * Renders {@code schema.name(type, ...)} over the input arguments.
     */
    public String getSignature() {
        return getQualifiedName() + parameters.stream()
                .filter(p -> p.getMode().isInput())
                .map(RoutineParameter::getDataType)
                .collect(Collectors.joining(",", "(", ")"));
    }

    /**
     * A checksum over signature, return type and body. A changed routine gets a new fingerprint.
     */
    public long getFingerprint() {
        CRC32 crc = new CRC32();
        crc.update(getSignature().getBytes(StandardCharsets.UTF_8));
        crc.update(String.valueOf(returnType).getBytes(StandardCharsets.UTF_8));
        crc.update(String.valueOf(source).getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }

    @Override
    public String toString() {
        return "RoutineDefinition{" + getSignature() + ", kind=" + kind + ", returns="
                + (returnsSet ? "SETOF " : "") + returnType + '}';
    }
}
