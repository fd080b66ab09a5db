package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.diagnostic.OutputFormat;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options of one check run. Defaults match {@code plpgsql_check_function}.
 */
public class CheckOptions {

    private boolean fatalErrors = true;
    private boolean otherWarnings = true;
    private boolean performanceWarnings = false;
    private boolean extraWarnings = true;
    private boolean securityWarnings = false;
    private boolean compatibilityWarnings = false;
    private OutputFormat format = OutputFormat.TEXT;
    private String oldTable;
    private String newTable;
    private Map<String, String> polymorphicTypes = defaultPolymorphicTypes();
    private boolean showDependencies;
    private Boolean fishyCastCheck;
    private Boolean injectionCheck;

    public static CheckOptions defaults() {
        return new CheckOptions();
    }

    /**
     * Only errors are reported.
     */
    public CheckOptions withoutWarnings() {
        otherWarnings = false;
        performanceWarnings = false;
        extraWarnings = false;
        securityWarnings = false;
        compatibilityWarnings = false;
        return this;
    }

    public CheckOptions allWarnings() {
        otherWarnings = true;
        performanceWarnings = true;
        extraWarnings = true;
        securityWarnings = true;
        compatibilityWarnings = true;
        return this;
    }

    private static Map<String, String> defaultPolymorphicTypes() {
        Map<String, String> types = new LinkedHashMap<>();
        types.put("anyelement", "integer");
        types.put("anyenum", null);
        types.put("anyrange", "int4range");
        types.put("anycompatible", "integer");
        types.put("anycompatiblerange", "int4range");
        return types;
    }

    /**
     * The comparison of a routine variable with an implicitly casted column is reported
     * when performance warnings are on, unless set explicitly.
     */
    public boolean isFishyCastCheckEnabled() {
        return fishyCastCheck != null ? fishyCastCheck : performanceWarnings;
    }

    /**
     * Dynamic SQL built from unsanitized text is reported when security warnings are
     * on, unless set explicitly.
     */
    public boolean isInjectionCheckEnabled() {
        return injectionCheck != null ? injectionCheck : securityWarnings;
    }

    // Getters and setters
    public boolean isFatalErrors() {
        return fatalErrors;
    }

    public void setFatalErrors(boolean fatalErrors) {
        this.fatalErrors = fatalErrors;
    }

    public boolean isOtherWarnings() {
        return otherWarnings;
    }

    public void setOtherWarnings(boolean otherWarnings) {
        this.otherWarnings = otherWarnings;
    }

    public boolean isPerformanceWarnings() {
        return performanceWarnings;
    }

    public void setPerformanceWarnings(boolean performanceWarnings) {
        this.performanceWarnings = performanceWarnings;
    }

    public boolean isExtraWarnings() {
        return extraWarnings;
    }

    public void setExtraWarnings(boolean extraWarnings) {
        this.extraWarnings = extraWarnings;
    }

    public boolean isSecurityWarnings() {
        return securityWarnings;
    }

    public void setSecurityWarnings(boolean securityWarnings) {
        this.securityWarnings = securityWarnings;
    }

    public boolean isCompatibilityWarnings() {
        return compatibilityWarnings;
    }

    public void setCompatibilityWarnings(boolean compatibilityWarnings) {
        this.compatibilityWarnings = compatibilityWarnings;
    }

    public OutputFormat getFormat() {
        return format;
    }

    public void setFormat(OutputFormat format) {
        this.format = format;
    }

    public String getOldTable() {
        return oldTable;
    }

    public void setOldTable(String oldTable) {
        this.oldTable = oldTable;
    }

    public String getNewTable() {
        return newTable;
    }

    public void setNewTable(String newTable) {
        this.newTable = newTable;
    }

    /**
     * Type names substituted for polymorphic pseudo types, keyed by pseudo type name;
     * a {@code null} value leaves the pseudo type in place.
     */
    public Map<String, String> getPolymorphicTypes() {
        return polymorphicTypes;
    }

    public void setPolymorphicTypes(Map<String, String> polymorphicTypes) {
        this.polymorphicTypes = polymorphicTypes;
    }

    public boolean isShowDependencies() {
        return showDependencies;
    }

    public void setShowDependencies(boolean showDependencies) {
        this.showDependencies = showDependencies;
    }

    public Boolean getFishyCastCheck() {
        return fishyCastCheck;
    }

    public void setFishyCastCheck(Boolean fishyCastCheck) {
        this.fishyCastCheck = fishyCastCheck;
    }

    public Boolean getInjectionCheck() {
        return injectionCheck;
    }

    public void setInjectionCheck(Boolean injectionCheck) {
        this.injectionCheck = injectionCheck;
    }
}
