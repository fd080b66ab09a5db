package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.ast.CompiledRoutine;
import me.christianrobert.plpgcheck.ast.PlStatement;
import me.christianrobert.plpgcheck.catalog.OverlayCatalog;
import me.christianrobert.plpgcheck.catalog.PgType;
import me.christianrobert.plpgcheck.catalog.RelationInfo;
import me.christianrobert.plpgcheck.catalog.Volatility;
import me.christianrobert.plpgcheck.dependency.DependencyCollector;
import me.christianrobert.plpgcheck.diagnostic.Diagnostic;
import me.christianrobert.plpgcheck.diagnostic.Severity;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;
import me.christianrobert.plpgcheck.routine.TriggerType;
import me.christianrobert.plpgcheck.sql.CatalogSqlAnalyzer;
import me.christianrobert.plpgcheck.sql.SqlAnalysisException;
import me.christianrobert.plpgcheck.sql.SqlAnalyzer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable context of one check run. Created by {@link CheckStateManager#beginCheck},
 * never shared between runs.
 */
public class CheckState {

    private final RoutineDefinition routine;
    private final CheckOptions options;
    private final OverlayCatalog catalog;
    private final SqlAnalyzer analyzer;
    private final RelationInfo triggerRelation;
    private final Map<String, PgType> polymorphicTypes;

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Set<String> diagnosticKeys = new HashSet<>();
    private final List<String> notices = new ArrayList<>();
    private final BitSet readVarnos = new BitSet();
    private final BitSet writtenVarnos = new BitSet();
    private final Set<Integer> sanitizedVarnos = new HashSet<>();
    private final DependencyCollector dependencies = new DependencyCollector();
    private final Deque<WarningFlags> pragmaScopes = new ArrayDeque<>();

    private CompiledRoutine compiled;
    private RecordPropagator records;
    private PlStatement currentStatement;
    private Volatility observedVolatility = Volatility.IMMUTABLE;
    private boolean usesDynamicSql;
    private boolean resultFromDynamicSql;
    private int handlerDepth;
    private boolean stopped;
    private boolean released;

    CheckState(RoutineDefinition routine, CheckOptions options, OverlayCatalog catalog,
               RelationInfo triggerRelation, Map<String, PgType> polymorphicTypes) {
        this.routine = routine;
        this.options = options;
        this.catalog = catalog;
        this.analyzer = new CatalogSqlAnalyzer(catalog);
        this.triggerRelation = triggerRelation;
        this.polymorphicTypes = polymorphicTypes;
        this.pragmaScopes.push(WarningFlags.from(options));
    }

    // ------------------------------------------------------------------ diagnostics

    /**
     * Appends a diagnostic attributed to the current statement, unless its category is
     * switched off, it was already reported or the run has stopped.
     */
    public void report(Diagnostic.Builder builder) {
        if (stopped) {
            return;
        }
        if (currentStatement != null) {
            builder.statement(currentStatement.getLineno(), currentStatement.getTypeName());
        }
        Diagnostic diagnostic = builder.build();
        if (!getFlags().allows(diagnostic.getSeverity())) {
            return;
        }
        if (!diagnosticKeys.add(diagnostic.dedupKey())) {
            return;
        }
        diagnostics.add(diagnostic);
        if (diagnostic.isError() && options.isFatalErrors()) {
            stopped = true;
        }
    }

    public void report(Severity severity, String sqlState, String message) {
        report(Diagnostic.builder(severity, message).sqlState(sqlState));
    }

    /**
     * Reports an error of the SQL analyzer for {@code query}.
     */
    public void report(SqlAnalysisException e, String query) {
        report(Diagnostic.builder(Severity.ERROR, e.getMessage())
                .sqlState(e.getSqlState())
                .detail(e.getDetail())
                .hint(e.getHint())
                .query(query, e.getPosition()));
    }

    public void addNotice(String notice) {
        if (!stopped) {
            notices.add(notice);
        }
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<String> getNotices() {
        return notices;
    }

    public boolean isStopped() {
        return stopped;
    }

    // ------------------------------------------------------------------ pragma scopes

    public WarningFlags getFlags() {
        return pragmaScopes.peek();
    }

    /**
     * Sets a feature in every open scope down to the routine scope, so the switch lasts
     * after the current block closes.
     *
     * @return {@code false} when the name is unknown
     */
    public boolean setRoutineFeature(String feature, boolean enabled) {
        for (WarningFlags flags : pragmaScopes) {
            if (!flags.set(feature, enabled)) {
                return false;
            }
        }
        return true;
    }

    void pushScope() {
        pragmaScopes.push(getFlags().copy());
    }

    void popScope() {
        if (pragmaScopes.size() > 1) {
            pragmaScopes.pop();
        }
    }

    // ------------------------------------------------------------------ variable usage

    public void markRead(int varno) {
        if (varno >= 0) {
            readVarnos.set(varno);
        }
    }

    public void markWritten(int varno) {
        if (varno >= 0) {
            writtenVarnos.set(varno);
        }
    }

    public boolean isRead(int varno) {
        return readVarnos.get(varno);
    }

    public boolean isWritten(int varno) {
        return writtenVarnos.get(varno);
    }

    public void setSanitized(int varno, boolean sanitized) {
        if (sanitized) {
            sanitizedVarnos.add(varno);
        } else {
            sanitizedVarnos.remove(varno);
        }
    }

    public boolean isSanitized(int varno) {
        return sanitizedVarnos.contains(varno);
    }

    // ------------------------------------------------------------------ routine level facts

    public void foldVolatility(Volatility volatility) {
        observedVolatility = observedVolatility.weaker(volatility);
    }

    public Volatility getObservedVolatility() {
        return observedVolatility;
    }

    public boolean isUsesDynamicSql() {
        return usesDynamicSql;
    }

    public void setUsesDynamicSql(boolean usesDynamicSql) {
        this.usesDynamicSql = usesDynamicSql;
    }

    /**
     * True when OUT values or the result may be filled by dynamic SQL.
     */
    public boolean isResultFromDynamicSql() {
        return resultFromDynamicSql;
    }

    public void setResultFromDynamicSql(boolean resultFromDynamicSql) {
        this.resultFromDynamicSql = resultFromDynamicSql;
    }

    void enterHandler() {
        handlerDepth++;
    }

    void leaveHandler() {
        handlerDepth--;
    }

    public boolean isInHandler() {
        return handlerDepth > 0;
    }

    // ------------------------------------------------------------------ lifecycle

    void attach(CompiledRoutine compiled) {
        this.compiled = compiled;
        this.records = new RecordPropagator(compiled);
    }

    /**
     * Drops the scratch state of the run; diagnostics stay readable.
     */
    void release() {
        released = true;
        readVarnos.clear();
        writtenVarnos.clear();
        sanitizedVarnos.clear();
        while (pragmaScopes.size() > 1) {
            pragmaScopes.pop();
        }
        records = null;
        currentStatement = null;
    }

    public boolean isReleased() {
        return released;
    }

    // Getters and setters
    public RoutineDefinition getRoutine() {
        return routine;
    }

    public CheckOptions getOptions() {
        return options;
    }

    public OverlayCatalog getCatalog() {
        return catalog;
    }

    public SqlAnalyzer getAnalyzer() {
        return analyzer;
    }

    public RelationInfo getTriggerRelation() {
        return triggerRelation;
    }

    public TriggerType getTriggerType() {
        return routine.getTriggerType();
    }

    public Map<String, PgType> getPolymorphicTypes() {
        return polymorphicTypes;
    }

    public CompiledRoutine getCompiled() {
        return compiled;
    }

    public RecordPropagator getRecords() {
        return records;
    }

    public DependencyCollector getDependencies() {
        return dependencies;
    }

    public PlStatement getCurrentStatement() {
        return currentStatement;
    }

    public void setCurrentStatement(PlStatement currentStatement) {
        this.currentStatement = currentStatement;
    }
}
