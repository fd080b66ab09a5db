package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.catalog.OverlayCatalog;
import me.christianrobert.plpgcheck.catalog.PgType;
import me.christianrobert.plpgcheck.catalog.QualifiedName;
import me.christianrobert.plpgcheck.catalog.RelationInfo;
import me.christianrobert.plpgcheck.coverage.StatementInventory;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;
import me.christianrobert.plpgcheck.routine.TriggerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Opens and closes check runs. Everything a run allocates hangs off its {@link CheckState}.
 */
public class CheckStateManager {

    private static final Logger log = LoggerFactory.getLogger(CheckStateManager.class);

    static final String PLPGSQL = "plpgsql";

    /**
     * Validates the request and creates the state of a new run.
     *
     * @throws InvalidInputException when the routine cannot be checked as requested
     */
    public CheckState beginCheck(CheckRequest request) {
        RoutineDefinition routine = request.getRoutine();
        CheckOptions options = request.getOptions();
        String language = routine.getLanguage();
        if (language == null || !PLPGSQL.equals(language.toLowerCase(Locale.ROOT))) {
            throw new InvalidInputException("0A000",
                    "only plpgsql functions can be checked, not " + (language != null ? language : "unknown") + " ones");
        }

        OverlayCatalog catalog = new OverlayCatalog(request.getCatalog());
        RelationInfo relation = resolveTriggerRelation(routine, request.getTriggerRelation(), catalog);
        if (relation != null) {
            addTransitionTable(catalog, options.getOldTable(), relation);
            addTransitionTable(catalog, options.getNewTable(), relation);
        } else if (options.getOldTable() != null || options.getNewTable() != null) {
            throw new InvalidInputException("missing description of trigger relation for transition tables");
        }

        Map<String, PgType> polymorphic = resolvePolymorphicTypes(options.getPolymorphicTypes(), catalog);
        log.debug("Starting check of {}", routine.getSignature());
        return new CheckState(routine, options, catalog, relation, polymorphic);
    }

    private static RelationInfo resolveTriggerRelation(RoutineDefinition routine, String relationName,
                                                       OverlayCatalog catalog) {
        TriggerType triggerType = routine.getTriggerType();
        if (triggerType == TriggerType.DML) {
            if (relationName == null || relationName.isBlank()) {
                throw new InvalidInputException("missing trigger relation");
            }
            RelationInfo relation = catalog.findRelation(QualifiedName.parse(relationName));
            if (relation == null) {
                throw new InvalidInputException("42P01", "relation \"" + relationName + "\" does not exist");
            }
            return relation;
        }
        if (relationName != null && !relationName.isBlank()) {
            throw new InvalidInputException("function is not trigger");
        }
        return null;
    }

    private static void addTransitionTable(OverlayCatalog catalog, String name, RelationInfo relation) {
        if (name != null && !name.isBlank()) {
            catalog.addTemporaryTable(QualifiedName.normalizeIdentifier(name), relation.getColumns());
        }
    }

    private static Map<String, PgType> resolvePolymorphicTypes(Map<String, String> substitutions,
                                                               OverlayCatalog catalog) {
        Map<String, PgType> resolved = new HashMap<>();
        if (substitutions == null) {
            return resolved;
        }
        for (Map.Entry<String, String> entry : substitutions.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            PgType type = catalog.findType(entry.getValue());
            if (type == null) {
                throw new InvalidInputException("42704", "type \"" + entry.getValue() + "\" does not exist");
            }
            if (type.isPolymorphic()) {
                throw new InvalidInputException("42804",
                        "type \"" + entry.getValue() + "\" used for " + entry.getKey() + " is polymorphic");
            }
            resolved.put(entry.getKey(), type);
        }
        return resolved;
    }

    /**
     * Collects the outcome of a run. The state stays readable afterwards.
     */
    public CheckResult endCheck(CheckState state) {
        StatementInventory inventory = state.getCompiled() != null ? StatementInventory.of(state.getCompiled()) : null;
        CheckResult result = new CheckResult(state.getRoutine().getId(), state.getDiagnostics(), state.getNotices(),
                state.getOptions().isShowDependencies() ? state.getDependencies().getRecords() : List.of(),
                state.getObservedVolatility(), inventory, false);
        log.debug("Finished check of {}: {} diagnostics", state.getRoutine().getSignature(),
                result.getDiagnostics().size());
        return result;
    }
}
