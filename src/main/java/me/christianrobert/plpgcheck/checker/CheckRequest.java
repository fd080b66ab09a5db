package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.catalog.Catalog;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;

/**
 * What to check: a routine, the relation a trigger routine is bound to, the catalog to
 * resolve names against and the run options.
 */
public class CheckRequest {

    private final RoutineDefinition routine;
    private final Catalog catalog;
    private String triggerRelation;
    private CheckOptions options = CheckOptions.defaults();

    public CheckRequest(RoutineDefinition routine, Catalog catalog) {
        this.routine = routine;
        this.catalog = catalog;
    }

    public CheckRequest relation(String triggerRelation) {
        this.triggerRelation = triggerRelation;
        return this;
    }

    public CheckRequest options(CheckOptions options) {
        this.options = options;
        return this;
    }

    public RoutineDefinition getRoutine() {
        return routine;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public String getTriggerRelation() {
        return triggerRelation;
    }

    public CheckOptions getOptions() {
        return options;
    }
}
