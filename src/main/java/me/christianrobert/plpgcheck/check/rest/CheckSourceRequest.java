package me.christianrobert.plpgcheck.check.rest;

import me.christianrobert.plpgcheck.checker.CheckOptions;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;

/**
 * Body of {@code POST /api/check/source}: a routine that is not (yet) stored in the database.
 */
public class CheckSourceRequest {

    private RoutineDefinition routine;
    private String relation;
    private CheckOptions options;

    public RoutineDefinition getRoutine() {
        return routine;
    }

    public void setRoutine(RoutineDefinition routine) {
        this.routine = routine;
    }

    public String getRelation() {
        return relation;
    }

    public void setRelation(String relation) {
        this.relation = relation;
    }

    public CheckOptions getOptions() {
        return options;
    }

    public void setOptions(CheckOptions options) {
        this.options = options;
    }
}
