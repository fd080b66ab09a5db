package me.christianrobert.plpgcheck.routine;

import java.util.List;

/**
 * Source of stored routine definitions.
 */
public interface RoutineRepository {

    /**
     * Finds a routine by oid, by {@code schema.name(argtypes)} signature or by a name
     * that is unique.
     *
     * @throws me.christianrobert.plpgcheck.checker.InvalidInputException when no routine
     *         or more than one routine matches
     */
    RoutineDefinition findRoutine(String nameOrSignature);

    /**
     * All routines of a schema written in the given language, ordered by name.
     */
    List<RoutineDefinition> findRoutines(String schema, String language);
}
