package me.christianrobert.plpgcheck.routine;

public enum RoutineKind {
    FUNCTION,
    PROCEDURE
}
