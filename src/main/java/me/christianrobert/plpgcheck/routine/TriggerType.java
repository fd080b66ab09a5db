package me.christianrobert.plpgcheck.routine;

/**
 * Whether a routine is a trigger function, derived from its declared return type.
 */
public enum TriggerType {
    NONE,
    DML,
    EVENT
}
