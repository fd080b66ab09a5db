package me.christianrobert.plpgcheck.catalog;

/**
 * Weakest context in which a cast between two types is applied, like {@code pg_cast.castcontext}.
 * Constants are ordered from the most permissive.
 */
public enum CastContext {
    IMPLICIT,
    ASSIGNMENT,
    EXPLICIT,
    NONE;

    public boolean allowsImplicit() {
        return this == IMPLICIT;
    }

    public boolean allowsAssignment() {
        return this == IMPLICIT || this == ASSIGNMENT;
    }
}
