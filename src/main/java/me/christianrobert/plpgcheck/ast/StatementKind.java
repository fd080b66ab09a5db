package me.christianrobert.plpgcheck.ast;

/**
 * Tag of every statement node, with the name PL/pgSQL uses for it in error contexts.
 */
public enum StatementKind {
    BLOCK("statement block"),
    ASSIGN("assignment"),
    IF("IF"),
    CASE("CASE"),
    LOOP("LOOP"),
    WHILE("WHILE"),
    FORI("FOR with integer loop variable"),
    FORS("FOR over SELECT rows"),
    FORC("FOR over cursor"),
    DYNFORS("FOR over EXECUTE statement"),
    FOREACH_A("FOREACH over array"),
    EXIT("EXIT"),
    RETURN("RETURN"),
    RETURN_NEXT("RETURN NEXT"),
    RETURN_QUERY("RETURN QUERY"),
    RAISE("RAISE"),
    ASSERT("ASSERT"),
    EXECSQL("SQL statement"),
    DYNEXECUTE("EXECUTE"),
    PERFORM("PERFORM"),
    CALL("CALL"),
    GETDIAG("GET DIAGNOSTICS"),
    OPEN("OPEN"),
    FETCH("FETCH"),
    CLOSE("CLOSE"),
    COMMIT("COMMIT"),
    ROLLBACK("ROLLBACK"),
    NULL("NULL");

    private final String displayName;

    StatementKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isLoop() {
        switch (this) {
            case LOOP:
            case WHILE:
            case FORI:
            case FORS:
            case FORC:
            case DYNFORS:
            case FOREACH_A:
                return true;
            default:
                return false;
        }
    }
}
