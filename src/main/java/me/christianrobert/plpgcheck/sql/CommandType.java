package me.christianrobert.plpgcheck.sql;

public enum CommandType {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    MERGE,
    CALL,
    UTILITY,
    TRANSACTION;

    public boolean isDataModifying() {
        return this == INSERT || this == UPDATE || this == DELETE || this == MERGE;
    }
}
