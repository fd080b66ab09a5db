package me.christianrobert.plpgcheck.dependency;

public enum DependencyType {
    RELATION,
    FUNCTION,
    PROCEDURE,
    OPERATOR
}
