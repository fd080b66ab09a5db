package me.christianrobert.plpgcheck.catalog;

public enum RelationKind {
    TABLE("r"),
    VIEW("v"),
    MATERIALIZED_VIEW("m"),
    SEQUENCE("S"),
    COMPOSITE_TYPE("c"),
    FOREIGN_TABLE("f"),
    PARTITIONED_TABLE("p");

    private final String relkind;

    RelationKind(String relkind) {
        this.relkind = relkind;
    }

    public String getRelkind() {
        return relkind;
    }

    public boolean isQueryable() {
        return this != SEQUENCE && this != COMPOSITE_TYPE;
    }

    public static RelationKind fromRelkind(String relkind) {
        for (RelationKind kind : values()) {
            if (kind.relkind.equals(relkind)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown relkind: " + relkind);
    }
}
