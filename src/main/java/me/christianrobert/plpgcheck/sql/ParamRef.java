package me.christianrobert.plpgcheck.sql;

import me.christianrobert.plpgcheck.catalog.PgType;

/**
 * A routine variable or positional parameter referenced from a query.
 */
public class ParamRef {

    private final int paramId;
    private final String name;
    private final PgType type;
    private final boolean positional;

    public ParamRef(int paramId, String name, PgType type, boolean positional) {
        this.paramId = paramId;
        this.name = name;
        this.type = type;
        this.positional = positional;
    }

    /**
     * The datum number for variables, the 1-based parameter number for {@code $n}.
     */
    public int getParamId() {
        return paramId;
    }

    public String getName() {
        return name;
    }

    /**
     * Type of the value; {@code unknown} when it cannot be determined before run time.
     */
    public PgType getType() {
        return type;
    }

    public boolean isPositional() {
        return positional;
    }

    @Override
    public String toString() {
        return name + " " + type;
    }
}
