package me.christianrobert.plpgcheck.routine;

/**
 * Argument mode as stored in {@code pg_proc.proargmodes}.
 */
public enum ParamMode {
    IN("i"),
    OUT("o"),
    INOUT("b"),
    VARIADIC("v"),
    TABLE("t");

    private final String code;

    ParamMode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isInput() {
        return this == IN || this == INOUT || this == VARIADIC;
    }

    public boolean isOutput() {
        return this == OUT || this == INOUT || this == TABLE;
    }

    public static ParamMode fromCode(String code) {
        if (code == null) {
            return IN;
        }
        for (ParamMode mode : values()) {
            if (mode.code.equals(code)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown argument mode: " + code);
    }
}
