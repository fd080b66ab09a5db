package me.christianrobert.plpgcheck.ast;

import me.christianrobert.plpgcheck.routine.ParamMode;

/**
 * A variable slot of a compiled routine, addressed by its varno for the routine's lifetime.
 */
public abstract class Datum {

    public enum Kind {
        VAR,
        ROW,
        RECORD,
        RECFIELD
    }

    private final int varno;
    private final String refname;
    private final int lineno;
    private ParamMode paramMode;
    private boolean internal;
    private boolean autoVariable;
    private PlExpression defaultValue;

    protected Datum(int varno, String refname, int lineno) {
        this.varno = varno;
        this.refname = refname;
        this.lineno = lineno;
    }

    public abstract Kind getKind();

    public int getVarno() {
        return varno;
    }

    public String getRefname() {
        return refname;
    }

    public int getLineno() {
        return lineno;
    }

    /**
     * @return the argument mode, or {@code null} for local variables
     */
    public ParamMode getParamMode() {
        return paramMode;
    }

    public void setParamMode(ParamMode paramMode) {
        this.paramMode = paramMode;
    }

    public boolean isParameter() {
        return paramMode != null;
    }

    /**
     * Internal datums (implicit row targets, exception variables) are never reported as unused.
     */
    public boolean isInternal() {
        return internal;
    }

    public void setInternal(boolean internal) {
        this.internal = internal;
    }

    /**
     * Automatic variables such as {@code FOUND}, the trigger variables and integer loop counters.
     */
    public boolean isAutoVariable() {
        return autoVariable;
    }

    public void setAutoVariable(boolean autoVariable) {
        this.autoVariable = autoVariable;
    }

    /**
     * The DEFAULT or {@code :=} initializer of a declaration, or {@code null}.
     */
    public PlExpression getDefaultValue() {
        return defaultValue;
    }

    public void setDefaultValue(PlExpression defaultValue) {
        this.defaultValue = defaultValue;
    }

    @Override
    public String toString() {
        return getKind() + " " + refname + " (" + varno + ")";
    }
}
