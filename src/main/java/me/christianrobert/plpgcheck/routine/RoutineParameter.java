package me.christianrobert.plpgcheck.routine;

/**
 * A routine argument. The name may be {@code null} for unnamed arguments.
 */
public class RoutineParameter {
    private String name;
    private String dataType;
    private ParamMode mode = ParamMode.IN;

    public RoutineParameter() {
    }

    public RoutineParameter(String name, String dataType, ParamMode mode) {
        this.name = name;
        this.dataType = dataType;
        this.mode = mode;
    }

    public static RoutineParameter in(String name, String dataType) {
        return new RoutineParameter(name, dataType, ParamMode.IN);
    }

    public static RoutineParameter out(String name, String dataType) {
        return new RoutineParameter(name, dataType, ParamMode.OUT);
    }

    public static RoutineParameter inout(String name, String dataType) {
        return new RoutineParameter(name, dataType, ParamMode.INOUT);
    }

    // Getters and setters
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDataType() {
        return dataType;
    }

    public void setDataType(String dataType) {
        this.dataType = dataType;
    }

    public ParamMode getMode() {
        return mode;
    }

    public void setMode(ParamMode mode) {
        this.mode = mode;
    }

    @Override
    public String toString() {
        return (mode != ParamMode.IN ? mode + " " : "") + (name != null ? name + " " : "") + dataType;
    }
}
