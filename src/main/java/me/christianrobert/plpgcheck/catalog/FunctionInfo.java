package me.christianrobert.plpgcheck.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A function or procedure signature as stored in {@code pg_proc}.
 */
public class FunctionInfo {

    public enum Kind {
        FUNCTION,
        PROCEDURE,
        AGGREGATE,
        WINDOW
    }

    private final long oid;
    private final String schema;
    private final String name;
    private final List<PgType> argTypes;
    private final List<String> argModes;
    private final PgType returnType;
    private final boolean returnsSet;
    private final Volatility volatility;
    private final Kind kind;
    private final boolean variadic;
    private final int defaultCount;

    private FunctionInfo(Builder builder) {
        this.oid = builder.oid;
        this.schema = builder.schema;
        this.name = builder.name;
        this.argTypes = List.copyOf(builder.argTypes);
        this.argModes = List.copyOf(builder.argModes);
        this.returnType = builder.returnType;
        this.returnsSet = builder.returnsSet;
        this.volatility = builder.volatility;
        this.kind = builder.kind;
        this.variadic = builder.variadic;
        this.defaultCount = builder.defaultCount;
    }

    public static Builder builder(String schema, String name) {
        return new Builder(schema, name);
    }

    public long getOid() {
        return oid;
    }

    public String getSchema() {
        return schema;
    }

    public String getName() {
        return name;
    }

    /**
     * Types of all call arguments, OUT arguments of procedures included.
     */
    public List<PgType> getArgTypes() {
        return argTypes;
    }

    /**
     * Argument modes ({@code i}, {@code o}, {@code b}, {@code v}), parallel to {@link #getArgTypes()}.
     */
    public List<String> getArgModes() {
        return argModes;
    }

    public boolean isOutputArgument(int index) {
        if (index >= argModes.size()) {
            return false;
        }
        String mode = argModes.get(index);
        return "o".equals(mode) || "b".equals(mode);
    }

    public PgType getReturnType() {
        return returnType;
    }

    public boolean isReturnsSet() {
        return returnsSet;
    }

    public Volatility getVolatility() {
        return volatility;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isProcedure() {
        return kind == Kind.PROCEDURE;
    }

    public boolean isVariadic() {
        return variadic;
    }

    public int getDefaultCount() {
        return defaultCount;
    }

    public boolean isBuiltin() {
        return "pg_catalog".equals(schema);
    }

    /**
     * Renders the argument types like {@code (integer,text)}.
     */
    public String getSignature() {
        return argTypes.stream().map(PgType::getName).collect(Collectors.joining(",", "(", ")"));
    }

    @Override
    public String toString() {
        return schema + "." + name + getSignature();
    }

    public static class Builder {
        private long oid;
        private final String schema;
        private final String name;
        private final List<PgType> argTypes = new ArrayList<>();
        private final List<String> argModes = new ArrayList<>();
        private PgType returnType = BuiltinTypes.VOID;
        private boolean returnsSet;
        private Volatility volatility = Volatility.VOLATILE;
        private Kind kind = Kind.FUNCTION;
        private boolean variadic;
        private int defaultCount;

        private Builder(String schema, String name) {
            this.schema = schema;
            this.name = name;
        }

        public Builder oid(long oid) {
            this.oid = oid;
            return this;
        }

        public Builder arg(PgType type) {
            return arg(type, "i");
        }

        public Builder arg(PgType type, String mode) {
            argTypes.add(type);
            argModes.add(mode);
            return this;
        }

        public Builder args(PgType... types) {
            for (PgType type : types) {
                arg(type);
            }
            return this;
        }

        public Builder returns(PgType type) {
            this.returnType = type;
            return this;
        }

        public Builder returnsSet(boolean returnsSet) {
            this.returnsSet = returnsSet;
            return this;
        }

        public Builder volatility(Volatility volatility) {
            this.volatility = volatility;
            return this;
        }

        public Builder kind(Kind kind) {
            this.kind = kind;
            return this;
        }

        public Builder variadic(boolean variadic) {
            this.variadic = variadic;
            return this;
        }

        public Builder defaults(int defaultCount) {
            this.defaultCount = defaultCount;
            return this;
        }

        public FunctionInfo build() {
            return new FunctionInfo(this);
        }
    }
}
