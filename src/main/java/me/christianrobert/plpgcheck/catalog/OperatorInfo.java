package me.christianrobert.plpgcheck.catalog;

/**
 * A user-defined operator from {@code pg_operator}. Built-in operators are typed by the analyzer itself.
 */
public class OperatorInfo {

    private final long oid;
    private final String schema;
    private final String symbol;
    private final PgType left;
    private final PgType right;
    private final PgType result;
    private final Volatility volatility;

    public OperatorInfo(long oid, String schema, String symbol, PgType left, PgType right, PgType result,
                        Volatility volatility) {
        this.oid = oid;
        this.schema = schema;
        this.symbol = symbol;
        this.left = left;
        this.right = right;
        this.result = result;
        this.volatility = volatility;
    }

    public long getOid() {
        return oid;
    }

    public String getSchema() {
        return schema;
    }

    public String getSymbol() {
        return symbol;
    }

    public PgType getLeft() {
        return left;
    }

    public PgType getRight() {
        return right;
    }

    public PgType getResult() {
        return result;
    }

    public Volatility getVolatility() {
        return volatility;
    }

    public boolean isBuiltin() {
        return "pg_catalog".equals(schema);
    }

    /**
     * Operand signature like {@code (integer,integer)}; a missing operand renders as {@code -}.
     */
    public String getSignature() {
        return "(" + (left != null ? left.getName() : "-") + "," + (right != null ? right.getName() : "-") + ")";
    }

    @Override
    public String toString() {
        return schema + "." + symbol + getSignature();
    }
}
