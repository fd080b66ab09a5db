package me.christianrobert.plpgcheck.catalog;

/**
 * Function volatility, ordered from the strictest to the weakest guarantee.
 */
public enum Volatility {
    IMMUTABLE('i'),
    STABLE('s'),
    VOLATILE('v');

    private final char code;

    Volatility(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * Returns the weaker of the two volatilities.
     */
    public Volatility weaker(Volatility other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }

    public static Volatility fromCode(String code) {
        if (code == null || code.isEmpty()) {
            return VOLATILE;
        }
        switch (Character.toLowerCase(code.charAt(0))) {
            case 'i':
                return IMMUTABLE;
            case 's':
                return STABLE;
            default:
                return VOLATILE;
        }
    }
}
