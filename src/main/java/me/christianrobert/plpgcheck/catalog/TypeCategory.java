package me.christianrobert.plpgcheck.catalog;

/**
 * Type categories as PostgreSQL stores them in {@code pg_type.typcategory}.
 */
public enum TypeCategory {
    ARRAY('A'),
    BOOLEAN('B'),
    COMPOSITE('C'),
    DATETIME('D'),
    ENUM('E'),
    GEOMETRIC('G'),
    NETWORK('I'),
    NUMERIC('N'),
    PSEUDO('P'),
    RANGE('R'),
    STRING('S'),
    TIMESPAN('T'),
    USER('U'),
    BITSTRING('V'),
    UNKNOWN('X');

    private final char code;

    TypeCategory(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    public static TypeCategory fromCode(String code) {
        if (code == null || code.isEmpty()) {
            return USER;
        }
        char c = Character.toUpperCase(code.charAt(0));
        for (TypeCategory category : values()) {
            if (category.code == c) {
                return category;
            }
        }
        return USER;
    }
}
