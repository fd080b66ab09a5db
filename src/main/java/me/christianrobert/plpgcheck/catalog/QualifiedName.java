package me.christianrobert.plpgcheck.catalog;

import java.util.Locale;
import java.util.Objects;

/**
 * A possibly schema-qualified object name. Unquoted parts are folded to lower case.
 */
public class QualifiedName {

    private final String schema;
    private final String name;

    public QualifiedName(String schema, String name) {
        this.schema = schema;
        this.name = name;
    }

    public static QualifiedName parse(String text) {
        String trimmed = text.trim();
        int dot = indexOfUnquotedDot(trimmed);
        if (dot < 0) {
            return new QualifiedName(null, normalizeIdentifier(trimmed));
        }
        return new QualifiedName(normalizeIdentifier(trimmed.substring(0, dot)),
                normalizeIdentifier(trimmed.substring(dot + 1)));
    }

    /**
     * Folds an identifier the way the server does: quoted identifiers keep their case.
     */
    public static String normalizeIdentifier(String identifier) {
        String trimmed = identifier.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1).replace("\"\"", "\"");
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    private static int indexOfUnquotedDot(String text) {
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == '.' && !quoted) {
                return i;
            }
        }
        return -1;
    }

    public String getSchema() {
        return schema;
    }

    public String getName() {
        return name;
    }

    public boolean isQualified() {
        return schema != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QualifiedName)) return false;
        QualifiedName that = (QualifiedName) o;
        return Objects.equals(schema, that.schema) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, name);
    }

    @Override
    public String toString() {
        return schema != null ? schema + "." + name : name;
    }
}
