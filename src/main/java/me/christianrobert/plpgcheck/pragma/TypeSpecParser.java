package me.christianrobert.plpgcheck.pragma;

import me.christianrobert.plpgcheck.catalog.Catalog;
import me.christianrobert.plpgcheck.catalog.ColumnInfo;
import me.christianrobert.plpgcheck.catalog.PgType;
import me.christianrobert.plpgcheck.catalog.QualifiedName;
import me.christianrobert.plpgcheck.catalog.RelationInfo;
import me.christianrobert.plpgcheck.parser.SqlText;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the field list of {@code type:} and {@code table:} pragmas. Accepted forms are
 * {@code (a int, b text)}, {@code (like some_table)} and a composite type name.
 */
class TypeSpecParser {

    private final Catalog catalog;

    TypeSpecParser(Catalog catalog) {
        this.catalog = catalog;
    }

    List<ColumnInfo> parseFields(String spec) throws PragmaException {
        String text = spec.trim();
        if (text.startsWith("(")) {
            int close = matchingParen(text);
            if (close < 0) {
                throw new PragmaException("Syntax error (unclosed parenthesis)");
            }
            if (!text.substring(close + 1).trim().isEmpty()) {
                throw new PragmaException("Syntax error (unexpected chars after type specification)");
            }
            return parseList(text.substring(1, close).trim());
        }
        PgType type = PragmaProcessor.requireType(catalog.findType(text), text);
        if (!type.isComposite() || type.getFields().isEmpty()) {
            throw new PragmaException("\"" + text + "\" is not composite type");
        }
        return type.getFields();
    }

    private List<ColumnInfo> parseList(String body) throws PragmaException {
        if (body.isEmpty()) {
            throw new PragmaException("Syntax error (expected identifier)");
        }
        if (body.toLowerCase(Locale.ROOT).startsWith("like ")) {
            String name = body.substring(5).trim();
            RelationInfo relation = catalog.findRelation(QualifiedName.parse(name));
            if (relation == null) {
                throw new PragmaException("relation \"" + name + "\" does not exist");
            }
            return new ArrayList<>(relation.getColumns());
        }
        List<ColumnInfo> fields = new ArrayList<>();
        for (String item : SqlText.splitTopLevel(body, ',')) {
            String definition = item.trim();
            int space = nameEnd(definition);
            if (space <= 0 || space >= definition.length()) {
                throw new PragmaException("Syntax error (expected identifier)");
            }
            String name = QualifiedName.normalizeIdentifier(definition.substring(0, space));
            String typeName = definition.substring(space).trim();
            if (typeName.isEmpty()) {
                throw new PragmaException("Syntax error (expected type identifier)");
            }
            fields.add(new ColumnInfo(name, PragmaProcessor.requireType(catalog.findType(typeName), typeName)));
        }
        return fields;
    }

    private static int nameEnd(String definition) {
        if (definition.startsWith("\"")) {
            int i = 1;
            while (i < definition.length()) {
                if (definition.charAt(i) == '"') {
                    if (i + 1 < definition.length() && definition.charAt(i + 1) == '"') {
                        i += 2;
                        continue;
                    }
                    return i + 1;
                }
                i++;
            }
            return -1;
        }
        for (int i = 0; i < definition.length(); i++) {
            if (Character.isWhitespace(definition.charAt(i))) {
                return i;
            }
        }
        return definition.length();
    }

    private static int matchingParen(String text) {
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
