package me.christianrobert.plpgcheck.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Small lexical helpers over raw SQL text that is not worth a full parse.
 */
public final class SqlText {

    private SqlText() {
    }

    /**
     * Splits on a separator character that is outside quotes, parentheses and brackets.
     */
    public static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipQuoted(text, i, c);
            } else if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(text.substring(start, i).trim());
                start = i + 1;
            }
        }
        String last = text.substring(start).trim();
        if (!last.isEmpty() || !parts.isEmpty()) {
            parts.add(last);
        }
        return parts;
    }

    private static int skipQuoted(String text, int start, char quote) {
        int i = start + 1;
        while (i < text.length()) {
            if (text.charAt(i) == quote) {
                if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        return text.length() - 1;
    }

    /**
     * Returns the value of a string literal: {@code 'it''s'}, {@code E'a\tb'} or a dollar-quoted string.
     *
     * @return the unquoted value, or {@code null} when the text is not a single literal
     */
    public static String literalValue(String literal) {
        String text = literal.trim();
        if (text.length() >= 2 && text.startsWith("'") && text.endsWith("'")) {
            String body = text.substring(1, text.length() - 1);
            if (body.replace("''", "").contains("'")) {
                return null;
            }
            return body.replace("''", "'");
        }
        if (text.length() >= 3 && (text.startsWith("E'") || text.startsWith("e'")) && text.endsWith("'")) {
            return unescape(text.substring(2, text.length() - 1).replace("''", "'"));
        }
        if (text.startsWith("$")) {
            int tagEnd = text.indexOf('$', 1);
            if (tagEnd > 0) {
                String tag = text.substring(0, tagEnd + 1);
                if (text.length() >= 2 * tag.length() && text.endsWith(tag)) {
                    String body = text.substring(tag.length(), text.length() - tag.length());
                    return body.contains(tag) ? null : body;
                }
            }
        }
        return null;
    }

    private static String unescape(String body) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(++i);
                switch (next) {
                    case 'n':
                        sb.append('\n');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    default:
                        sb.append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
