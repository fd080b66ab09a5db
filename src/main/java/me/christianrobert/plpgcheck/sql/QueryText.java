package me.christianrobert.plpgcheck.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lexical helpers over raw query text. Words are found outside of string literals, quoted
 * identifiers, dollar quotes and comments, together with their parenthesis depth.
 */
final class QueryText {

    static final class Word {
        final String text;
        final int start;
        final int end;
        final int depth;

        Word(String text, int start, int end, int depth) {
            this.text = text;
            this.start = start;
            this.end = end;
            this.depth = depth;
        }
    }

    private QueryText() {
    }

    static List<Word> words(String sql) {
        List<Word> words = new ArrayList<>();
        int depth = 0;
        int i = 0;
        int length = sql.length();
        while (i < length) {
            char c = sql.charAt(i);
            if (c == '\'') {
                boolean escaped = i > 0 && (sql.charAt(i - 1) == 'e' || sql.charAt(i - 1) == 'E')
                        && (i < 2 || !isWordChar(sql.charAt(i - 2)));
                i = skipString(sql, i, escaped);
            } else if (c == '"') {
                i = skipQuotedIdentifier(sql, i);
            } else if (c == '$' && i + 1 < length && !Character.isDigit(sql.charAt(i + 1))) {
                i = skipDollarQuote(sql, i);
            } else if (c == '-' && i + 1 < length && sql.charAt(i + 1) == '-') {
                int newline = sql.indexOf('\n', i);
                i = newline < 0 ? length : newline + 1;
            } else if (c == '/' && i + 1 < length && sql.charAt(i + 1) == '*') {
                int close = sql.indexOf("*/", i + 2);
                i = close < 0 ? length : close + 2;
            } else if (c == '(') {
                depth++;
                i++;
            } else if (c == ')') {
                depth--;
                i++;
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < length && isWordChar(sql.charAt(i))) {
                    i++;
                }
                words.add(new Word(sql.substring(start, i).toLowerCase(Locale.ROOT), start, i, depth));
            } else {
                i++;
            }
        }
        return words;
    }

    static String firstWord(String sql) {
        for (Word word : words(sql)) {
            return word.text;
        }
        return "";
    }

    /**
     * Index of the first occurrence of a keyword outside parentheses, or -1.
     */
    static int findTopLevelKeyword(String sql, String keyword) {
        for (Word word : words(sql)) {
            if (word.depth == 0 && word.text.equals(keyword)) {
                return word.start;
            }
        }
        return -1;
    }

    /**
     * 1-based position of the first occurrence of {@code name} as a whole word, 0 when
     * it does not occur.
     */
    static int positionOf(String sql, String name) {
        if (name == null || name.isEmpty()) {
            return 0;
        }
        String wanted = name.toLowerCase(Locale.ROOT);
        for (Word word : words(sql)) {
            if (word.text.equals(wanted)) {
                return word.start + 1;
            }
        }
        int quoted = sql.indexOf("\"" + name + "\"");
        return quoted >= 0 ? quoted + 1 : 0;
    }

    /**
     * Index where a trailing {@code FOR UPDATE/SHARE} locking clause starts, or -1.
     */
    static int lockingClauseStart(String sql) {
        List<Word> words = words(sql);
        for (int i = 0; i + 1 < words.size(); i++) {
            Word word = words.get(i);
            if (word.depth != 0 || !word.text.equals("for")) {
                continue;
            }
            String next = words.get(i + 1).text;
            if (next.equals("update") || next.equals("share")
                    || (next.equals("no") || next.equals("key")) && i + 2 < words.size()) {
                return word.start;
            }
        }
        return -1;
    }

    /**
     * True when a WITH item runs a data-modifying statement.
     */
    static boolean hasModifyingCte(String sql) {
        List<Word> words = words(sql);
        if (words.isEmpty() || !words.get(0).text.equals("with")) {
            return false;
        }
        for (int i = 0; i + 1 < words.size(); i++) {
            Word as = words.get(i);
            Word next = words.get(i + 1);
            if (as.text.equals("as") && next.depth == as.depth + 1
                    && (next.text.equals("insert") || next.text.equals("update") || next.text.equals("delete"))) {
                int between = sql.substring(as.end, next.start).replaceAll("\\s+", "").length();
                if (between == 1) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Rewrites {@code $n} parameter references to {@code ?n}, keeping every offset intact.
     */
    static String rewritePositionalParams(String sql) {
        StringBuilder result = new StringBuilder(sql);
        int i = 0;
        int length = sql.length();
        while (i < length) {
            char c = sql.charAt(i);
            if (c == '\'') {
                i = skipString(sql, i, false);
            } else if (c == '"') {
                i = skipQuotedIdentifier(sql, i);
            } else if (c == '$') {
                if (i + 1 < length && Character.isDigit(sql.charAt(i + 1))
                        && (i == 0 || !isWordChar(sql.charAt(i - 1)))) {
                    result.setCharAt(i, '?');
                    i++;
                } else {
                    i = skipDollarQuote(sql, i);
                }
            } else {
                i++;
            }
        }
        return result.toString();
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static int skipString(String sql, int start, boolean backslashEscapes) {
        int i = start + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (backslashEscapes && c == '\\') {
                i += 2;
            } else if (c == '\'') {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
                    i += 2;
                } else {
                    return i + 1;
                }
            } else {
                i++;
            }
        }
        return sql.length();
    }

    private static int skipQuotedIdentifier(String sql, int start) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == '"') {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == '"') {
                    i += 2;
                } else {
                    return i + 1;
                }
            } else {
                i++;
            }
        }
        return sql.length();
    }

    private static int skipDollarQuote(String sql, int start) {
        int tagEnd = sql.indexOf('$', start + 1);
        if (tagEnd < 0) {
            return start + 1;
        }
        String tag = sql.substring(start, tagEnd + 1);
        for (int i = 1; i < tag.length() - 1; i++) {
            if (!isWordChar(tag.charAt(i))) {
                return start + 1;
            }
        }
        int close = sql.indexOf(tag, tagEnd + 1);
        return close < 0 ? sql.length() : close + tag.length();
    }
}
