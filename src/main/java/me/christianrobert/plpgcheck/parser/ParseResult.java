package me.christianrobert.plpgcheck.parser;

import me.christianrobert.plpgcheck.antlr.PlPgSqlParser;
import org.antlr.v4.runtime.CommonTokenStream;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of parsing a routine body.
 * Contains the parse tree, its token stream and any syntax errors encountered.
 */
public class ParseResult {

    private final PlPgSqlParser.PlFunctionContext tree;
    private final CommonTokenStream tokens;
    private final List<String> errors;
    private final int firstErrorLine;
    private final String originalSource;

    public ParseResult(PlPgSqlParser.PlFunctionContext tree, CommonTokenStream tokens, List<String> errors,
                       int firstErrorLine, String originalSource) {
        this.tree = tree;
        this.tokens = tokens;
        this.errors = new ArrayList<>(errors);
        this.firstErrorLine = firstErrorLine;
        this.originalSource = originalSource;
    }

    /**
     * Gets the ANTLR parse tree root node.
     */
    public PlPgSqlParser.PlFunctionContext getTree() {
        return tree;
    }

    public CommonTokenStream getTokens() {
        return tokens;
    }

    /**
     * Gets the list of syntax errors encountered during parsing.
     */
    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * Line of the first syntax error, or 0 when parsing succeeded.
     */
    public int getFirstErrorLine() {
        return firstErrorLine;
    }

    public String getOriginalSource() {
        return originalSource;
    }

    /**
     * Checks if parsing was successful (no errors).
     */
    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Gets a formatted error message combining all errors.
     */
    public String getErrorMessage() {
        if (errors.isEmpty()) {
            return null;
        }
        return String.join("\n", errors);
    }

    @Override
    public String toString() {
        return "ParseResult{success=" + isSuccess() + ", errors=" + errors.size() + "}";
    }
}
