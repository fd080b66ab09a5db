package me.christianrobert.plpgcheck.sql;

/**
 * Parse and analyze service for SQL embedded in routines.
 */
public interface SqlAnalyzer {

    /**
     * Parses and resolves one statement. {@code $n} references and names the range table
     * cannot supply are resolved through {@code params}.
     */
    ResolvedQuery analyze(String sql, ParamResolver params) throws SqlAnalysisException;

    /**
     * Resolves the text following {@code CALL}: a procedure name with its arguments.
     */
    ResolvedQuery analyzeCall(String callText, ParamResolver params) throws SqlAnalysisException;
}
