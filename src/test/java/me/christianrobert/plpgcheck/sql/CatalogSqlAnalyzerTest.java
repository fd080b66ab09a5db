package me.christianrobert.plpgcheck.sql;

import me.christianrobert.plpgcheck.catalog.BuiltinTypes;
import me.christianrobert.plpgcheck.catalog.InMemoryCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CatalogSqlAnalyzer: name resolution, typing and the errors the server
 * parser and analyzer would raise.
 */
class CatalogSqlAnalyzerTest {

    private final InMemoryCatalog catalog = new InMemoryCatalog()
            .addTable("public.t1", "a integer", "b text")
            .addTable("public.t2", "a integer", "d date");
    private final CatalogSqlAnalyzer analyzer = new CatalogSqlAnalyzer(catalog);

    /**
     * Knows a single boolean variable {@code v} and the positional parameter $1.
     */
    private static final ParamResolver VARIABLES = new ParamResolver() {
        @Override
        public ParamRef resolveName(List<String> nameParts) {
            if (nameParts.size() == 1 && nameParts.get(0).equals("v")) {
                return new ParamRef(5, "v", BuiltinTypes.BOOL, false);
            }
            return null;
        }

        @Override
        public ParamRef resolveNumber(int number) {
            return number == 1 ? new ParamRef(0, "$1", BuiltinTypes.INT4, true) : null;
        }
    };

    private SqlAnalysisException analysisError(String sql, ParamResolver params) {
        return assertThrows(SqlAnalysisException.class, () -> analyzer.analyze(sql, params));
    }

    // ========== Target lists ==========

    @Test
    void analyze_selectColumnsFromTable() throws SqlAnalysisException {
        ResolvedQuery query = analyzer.analyze("select a, b from t1", ParamResolver.NONE);

        assertEquals(CommandType.SELECT, query.getCommandType());
        assertEquals(2, query.getTargetList().size());
        assertEquals(BuiltinTypes.INT4, query.getTargetList().get(0).getType());
        assertEquals(BuiltinTypes.TEXT, query.getTargetList().get(1).getType());
        assertEquals(1, query.getRelations().size());
        assertFalse(query.isDataModifying());
    }

    @Test
    void analyze_literalTypes() throws SqlAnalysisException {
        ResolvedQuery query = analyzer.analyze("SELECT 1, 'x', null", ParamResolver.NONE);

        assertEquals(BuiltinTypes.INT4, query.getTargetList().get(0).getType());
        assertEquals(BuiltinTypes.UNKNOWN, query.getTargetList().get(1).getType(), "string literals stay unknown");
        assertEquals(BuiltinTypes.UNKNOWN, query.getTargetList().get(2).getType());
    }

    @Test
    void analyze_trailingSemicolonIsIgnored() throws SqlAnalysisException {
        assertEquals(1, analyzer.analyze("select a from t1;", ParamResolver.NONE).getTargetList().size());
    }

    // ========== Name resolution ==========

    @Test
    void analyze_unknownRelation() {
        SqlAnalysisException e = analysisError("select * from nosuch", ParamResolver.NONE);
        assertEquals("42P01", e.getSqlState());
        assertEquals("relation \"nosuch\" does not exist", e.getMessage());
    }

    @Test
    void analyze_unknownColumn() {
        SqlAnalysisException e = analysisError("select zz from t1", ParamResolver.NONE);
        assertEquals("42703", e.getSqlState());
        assertEquals("column \"zz\" does not exist", e.getMessage());
    }

    @Test
    void analyze_columnInTwoTablesIsAmbiguous() {
        SqlAnalysisException e = analysisError("select a from t1, t2", ParamResolver.NONE);
        assertEquals("42702", e.getSqlState());
        assertEquals("column reference \"a\" is ambiguous", e.getMessage());
    }

    @Test
    void analyze_variableAndColumnAreAmbiguous() {
        InMemoryCatalog withV = new InMemoryCatalog().addTable("public.t3", "v boolean");
        SqlAnalysisException e = assertThrows(SqlAnalysisException.class,
                () -> new CatalogSqlAnalyzer(withV).analyze("select v from t3", VARIABLES));

        assertEquals("42702", e.getSqlState());
        assertEquals("It could refer to either a PL/pgSQL variable or a table column.", e.getDetail());
    }

    @Test
    void analyze_variableIsRecordedAsParameter() throws SqlAnalysisException {
        ResolvedQuery query = analyzer.analyze("select a from t1 where v", VARIABLES);

        assertEquals(1, query.getParamRefs().size());
        assertEquals("v", query.getParamRefs().get(0).getName());
    }

    @Test
    void analyze_missingPositionalParameter() {
        SqlAnalysisException e = analysisError("select $2", VARIABLES);
        assertEquals("42P02", e.getSqlState());
        assertEquals("there is no parameter $2", e.getMessage());
    }

    // ========== Functions and operators ==========

    @Test
    void analyze_unknownFunction() {
        SqlAnalysisException e = analysisError("select nosuchfn(1)", ParamResolver.NONE);
        assertEquals("42883", e.getSqlState());
        assertEquals("function nosuchfn(integer) does not exist", e.getMessage());
        assertNotNull(e.getHint());
    }

    @Test
    void analyze_builtinFunctionIsRecorded() throws SqlAnalysisException {
        ResolvedQuery query = analyzer.analyze("select length(b) from t1", ParamResolver.NONE);
        assertEquals(BuiltinTypes.INT4, query.getTargetList().get(0).getType());
        assertFalse(query.getFunctions().isEmpty());
    }

    @Test
    void analyze_comparisonWithoutOperator() {
        SqlAnalysisException e = analysisError("select d > v from t2", VARIABLES);
        assertEquals("42883", e.getSqlState());
        assertEquals("operator does not exist: date > boolean", e.getMessage());
    }

    // ========== Commands ==========

    @Test
    void analyze_insertIsDataModifying() throws SqlAnalysisException {
        ResolvedQuery query = analyzer.analyze("insert into t1 values (1, 'x')", ParamResolver.NONE);
        assertEquals(CommandType.INSERT, query.getCommandType());
        assertTrue(query.isDataModifying());
        assertFalse(query.isReturnsTuples());
    }

    @Test
    void analyze_insertWithTooManyValues() {
        SqlAnalysisException e = analysisError("insert into t1 values (1, 'x', 2)", ParamResolver.NONE);
        assertEquals("INSERT has more expressions than target columns", e.getMessage());
    }

    @Test
    void analyze_updateOfUnknownColumn() {
        SqlAnalysisException e = analysisError("update t1 set zz = 1", ParamResolver.NONE);
        assertEquals("column \"zz\" of relation \"t1\" does not exist", e.getMessage());
    }

    @Test
    void analyze_transactionCommandsAreClassified() throws SqlAnalysisException {
        assertEquals(CommandType.TRANSACTION, analyzer.analyze("commit", ParamResolver.NONE).getCommandType());
    }
}
