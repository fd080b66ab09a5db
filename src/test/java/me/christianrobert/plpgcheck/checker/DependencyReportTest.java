package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.catalog.BuiltinTypes;
import me.christianrobert.plpgcheck.catalog.FunctionInfo;
import me.christianrobert.plpgcheck.catalog.Volatility;
import me.christianrobert.plpgcheck.dependency.DependencyRecord;
import me.christianrobert.plpgcheck.dependency.DependencyType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the objects a routine depends on: relations, user functions and user
 * operators, each listed once in the order it is first met.
 */
class DependencyReportTest extends PlPgSqlCheckTestBase {

    private static CheckOptions withDependencies() {
        CheckOptions options = CheckOptions.defaults();
        options.setShowDependencies(true);
        return options;
    }

    private void addUserObjects() {
        catalog.addOperator("public", "=", BuiltinTypes.INT4, BuiltinTypes.INT4, BuiltinTypes.BOOL,
                Volatility.IMMUTABLE);
        catalog.addFunction(FunctionInfo.builder("public", "total")
                .args(BuiltinTypes.INT4)
                .returns(BuiltinTypes.INT8)
                .volatility(Volatility.STABLE));
    }

    // ========== Collected objects ==========

    @Test
    void relationFunctionAndOperatorAreListedOnce() {
        addUserObjects();

        CheckResult result = check(function("void", """
                begin
                  perform total(a) from t1 where a = 1;
                  perform total(a) from t1 where a = 2;
                end;
                """), withDependencies());

        List<DependencyRecord> dependencies = result.getDependencies();
        assertEquals(3, dependencies.size(), "dependencies: " + dependencies);

        DependencyRecord relation = dependencies.get(0);
        assertEquals(DependencyType.RELATION, relation.getType());
        assertEquals("public", relation.getSchema());
        assertEquals("t1", relation.getName());
        assertNull(relation.getParams());

        DependencyRecord function = dependencies.get(1);
        assertEquals(DependencyType.FUNCTION, function.getType());
        assertEquals("total", function.getName());
        assertEquals("(integer)", function.getParams());

        DependencyRecord operator = dependencies.get(2);
        assertEquals(DependencyType.OPERATOR, operator.getType());
        assertEquals("=", operator.getName());
        assertEquals("(integer,integer)", operator.getParams());

        long distinctKeys = dependencies.stream().map(DependencyRecord::key).distinct().count();
        assertEquals(3, distinctKeys);
    }

    @Test
    void builtinFunctionsAreNotListed() {
        CheckResult result = check(function("void", """
                begin
                  perform length(b) from t1;
                end;
                """), withDependencies());

        List<DependencyRecord> dependencies = result.getDependencies();
        assertEquals(1, dependencies.size(), "dependencies: " + dependencies);
        assertEquals(DependencyType.RELATION, dependencies.get(0).getType());
        assertEquals("t1", dependencies.get(0).getName());
    }

    @Test
    void pragmaTableIsListedApartFromCatalogTables() {
        CheckResult result = check(function("void", """
                begin
                  perform plpgsql_check_pragma('table: tmp(id integer)');
                  perform id from tmp;
                  perform a from t1;
                end;
                """), withDependencies());

        List<DependencyRecord> relations = result.getDependencies().stream()
                .filter(d -> d.getType() == DependencyType.RELATION)
                .collect(Collectors.toList());
        assertEquals(2, relations.size(), "dependencies: " + result.getDependencies());
        assertEquals("tmp", relations.get(0).getName());
        assertTrue(relations.get(0).getOid() < 0, "pragma tables get oids no catalog uses");
        assertEquals("t1", relations.get(1).getName());
        assertNotEquals(relations.get(0).key(), relations.get(1).key());
    }

    // ========== Option ==========

    @Test
    void noDependenciesWithoutTheOption() {
        addUserObjects();

        CheckResult result = check(function("void", """
                begin
                  perform total(a) from t1 where a = 1;
                end;
                """));

        assertTrue(result.getDependencies().isEmpty());
    }
}
