package me.christianrobert.plpgcheck.catalog;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for InMemoryCatalog, the catalog offline checks and most other tests run against.
 */
class InMemoryCatalogTest {

    private final InMemoryCatalog catalog = new InMemoryCatalog(List.of("app", "public"))
            .addTable("public.t1", "a integer", "b text not null")
            .addTable("app.orders", "id bigint", "created timestamp with time zone")
            .addSequence("public.s1")
            .addCompositeType("public.pair", "x integer", "y integer")
            .addFunction(FunctionInfo.builder("app", "total")
                    .args(BuiltinTypes.INT8)
                    .returns(BuiltinTypes.NUMERIC)
                    .volatility(Volatility.STABLE));

    // ========== Relations ==========

    @Test
    void findRelation_unqualifiedUsesSearchPath() {
        RelationInfo orders = catalog.findRelation("orders");
        assertNotNull(orders, "orders is found through the app schema");
        assertEquals("app", orders.getSchema());
        assertEquals(RelationKind.TABLE, orders.getKind());
    }

    @Test
    void findRelation_qualifiedNameMustMatchSchema() {
        assertNotNull(catalog.findRelation("public.t1"));
        assertNull(catalog.findRelation("app.t1"), "t1 lives in public only");
    }

    @Test
    void findRelation_foldsUnquotedNames() {
        assertNotNull(catalog.findRelation("PUBLIC.T1"));
    }

    @Test
    void addTable_parsesColumnDefinitions() {
        RelationInfo t1 = catalog.findRelation("t1");
        assertEquals(2, t1.getColumns().size());
        assertEquals(BuiltinTypes.INT4, t1.findColumn("a").getType());
        assertEquals(BuiltinTypes.TEXT, t1.findColumn("b").getType());
        assertTrue(t1.findColumn("b").isNotNull(), "NOT NULL suffix is recognized");
        assertFalse(t1.findColumn("a").isNotNull());
    }

    @Test
    void addTable_rejectsUnknownColumnType() {
        InMemoryCatalog fresh = new InMemoryCatalog();
        assertThrows(IllegalArgumentException.class, () -> fresh.addTable("x", "a nosuchtype"));
        assertThrows(IllegalArgumentException.class, () -> fresh.addTable("y", "justname"));
    }

    @Test
    void addSequence_hasSequenceColumns() {
        RelationInfo s1 = catalog.findRelation("s1");
        assertTrue(s1.isSequence());
        assertNotNull(s1.findColumn("last_value"));
    }

    // ========== Types ==========

    @Test
    void findType_builtinAliases() {
        assertEquals(BuiltinTypes.INT4, catalog.findType("int"));
        assertEquals(BuiltinTypes.NUMERIC, catalog.findType("NUMERIC(10, 2)"));
        assertEquals(BuiltinTypes.VARCHAR, catalog.findType("character varying(20)"));
        assertEquals(BuiltinTypes.arrayOf(BuiltinTypes.TEXT), catalog.findType("text[]"));
    }

    @Test
    void findType_relationRowType() {
        PgType pair = catalog.findType("pair");
        assertNotNull(pair);
        assertTrue(pair.isComposite());
        assertEquals(2, pair.getFields().size());
    }

    @Test
    void findType_unknownIsNull() {
        assertNull(catalog.findType("no_such_type"));
    }

    // ========== Functions ==========

    @Test
    void findFunctions_includesBuiltins() {
        List<FunctionInfo> length = catalog.findFunctions(QualifiedName.parse("length"));
        assertFalse(length.isEmpty());
        assertTrue(length.get(0).isBuiltin());
    }

    @Test
    void findFunctions_userFunctionBySearchPath() {
        List<FunctionInfo> total = catalog.findFunctions(QualifiedName.parse("total"));
        assertEquals(1, total.size());
        assertEquals(Volatility.STABLE, total.get(0).getVolatility());
        assertEquals("(bigint)", total.get(0).getSignature());
        assertTrue(total.get(0).getOid() > 0, "registered functions receive an oid");
    }

    @Test
    void findFunctions_wrongSchemaFindsNothing() {
        assertTrue(catalog.findFunctions(QualifiedName.parse("public.total")).isEmpty());
        assertTrue(catalog.findFunctions(QualifiedName.parse("app.length")).isEmpty(),
                "builtins are only visible unqualified or under pg_catalog");
    }

    // ========== Qualified names ==========

    @Test
    void qualifiedName_keepsQuotedCase() {
        QualifiedName name = QualifiedName.parse("\"MySchema\".Orders");
        assertEquals("MySchema", name.getSchema());
        assertEquals("orders", name.getName());
    }
}
