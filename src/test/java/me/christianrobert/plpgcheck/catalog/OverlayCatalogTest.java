package me.christianrobert.plpgcheck.catalog;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OverlayCatalog.
 */
class OverlayCatalogTest {

    private final InMemoryCatalog base = new InMemoryCatalog().addTable("public.t1", "a integer");

    @Test
    void addTemporaryTable_isFoundBeforeBaseRelation() {
        OverlayCatalog overlay = new OverlayCatalog(base);
        overlay.addTemporaryTable("t1", List.of(new ColumnInfo("id", BuiltinTypes.INT4)));

        RelationInfo unqualified = overlay.findRelation(QualifiedName.parse("t1"));
        assertEquals(OverlayCatalog.TEMP_SCHEMA, unqualified.getSchema());
        assertTrue(overlay.isTemporary(unqualified));

        RelationInfo qualified = overlay.findRelation(QualifiedName.parse("public.t1"));
        assertEquals("public", qualified.getSchema(), "a qualified name skips the overlay");
        assertFalse(overlay.isTemporary(qualified));
    }

    @Test
    void temporaryRelations_getDistinctNegativeOids() {
        OverlayCatalog overlay = new OverlayCatalog(base);
        RelationInfo table = overlay.addTemporaryTable("tmp", List.of(new ColumnInfo("id", BuiltinTypes.INT4)));
        RelationInfo sequence = overlay.addTemporarySequence("tmp_seq");
        RelationInfo server = base.findRelation(QualifiedName.parse("public.t1"));

        assertTrue(table.getOid() < 0, "oid " + table.getOid());
        assertTrue(sequence.getOid() < 0, "oid " + sequence.getOid());
        assertNotEquals(table.getOid(), sequence.getOid());
        assertTrue(server.getOid() > 0);
    }

    @Test
    void temporaryRelations_doNotLeakIntoBase() {
        OverlayCatalog overlay = new OverlayCatalog(base);
        overlay.addTemporarySequence("tmp_seq");

        assertNotNull(overlay.findRelation(QualifiedName.parse("tmp_seq")));
        assertNull(base.findRelation(QualifiedName.parse("tmp_seq")));
    }
}
