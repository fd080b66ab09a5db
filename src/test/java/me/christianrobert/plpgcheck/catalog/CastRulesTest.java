package me.christianrobert.plpgcheck.catalog;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CastRules.
 *
 * The checker decides between "no warning", "performance warning" and "warning" on the
 * cast context returned here, so the context of common pairs must match pg_cast.
 */
class CastRulesTest {

    // ========== Numeric ladder ==========

    @Test
    void castContext_wideningNumericIsImplicit() {
        assertEquals(CastContext.IMPLICIT, CastRules.castContext(BuiltinTypes.INT4, BuiltinTypes.INT8));
        assertEquals(CastContext.IMPLICIT, CastRules.castContext(BuiltinTypes.INT4, BuiltinTypes.NUMERIC));
        assertEquals(CastContext.IMPLICIT, CastRules.castContext(BuiltinTypes.NUMERIC, BuiltinTypes.FLOAT8));
    }

    @Test
    void castContext_narrowingNumericNeedsAssignment() {
        assertEquals(CastContext.ASSIGNMENT, CastRules.castContext(BuiltinTypes.INT8, BuiltinTypes.INT4),
                "bigint -> integer is an assignment cast");
        assertEquals(CastContext.ASSIGNMENT, CastRules.castContext(BuiltinTypes.NUMERIC, BuiltinTypes.INT4));
    }

    @Test
    void castContext_sameTypeAndUnknownAreImplicit() {
        assertEquals(CastContext.IMPLICIT, CastRules.castContext(BuiltinTypes.TEXT, BuiltinTypes.TEXT));
        assertEquals(CastContext.IMPLICIT, CastRules.castContext(BuiltinTypes.UNKNOWN, BuiltinTypes.DATE),
                "unknown literals coerce to anything");
    }

    // ========== Strings ==========

    @Test
    void castContext_stringFamilyIsImplicit() {
        assertEquals(CastContext.IMPLICIT, CastRules.castContext(BuiltinTypes.VARCHAR, BuiltinTypes.TEXT));
        assertEquals(CastContext.IMPLICIT, CastRules.castContext(BuiltinTypes.TEXT, BuiltinTypes.BPCHAR));
    }

    @Test
    void castContext_ioConversionToStringIsAssignment() {
        assertEquals(CastContext.ASSIGNMENT, CastRules.castContext(BuiltinTypes.DATE, BuiltinTypes.TEXT));
    }

    @Test
    void castContext_ioConversionFromStringIsExplicit() {
        assertEquals(CastContext.EXPLICIT, CastRules.castContext(BuiltinTypes.TEXT, BuiltinTypes.INT4),
                "text -> integer must be written as an explicit cast");
    }

    // ========== Date and time ==========

    @Test
    void castContext_datetimeCasts() {
        assertEquals(CastContext.IMPLICIT, CastRules.castContext(BuiltinTypes.DATE, BuiltinTypes.TIMESTAMPTZ));
        assertEquals(CastContext.ASSIGNMENT, CastRules.castContext(BuiltinTypes.TIMESTAMPTZ, BuiltinTypes.DATE));
    }

    @Test
    void castContext_unrelatedTypesHaveNoCast() {
        assertEquals(CastContext.NONE, CastRules.castContext(BuiltinTypes.DATE, BuiltinTypes.INT4));
        assertFalse(CastRules.castContext(BuiltinTypes.DATE, BuiltinTypes.INT4).allowsAssignment());
    }

    @Test
    void castContext_boolAndIntegerIsExplicit() {
        assertEquals(CastContext.EXPLICIT, CastRules.castContext(BuiltinTypes.INT4, BuiltinTypes.BOOL));
    }

    @Test
    void castContext_arraysFollowElements() {
        assertEquals(CastContext.IMPLICIT,
                CastRules.castContext(BuiltinTypes.arrayOf(BuiltinTypes.INT4), BuiltinTypes.arrayOf(BuiltinTypes.INT8)));
    }

    // ========== Binary coercion and common types ==========

    @Test
    void isBinaryCoercible_varcharToText() {
        assertTrue(CastRules.isBinaryCoercible(BuiltinTypes.VARCHAR, BuiltinTypes.TEXT));
        assertFalse(CastRules.isBinaryCoercible(BuiltinTypes.INT4, BuiltinTypes.INT8),
                "int4 -> int8 needs a cast function");
    }

    @Test
    void commonType_picksWiderNumeric() {
        assertEquals(BuiltinTypes.INT8, CastRules.commonType(BuiltinTypes.INT4, BuiltinTypes.INT8));
        assertEquals(BuiltinTypes.NUMERIC, CastRules.commonType(BuiltinTypes.NUMERIC, BuiltinTypes.INT2));
    }

    @Test
    void commonType_unknownFallsBackToText() {
        assertEquals(BuiltinTypes.TEXT, CastRules.commonType(BuiltinTypes.UNKNOWN, BuiltinTypes.UNKNOWN));
        assertEquals(BuiltinTypes.DATE, CastRules.commonType(BuiltinTypes.UNKNOWN, BuiltinTypes.DATE));
    }

    @Test
    void commonType_incompatibleIsNull() {
        assertNull(CastRules.commonType(BuiltinTypes.DATE, BuiltinTypes.BOOL));
    }
}
