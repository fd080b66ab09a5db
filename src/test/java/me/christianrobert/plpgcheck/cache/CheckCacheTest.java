package me.christianrobert.plpgcheck.cache;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CheckCacheTest {

    @Test
    void testMarkedRoutineIsChecked() {
        CheckCache cache = new CheckCache();
        assertFalse(cache.isChecked("100", 42L));

        cache.markChecked("100", 42L);

        assertTrue(cache.isChecked("100", 42L));
        assertFalse(cache.isChecked("101", 42L));
    }

    @Test
    void testChangedFingerprintDropsEntry() {
        CheckCache cache = new CheckCache();
        cache.markChecked("100", 42L);

        assertFalse(cache.isChecked("100", 43L));
        assertEquals(0, cache.size());
        assertFalse(cache.isChecked("100", 42L), "the old version is forgotten too");
    }

    @Test
    void testInvalidateAndClear() {
        CheckCache cache = new CheckCache();
        cache.markChecked("100", 1L);
        cache.markChecked("101", 2L);

        cache.invalidate("100");
        assertFalse(cache.isChecked("100", 1L));
        assertTrue(cache.isChecked("101", 2L));

        cache.clear();
        assertEquals(0, cache.size());
    }
}
