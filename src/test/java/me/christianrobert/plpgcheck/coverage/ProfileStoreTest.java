package me.christianrobert.plpgcheck.coverage;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ProfileStore.
 */
class ProfileStoreTest {

    @Test
    void record_storesCountersPerRoutineAndFingerprint() {
        ProfileStore store = new ProfileStore(10);

        assertTrue(store.record("public.f1()", 42L, 3, 2, 100));
        assertTrue(store.record("public.f1()", 42L, 3, 2, 50));

        StatementCounters counters = store.get("public.f1()", 42L);
        assertEquals(2, counters.getExecutions(2));
        assertEquals(150, counters.getTotalMicros(2));
        assertNull(store.get("public.f1()", 43L), "a changed body starts a new profile");
    }

    @Test
    void record_dropsNewRoutinesWhenFull() {
        ProfileStore store = new ProfileStore(1);

        assertTrue(store.record("public.f1()", 1L, 2, 1, 10));
        assertFalse(store.record("public.f2()", 1L, 2, 1, 10), "capacity reached");
        assertTrue(store.record("public.f1()", 1L, 2, 1, 10), "known routines are still updated");
        assertEquals(1, store.size());
    }

    @Test
    void reset_removesOneRoutine() {
        ProfileStore store = new ProfileStore(10);
        store.record("public.f1()", 1L, 2, 1, 10);
        store.record("public.f1()", 2L, 2, 1, 10);
        store.record("public.f2()", 1L, 2, 1, 10);

        store.reset("public.f1()");

        assertEquals(1, store.size());
        assertNotNull(store.get("public.f2()", 1L));

        store.resetAll();
        assertEquals(0, store.size());
    }

    @Test
    void get_returnsSnapshot() {
        ProfileStore store = new ProfileStore(10);
        store.record("public.f1()", 1L, 2, 1, 10);

        StatementCounters snapshot = store.get("public.f1()", 1L);
        store.record("public.f1()", 1L, 2, 1, 10);

        assertEquals(1, snapshot.getExecutions(1));
    }

    @Test
    void record_concurrentUpdatesNeverOvercount() throws Exception {
        ProfileStore store = new ProfileStore(10);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        List<Future<Integer>> futures = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            futures.add(executor.submit(() -> {
                int accepted = 0;
                for (int i = 0; i < 1000; i++) {
                    if (store.record("public.f1()", 1L, 1, 1, 1)) {
                        accepted++;
                    }
                }
                return accepted;
            }));
        }
        int accepted = 0;
        for (Future<Integer> future : futures) {
            accepted += future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(accepted, store.get("public.f1()", 1L).getExecutions(1),
                "every accepted update is counted exactly once");
    }

    @Test
    void record_concurrentNewRoutinesNeverExceedCapacity() throws Exception {
        ProfileStore store = new ProfileStore(5);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            int thread = t;
            futures.add(executor.submit(() -> {
                start.await();
                int accepted = 0;
                for (int i = 0; i < 200; i++) {
                    if (store.record("public.f" + thread + "_" + i + "()", 1L, 1, 1, 1)) {
                        accepted++;
                    }
                }
                return accepted;
            }));
        }
        start.countDown();
        int accepted = 0;
        for (Future<Integer> future : futures) {
            accepted += future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(5, store.size());
        assertEquals(5, accepted, "each stored routine took exactly one update");
    }

    @Test
    void reset_freesSlotsForNewRoutines() {
        ProfileStore store = new ProfileStore(1);
        assertTrue(store.record("public.f1()", 1L, 1, 1, 1));
        assertFalse(store.record("public.f2()", 1L, 1, 1, 1));

        store.reset("public.f1()");

        assertTrue(store.record("public.f2()", 1L, 1, 1, 1), "the freed slot is reused");
        assertEquals(1, store.size());
    }
}
