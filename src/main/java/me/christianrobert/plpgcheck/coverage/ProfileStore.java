package me.christianrobert.plpgcheck.coverage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed capacity table of per-routine statement counters shared by concurrent callers.
 * Updates are best effort: a contended entry or a full table drops the update.
 */
public class ProfileStore {

    private static final Logger log = LoggerFactory.getLogger(ProfileStore.class);

    private static final class Key {
        private final String routineId;
        private final long fingerprint;

        Key(String routineId, long fingerprint) {
            this.routineId = routineId;
            this.fingerprint = fingerprint;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key key = (Key) o;
            return fingerprint == key.fingerprint && routineId.equals(key.routineId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(routineId, fingerprint);
        }
    }

    private static final class Chunk {
        private final ReentrantLock lock = new ReentrantLock();
        private final StatementCounters counters;

        Chunk(int statementCount) {
            this.counters = new StatementCounters(statementCount);
        }
    }

    private final int capacity;
    private final Map<Key, Chunk> chunks = new ConcurrentHashMap<>();
    private final AtomicInteger usedSlots = new AtomicInteger();
    private final AtomicBoolean exhaustedLogged = new AtomicBoolean();

    public ProfileStore(int capacity) {
        this.capacity = capacity;
    }

    /**
     * Adds one execution of a statement.
     *
     * @return {@code false} when the update was dropped
     */
    public boolean record(String routineId, long fingerprint, int statementCount, int stmtId, long micros) {
        Key key = new Key(routineId, fingerprint);
        Chunk chunk = chunks.get(key);
        if (chunk == null) {
            chunk = allocate(key, statementCount);
            if (chunk == null) {
                if (exhaustedLogged.compareAndSet(false, true)) {
                    log.warn("Profile store is full ({} routines), further routines are not recorded", capacity);
                }
                return false;
            }
        }
        if (!chunk.lock.tryLock()) {
            return false;
        }
        try {
            chunk.counters.record(stmtId, micros);
            return true;
        } finally {
            chunk.lock.unlock();
        }
    }

    /**
     * Reserves a slot before the entry is published, so concurrent callers never fill more
     * than {@code capacity} entries.
     *
     * @return the entry of {@code key}, or {@code null} when no slot is left
     */
    private Chunk allocate(Key key, int statementCount) {
        int used;
        do {
            used = usedSlots.get();
            if (used >= capacity) {
                return chunks.get(key);
            }
        } while (!usedSlots.compareAndSet(used, used + 1));

        Chunk created = new Chunk(statementCount);
        Chunk existing = chunks.putIfAbsent(key, created);
        if (existing != null) {
            usedSlots.decrementAndGet();
            return existing;
        }
        return created;
    }

    /**
     * Snapshot of the counters, or {@code null} when nothing was recorded.
     */
    public StatementCounters get(String routineId, long fingerprint) {
        Chunk chunk = chunks.get(new Key(routineId, fingerprint));
        if (chunk == null) {
            return null;
        }
        chunk.lock.lock();
        try {
            return chunk.counters.copy();
        } finally {
            chunk.lock.unlock();
        }
    }

    public void reset(String routineId) {
        for (Key key : chunks.keySet()) {
            if (key.routineId.equals(routineId)) {
                release(key);
            }
        }
    }

    public void resetAll() {
        for (Key key : chunks.keySet()) {
            release(key);
        }
        exhaustedLogged.set(false);
    }

    private void release(Key key) {
        if (chunks.remove(key) != null) {
            usedSlots.decrementAndGet();
        }
    }

    public int size() {
        return chunks.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
