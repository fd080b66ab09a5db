package me.christianrobert.plpgcheck.cache;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers which routine versions passed a passive check. A routine is identified by
 * its id; a changed fingerprint means a changed definition and drops the entry.
 */
@ApplicationScoped
public class CheckCache {

    private static final Logger log = LoggerFactory.getLogger(CheckCache.class);

    private final Map<String, Long> checked = new ConcurrentHashMap<>();

    public boolean isChecked(String routineId, long fingerprint) {
        Long known = checked.get(routineId);
        if (known == null) {
            return false;
        }
        if (known != fingerprint) {
            log.debug("Routine {} changed since its last check", routineId);
            checked.remove(routineId, known);
            return false;
        }
        return true;
    }

    public void markChecked(String routineId, long fingerprint) {
        checked.put(routineId, fingerprint);
    }

    public void invalidate(String routineId) {
        checked.remove(routineId);
    }

    public void clear() {
        log.info("Clearing check cache ({} entries)", checked.size());
        checked.clear();
    }

    public int size() {
        return checked.size();
    }
}
