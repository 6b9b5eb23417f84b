package qrlab.ratelimit.store;

import qrlab.CounterStoreUnavailableException;

import java.util.List;

/**
 * Shared expiring counters. Every method throws {@link CounterStoreUnavailableException} when the backing
 * service cannot be reached.
 */
public interface CounterStore {

    /**
     * Checks the counters in order and, only if all of them are below their limits, increments every one
     * and refreshes its TTL. The check and the increments are a single atomic step for all callers sharing
     * the store.
     *
     * @param scope    groups counters that may be touched together, e.g. the caller identifier
     * @param counters counters to check and increment
     */
    BatchOutcome incrementIfAllBelow(String scope, List<CounterSpec> counters);

    /** Current value, 0 for a missing or expired counter. */
    long get(String key);

    /** @return number of counters removed */
    long deleteByPrefix(String prefix);

    /** False instead of throwing when the store is down. */
    boolean ping();
}
