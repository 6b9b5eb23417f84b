package qrlab.ratelimit.store;

import qrlab.ratelimit.clock.Clock;
import qrlab.ratelimit.clock.SystemClock;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local counter store. Batches are serialized by a fixed pool of {@value #LOCK_STRIPES} lock
 * stripes picked by scope, so batches in the same scope never interleave and the lock pool does not grow
 * with the number of identifiers.
 *
 * <p>Only safe when a single process enforces the limits. Expired counters are dropped lazily and by a
 * sweep every {@value #SWEEP_INTERVAL} batches.
 */
public final class InMemoryCounterStore implements CounterStore {

    static final int SWEEP_INTERVAL = 1024;
    static final int LOCK_STRIPES = 64;

    private final Clock clock;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];
    private final AtomicInteger batches = new AtomicInteger();

    public InMemoryCounterStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public InMemoryCounterStore() {
        this(SystemClock.instance());
    }

    @Override
    public BatchOutcome incrementIfAllBelow(String scope, List<CounterSpec> specs) {
        if (batches.incrementAndGet() % SWEEP_INTERVAL == 0) {
            purgeExpired();
        }
        var lock = stripes[Math.floorMod(scope.hashCode(), stripes.length)];
        lock.lock();
        try {
            long now = clock.nowMillis();
            var current = new ArrayList<Long>(specs.size());
            for (var spec : specs) {
                current.add(valueAt(spec.key(), now));
            }
            for (int i = 0; i < specs.size(); i++) {
                if (current.get(i) >= specs.get(i).limit()) {
                    return BatchOutcome.blocked(i, current);
                }
            }
            var updated = new ArrayList<Long>(specs.size());
            for (int i = 0; i < specs.size(); i++) {
                var spec = specs.get(i);
                long value = current.get(i) + 1;
                counters.put(spec.key(), new Counter(value, now + spec.ttl().toMillis()));
                updated.add(value);
            }
            return BatchOutcome.applied(updated);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long get(String key) {
        return valueAt(key, clock.nowMillis());
    }

    @Override
    public long deleteByPrefix(String prefix) {
        long removed = 0;
        for (var key : counters.keySet()) {
            if (key.startsWith(prefix) && counters.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public boolean ping() {
        return true;
    }

    /** Drops every expired counter. */
    public void purgeExpired() {
        long now = clock.nowMillis();
        counters.entrySet().removeIf(e -> e.getValue().expiresAt() <= now);
    }

    int size() {
        return counters.size();
    }

    int lockCount() {
        return stripes.length;
    }

    private long valueAt(String key, long now) {
        var counter = counters.get(key);
        if (counter == null) {
            return 0;
        }
        if (counter.expiresAt() <= now) {
            counters.remove(key, counter);
            return 0;
        }
        return counter.value();
    }

    private record Counter(long value, long expiresAt) {
    }
}
