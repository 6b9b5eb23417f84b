package qrlab.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qrlab.CounterStoreUnavailableException;
import qrlab.ratelimit.clock.Clock;
import qrlab.ratelimit.clock.SystemClock;
import qrlab.ratelimit.store.CounterSpec;
import qrlab.ratelimit.store.CounterStore;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tiered fixed-window limiter: every caller gets a minute, an hour and a day counter, all three must be
 * under their caps for a request to pass, and a passing request bumps all three at once.
 *
 * <p>Windows are aligned to the epoch, so a caller can spend a full window's quota on each side of a
 * boundary.
 *
 * <p>When the counter store is down the limiter fails open: requests are allowed and flagged with
 * {@code limiterEnabled=false}.
 *
 * <p>Thread safe. Atomicity of the check and the increments is delegated to {@link CounterStore}.
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    public static final String KEY_PREFIX = "rate_limit:";

    private static final Window[] WINDOWS = {Window.MINUTE, Window.HOUR, Window.DAY};

    private final CounterStore store;
    private final Clock clock;

    public RateLimiter(CounterStore store, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.clock = clock;
    }

    public RateLimiter(CounterStore store) {
        this(store, SystemClock.instance());
    }

    public RateLimitDecision isAllowed(String identifier, Tier tier) {
        return isAllowed(identifier, tier, null);
    }

    /** Same as {@link #isAllowed(String, Tier, String)} with the tier looked up by name. */
    public RateLimitDecision isAllowed(String identifier, String tierName, String endpoint) {
        return isAllowed(identifier, Tier.fromName(tierName), endpoint);
    }

    /**
     * Checks minute, hour and day in that order. The first window at or over its cap decides the rejection,
     * so a minute block is reported even when the hour is exhausted too.
     *
     * @param endpoint optional, gives the endpoint its own set of counters
     */
    public RateLimitDecision isAllowed(String identifier, Tier tier, String endpoint) {
        requireIdentifier(identifier);
        var limits = limitsFor(tier);
        long now = clock.epochSeconds();

        var specs = new ArrayList<CounterSpec>(WINDOWS.length);
        for (var window : WINDOWS) {
            specs.add(new CounterSpec(key(identifier, window, window.bucket(now), endpoint),
                    limits.limit(window), window.length()));
        }

        try {
            var outcome = store.incrementIfAllBelow(identifier, specs);
            var counts = new EnumMap<Window, Long>(Window.class);
            for (int i = 0; i < WINDOWS.length; i++) {
                counts.put(WINDOWS[i], outcome.counts().get(i));
            }
            if (!outcome.applied()) {
                var window = WINDOWS[outcome.blockedIndex()];
                log.debug("{} blocked by {} limit {}", identifier, window.wireName(), limits.limit(window));
                return RateLimitDecision.blocked(window, limits, now, counts);
            }
            long remaining = Long.MAX_VALUE;
            for (var window : WINDOWS) {
                remaining = Math.min(remaining, limits.limit(window) - counts.get(window));
            }
            return RateLimitDecision.allowed(limits, remaining, now, counts);
        } catch (CounterStoreUnavailableException e) {
            log.warn("rate limiting disabled for {}: {}", identifier, e.getMessage());
            return RateLimitDecision.failOpen(limits, now);
        }
    }

    public UsageStats usageStats(String identifier, Tier tier) {
        return usageStats(identifier, tier, null);
    }

    /**
     * Reads the three counters without counting a request.
     *
     * @throws CounterStoreUnavailableException when the store cannot be reached
     */
    public UsageStats usageStats(String identifier, Tier tier, String endpoint) {
        requireIdentifier(identifier);
        var limits = limitsFor(tier);
        long now = clock.epochSeconds();
        Map<Window, Long> usage = new EnumMap<>(Window.class);
        Map<Window, Long> remaining = new EnumMap<>(Window.class);
        Map<Window, Long> resets = new EnumMap<>(Window.class);
        for (var window : WINDOWS) {
            long count = store.get(key(identifier, window, window.bucket(now), endpoint));
            usage.put(window, count);
            remaining.put(window, Math.max(0, limits.limit(window) - count));
            resets.put(window, window.nextBoundary(now));
        }
        return new UsageStats(tier == null ? Tier.FREE : tier, limits, usage, remaining, resets);
    }

    /**
     * Clears every counter of the identifier, across windows and endpoints. Whether the caller may do this
     * is decided outside, see {@link Tier#canResetLimits()}.
     *
     * @return false when the store could not be reached
     */
    public boolean reset(String identifier) {
        requireIdentifier(identifier);
        try {
            long removed = store.deleteByPrefix(KEY_PREFIX + identifier + ":");
            log.info("reset {} counters of {}", removed, identifier);
            return true;
        } catch (CounterStoreUnavailableException e) {
            log.warn("reset of {} failed: {}", identifier, e.getMessage());
            return false;
        }
    }

    public boolean isStoreAvailable() {
        return store.ping();
    }

    /** Unknown (null) tiers get the free limits. */
    public TierLimits limitsFor(Tier tier) {
        return (tier == null ? Tier.FREE : tier).limits();
    }

    /** {@code rate_limit:{identifier}:{window}:{bucket}[:{endpoint}]} */
    static String key(String identifier, Window window, long bucket, String endpoint) {
        var key = KEY_PREFIX + identifier + ":" + window.wireName() + ":" + bucket;
        return endpoint == null || endpoint.isEmpty() ? key : key + ":" + endpoint;
    }

    private static void requireIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("identifier cannot be empty");
        }
    }
}
