package qrlab.ratelimit.store;

import java.time.Duration;
import java.util.Objects;

/**
 * One counter taking part in an {@link CounterStore#incrementIfAllBelow} batch.
 *
 * @param limit the batch is refused when the counter is already at or above this
 * @param ttl   expiry set on every increment
 */
public record CounterSpec(String key, long limit, Duration ttl) {

    public CounterSpec {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("ttl must be > 0");
    }
}
