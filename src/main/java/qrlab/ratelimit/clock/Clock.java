package qrlab.ratelimit.clock;

/**
 * Wall-clock time source. Injected so window arithmetic can be tested without sleeping.
 */
public interface Clock {

    long nowMillis();

    default long epochSeconds() {
        return Math.floorDiv(nowMillis(), 1000L);
    }
}
