package qrlab.ratelimit;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Answer to one rate-limit check.
 *
 * @param limitType      window that blocked the request, or {@link Window#MINUTE} when allowed
 * @param limit          cap of {@code limitType}
 * @param remaining      0 when blocked, otherwise the smallest headroom left across the three windows
 * @param resetTime      epoch second at which {@code limitType} starts a new bucket
 * @param retryAfter     seconds until {@code resetTime}, present only when blocked
 * @param counts         counter values per window after this request, empty when failing open
 * @param limiterEnabled false when the store was unreachable and the request was let through unchecked
 */
public record RateLimitDecision(
        boolean allowed,
        Window limitType,
        long limit,
        long remaining,
        long resetTime,
        OptionalLong retryAfter,
        Map<Window, Long> counts,
        boolean limiterEnabled
) {

    public RateLimitDecision {
        Objects.requireNonNull(limitType, "limitType");
        Objects.requireNonNull(retryAfter, "retryAfter");
        counts = Map.copyOf(counts);
    }

    static RateLimitDecision allowed(TierLimits limits, long remaining, long now, Map<Window, Long> counts) {
        return new RateLimitDecision(true, Window.MINUTE, limits.perMinute(), remaining,
                Window.MINUTE.nextBoundary(now), OptionalLong.empty(), counts, true);
    }

    static RateLimitDecision blocked(Window window, TierLimits limits, long now, Map<Window, Long> counts) {
        var reset = window.nextBoundary(now);
        return new RateLimitDecision(false, window, limits.limit(window), 0, reset,
                OptionalLong.of(reset - now), counts, true);
    }

    static RateLimitDecision failOpen(TierLimits limits, long now) {
        return new RateLimitDecision(true, Window.MINUTE, limits.perMinute(), limits.perMinute(),
                Window.MINUTE.nextBoundary(now), OptionalLong.empty(), Map.of(), false);
    }
}
