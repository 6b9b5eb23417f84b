package qrlab.ratelimit;

import java.util.Map;

/**
 * Snapshot of a caller's counters. Reading it does not count as a request.
 */
public record UsageStats(
        Tier tier,
        TierLimits limits,
        Map<Window, Long> currentUsage,
        Map<Window, Long> remaining,
        Map<Window, Long> resetTimes
) {

    public UsageStats {
        currentUsage = Map.copyOf(currentUsage);
        remaining = Map.copyOf(remaining);
        resetTimes = Map.copyOf(resetTimes);
    }
}
