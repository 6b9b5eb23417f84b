package qrlab.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Subscription tiers and their request caps. Assigning a tier to a caller is someone else's job.
 */
public enum Tier {
    FREE(new TierLimits(10, 100, 1_000), "Free tier with basic rate limits for personal use"),
    PRO(new TierLimits(60, 1_000, 10_000), "Pro tier with increased limits for professionals"),
    BUSINESS(new TierLimits(120, 5_000, 50_000), "Business tier with high limits for growing businesses"),
    ENTERPRISE(new TierLimits(300, 20_000, 200_000), "Enterprise tier with maximum limits and priority support");

    private static final Logger log = LoggerFactory.getLogger(Tier.class);

    private final TierLimits limits;
    private final String description;

    Tier(TierLimits limits, String description) {
        this.limits = limits;
        this.description = description;
    }

    public TierLimits limits() {
        return limits;
    }

    public String description() {
        return description;
    }

    /** Only enterprise callers may clear their own counters. The limiter itself does not check this. */
    public boolean canResetLimits() {
        return this == ENTERPRISE;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup. Null, blank and unknown names resolve to {@link #FREE}.
     */
    public static Tier fromName(String name) {
        if (name == null || name.isBlank()) {
            return FREE;
        }
        for (var tier : values()) {
            if (tier.wireName().equalsIgnoreCase(name.trim())) {
                return tier;
            }
        }
        log.warn("unknown tier '{}', using {}", name, FREE.wireName());
        return FREE;
    }
}
