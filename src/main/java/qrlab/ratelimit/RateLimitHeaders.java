package qrlab.ratelimit;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP response headers describing a decision.
 */
public final class RateLimitHeaders {

    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";
    public static final String RETRY_AFTER = "Retry-After";
    public static final String STATUS = "X-RateLimit-Status";
    public static final String REASON = "X-RateLimit-Reason";
    public static final String COUNT_PREFIX = "X-RateLimit-Count-";

    private RateLimitHeaders() {
    }

    public static Map<String, String> of(RateLimitDecision decision) {
        var headers = new LinkedHashMap<String, String>();
        if (!decision.limiterEnabled()) {
            headers.put(STATUS, "disabled");
            headers.put(REASON, "store-unavailable");
            return headers;
        }
        headers.put(LIMIT, Long.toString(decision.limit()));
        headers.put(REMAINING, Long.toString(decision.remaining()));
        headers.put(RESET, Long.toString(decision.resetTime()));
        if (!decision.allowed()) {
            decision.retryAfter().ifPresent(seconds -> headers.put(RETRY_AFTER, Long.toString(seconds)));
            return headers;
        }
        for (var window : Window.values()) {
            var count = decision.counts().get(window);
            if (count != null) {
                headers.put(COUNT_PREFIX + capitalize(window.wireName()), Long.toString(count));
            }
        }
        return headers;
    }

    private static String capitalize(String word) {
        return Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }
}
