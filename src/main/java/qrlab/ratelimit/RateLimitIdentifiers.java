package qrlab.ratelimit;

/**
 * Identifier conventions: signed-in callers are limited per user, anonymous ones per client address.
 */
public final class RateLimitIdentifiers {

    private RateLimitIdentifiers() {
    }

    public static String user(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be blank");
        }
        return "user:" + userId;
    }

    /** Unknown addresses share the {@code ip:unknown} bucket. */
    public static String ip(String address) {
        return "ip:" + (address == null || address.isBlank() ? "unknown" : address);
    }
}
