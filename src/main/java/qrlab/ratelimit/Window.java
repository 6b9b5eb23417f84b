package qrlab.ratelimit;

import java.time.Duration;
import java.util.Locale;

/**
 * Fixed, epoch-aligned counting window. Bucket {@code n} covers {@code [n * seconds, (n + 1) * seconds)}.
 */
public enum Window {
    MINUTE(60),
    HOUR(3_600),
    DAY(86_400);

    private final long seconds;

    Window(long seconds) {
        this.seconds = seconds;
    }

    public long seconds() {
        return seconds;
    }

    public Duration length() {
        return Duration.ofSeconds(seconds);
    }

    public long bucket(long epochSeconds) {
        return Math.floorDiv(epochSeconds, seconds);
    }

    /** first second of the next bucket */
    public long nextBoundary(long epochSeconds) {
        return (bucket(epochSeconds) + 1) * seconds;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
