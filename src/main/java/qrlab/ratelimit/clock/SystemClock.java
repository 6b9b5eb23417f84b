package qrlab.ratelimit.clock;

/**
 * Real wall clock, {@link System#currentTimeMillis()}. Windows are calendar aligned, so a monotonic
 * source would not do here.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    public static SystemClock instance() {
        return INSTANCE;
    }

    private SystemClock() {
    }

    @Override
    public long nowMillis() {
        return System.currentTimeMillis();
    }
}
