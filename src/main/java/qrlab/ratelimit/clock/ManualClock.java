package qrlab.ratelimit.clock;

public final class ManualClock implements Clock {
    private volatile long now;

    public ManualClock(long startMillis) {
        this.now = startMillis;
    }

    public static ManualClock atEpochSecond(long epochSecond) {
        return new ManualClock(epochSecond * 1000L);
    }

    @Override
    public long nowMillis() {
        return now;
    }

    public void advanceMillis(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now += delta;
    }

    public void advanceSeconds(long delta) {
        advanceMillis(delta * 1000L);
    }

    public void setMillis(long value) {
        now = value;
    }
}
