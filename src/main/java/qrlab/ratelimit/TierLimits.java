package qrlab.ratelimit;

public record TierLimits(long perMinute, long perHour, long perDay) {

    public TierLimits {
        if (perMinute <= 0 || perHour <= 0 || perDay <= 0) throw new IllegalArgumentException("limits must be > 0");
    }

    public long limit(Window window) {
        switch (window) {
            case MINUTE:
                return perMinute;
            case HOUR:
                return perHour;
            case DAY:
                return perDay;
            default:
                throw new IllegalArgumentException("unknown window " + window);
        }
    }
}
