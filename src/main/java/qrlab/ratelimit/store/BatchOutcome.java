package qrlab.ratelimit.store;

import java.util.List;

/**
 * Result of {@link CounterStore#incrementIfAllBelow}.
 *
 * @param applied      true when every counter was incremented
 * @param blockedIndex index of the first counter at or over its limit, -1 when applied
 * @param counts       one value per counter, in request order: after the increment when applied,
 *                     the untouched current values otherwise
 */
public record BatchOutcome(boolean applied, int blockedIndex, List<Long> counts) {

    public BatchOutcome {
        counts = List.copyOf(counts);
        if (applied != (blockedIndex < 0)) throw new IllegalArgumentException("applied and blockedIndex disagree");
    }

    public static BatchOutcome applied(List<Long> counts) {
        return new BatchOutcome(true, -1, counts);
    }

    public static BatchOutcome blocked(int index, List<Long> counts) {
        return new BatchOutcome(false, index, counts);
    }
}
