package qrlab.ratelimit.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import qrlab.CounterStoreUnavailableException;
import qrlab.ratelimit.RateLimiter;
import qrlab.ratelimit.Tier;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RedisCounterStoreOfflineTest {

    // nothing listens on port 1
    private final RedisCounterStore store = new RedisCounterStore("redis://localhost:1", Duration.ofMillis(300));

    @AfterEach
    void close() {
        store.close();
    }

    @Test
    void testUnreachableServer() {
        assertFalse(store.ping());
        assertThrows(CounterStoreUnavailableException.class, () -> store.incrementIfAllBelow("x",
                List.of(new CounterSpec("x:minute", 10, Duration.ofSeconds(60)))));
        assertThrows(CounterStoreUnavailableException.class, () -> store.get("x:minute"));
    }

    @Test
    void testLimiterFailsOpen() {
        var decision = new RateLimiter(store).isAllowed("user:offline", Tier.PRO);

        assertTrue(decision.allowed());
        assertFalse(decision.limiterEnabled());
        assertEquals(60, decision.limit());
    }

    @Test
    void testScriptReply() {
        var applied = RedisCounterStore.toOutcome(List.<Object>of(0L, 3L, 7L), 2);
        assertTrue(applied.applied());
        assertEquals(List.of(3L, 7L), applied.counts());

        var blocked = RedisCounterStore.toOutcome(List.<Object>of(2L, 3L, 100L), 2);
        assertEquals(1, blocked.blockedIndex());

        assertThrows(IllegalStateException.class, () -> RedisCounterStore.toOutcome(List.<Object>of(0L), 2));
    }

    @Test
    void testEscapeGlob() {
        assertEquals("rate_limit:a\\*b\\?\\[c\\]:", RedisCounterStore.escapeGlob("rate_limit:a*b?[c]:"));
    }
}
