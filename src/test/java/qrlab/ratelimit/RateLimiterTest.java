package qrlab.ratelimit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import qrlab.CounterStoreUnavailableException;
import qrlab.ratelimit.clock.ManualClock;
import qrlab.ratelimit.store.CounterStore;
import qrlab.ratelimit.store.InMemoryCounterStore;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RateLimiterTest {

    /** 2023-11-14T22:00:00Z, aligned to minute and hour */
    private static final long T0 = 1_699_999_200L;

    private ManualClock clock;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = ManualClock.atEpochSecond(T0);
        limiter = new RateLimiter(new InMemoryCounterStore(clock), clock);
    }

    private void spend(String id, int requests) {
        for (int i = 0; i < requests; i++) {
            assertTrue(limiter.isAllowed(id, Tier.FREE).allowed(), "request " + (i + 1) + " should pass");
        }
    }

    @Test
    void testFirstRequest() {
        var decision = limiter.isAllowed("user:1", Tier.FREE);

        assertTrue(decision.allowed());
        assertTrue(decision.limiterEnabled());
        assertEquals(Window.MINUTE, decision.limitType());
        assertEquals(10, decision.limit());
        assertEquals(9, decision.remaining(), "smallest headroom is the minute window");
        assertEquals(T0 + 60, decision.resetTime());
        assertEquals(OptionalLong.empty(), decision.retryAfter());
        assertEquals(1L, decision.counts().get(Window.DAY));
    }

    @Test
    void testMinuteLimit() {
        spend("user:1", 10);

        clock.advanceSeconds(15);
        var decision = limiter.isAllowed("user:1", Tier.FREE);

        assertFalse(decision.allowed(), "11th request in the minute is blocked");
        assertEquals(Window.MINUTE, decision.limitType());
        assertEquals(0, decision.remaining());
        assertEquals(T0 + 60, decision.resetTime());
        assertEquals(OptionalLong.of(45), decision.retryAfter());
        assertEquals(10L, decision.counts().get(Window.MINUTE), "blocked request is not counted");
    }

    @Test
    void testMinuteWindowRollsOver() {
        spend("user:1", 10);
        assertFalse(limiter.isAllowed("user:1", Tier.FREE).allowed());

        clock.advanceSeconds(60);

        var decision = limiter.isAllowed("user:1", Tier.FREE);
        assertTrue(decision.allowed());
        assertEquals(1L, decision.counts().get(Window.MINUTE));
        assertEquals(11L, decision.counts().get(Window.HOUR));
    }

    @Test
    void testHourLimit() {
        for (int minute = 0; minute < 10; minute++) {
            spend("user:1", 10);
            clock.advanceSeconds(60);
        }

        var decision = limiter.isAllowed("user:1", Tier.FREE);

        assertFalse(decision.allowed());
        assertEquals(Window.HOUR, decision.limitType());
        assertEquals(100, decision.limit());
        assertEquals(T0 + 3600, decision.resetTime());
        assertEquals(OptionalLong.of(3000), decision.retryAfter());
    }

    @Test
    void testMinuteReportedBeforeHour() {
        for (int minute = 0; minute < 10; minute++) {
            spend("user:1", 10);
            if (minute < 9) {
                clock.advanceSeconds(60);
            }
        }

        // minute and hour are both at their caps
        var decision = limiter.isAllowed("user:1", Tier.FREE);
        assertEquals(Window.MINUTE, decision.limitType());
        assertEquals(100L, decision.counts().get(Window.HOUR));
    }

    @Test
    void testTiersHaveOwnCaps() {
        for (int i = 0; i < 60; i++) {
            assertTrue(limiter.isAllowed("user:pro", Tier.PRO).allowed());
        }
        assertFalse(limiter.isAllowed("user:pro", Tier.PRO).allowed());
    }

    @Test
    void testEndpointsCountedSeparately() {
        for (int i = 0; i < 10; i++) {
            assertTrue(limiter.isAllowed("user:1", Tier.FREE, "/generate").allowed());
        }

        assertFalse(limiter.isAllowed("user:1", Tier.FREE, "/generate").allowed());
        assertTrue(limiter.isAllowed("user:1", Tier.FREE, "/decode").allowed());
        assertTrue(limiter.isAllowed("user:1", Tier.FREE).allowed());
    }

    @Test
    void testIdentifiersCountedSeparately() {
        spend("user:1", 10);
        assertTrue(limiter.isAllowed("user:2", Tier.FREE).allowed());
    }

    @Test
    void testUnknownTierNameGetsFreeLimits() {
        var decision = limiter.isAllowed("user:1", "gold", null);
        assertEquals(10, decision.limit());
        assertEquals(Tier.FREE.limits(), limiter.limitsFor(null));
    }

    @Test
    void testReset() {
        spend("user:1", 10);
        spend("user:10", 3);
        assertFalse(limiter.isAllowed("user:1", Tier.FREE).allowed());

        assertTrue(limiter.reset("user:1"));

        var decision = limiter.isAllowed("user:1", Tier.FREE);
        assertTrue(decision.allowed());
        assertEquals(1L, decision.counts().get(Window.DAY));
        assertEquals(3L, limiter.usageStats("user:10", Tier.FREE).currentUsage().get(Window.MINUTE),
                "prefix of another identifier is left alone");
    }

    @Test
    void testUsageStatsDoesNotCount() {
        spend("user:1", 3);
        clock.advanceSeconds(20);

        var stats = limiter.usageStats("user:1", Tier.FREE);
        limiter.usageStats("user:1", Tier.FREE);

        assertEquals(Tier.FREE, stats.tier());
        assertEquals(3L, stats.currentUsage().get(Window.MINUTE));
        assertEquals(7L, stats.remaining().get(Window.MINUTE));
        assertEquals(97L, stats.remaining().get(Window.HOUR));
        assertEquals(T0 + 60, stats.resetTimes().get(Window.MINUTE));
        assertEquals(T0 + 3600, stats.resetTimes().get(Window.HOUR));
        assertEquals(6, limiter.isAllowed("user:1", Tier.FREE).remaining());
    }

    @Test
    void testEmptyIdentifierRejected() {
        assertThrows(IllegalArgumentException.class, () -> limiter.isAllowed("", Tier.FREE));
        assertThrows(IllegalArgumentException.class, () -> limiter.reset(null));
    }

    @Test
    void testKeyLayout() {
        assertEquals("rate_limit:user:1:minute:28333320", RateLimiter.key("user:1", Window.MINUTE, 28333320, null));
        assertEquals("rate_limit:ip:1.2.3.4:day:19675:/decode",
                RateLimiter.key("ip:1.2.3.4", Window.DAY, 19675, "/decode"));
    }

    @Test
    void testFailsOpenWhenStoreIsDown() {
        var store = mock(CounterStore.class);
        var down = new CounterStoreUnavailableException("counter store unavailable: test", new RuntimeException("refused"));
        when(store.incrementIfAllBelow(anyString(), anyList())).thenThrow(down);
        when(store.deleteByPrefix(anyString())).thenThrow(down);
        when(store.get(any())).thenThrow(down);
        var offline = new RateLimiter(store, clock);

        var decision = offline.isAllowed("user:1", Tier.FREE);

        assertTrue(decision.allowed());
        assertFalse(decision.limiterEnabled());
        assertEquals(10, decision.remaining());
        assertTrue(decision.counts().isEmpty());
        assertFalse(offline.reset("user:1"));
        assertFalse(offline.isStoreAvailable());
        assertThrows(CounterStoreUnavailableException.class, () -> offline.usageStats("user:1", Tier.FREE));
    }
}
