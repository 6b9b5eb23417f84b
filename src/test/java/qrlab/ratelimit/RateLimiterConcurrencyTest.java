package qrlab.ratelimit;

import org.junit.jupiter.api.Test;
import qrlab.ratelimit.clock.ManualClock;
import qrlab.ratelimit.store.InMemoryCounterStore;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterConcurrencyTest {

    private static int admitted(RateLimiter limiter, String id, int threads) throws InterruptedException {
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threads);
        AtomicInteger allowed = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    if (limiter.isAllowed(id, Tier.FREE).allowed()) {
                        allowed.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "Executor did not terminate");
        return allowed.get();
    }

    @Test
    void testConcurrent_exactlyMinuteCapAdmitted() throws InterruptedException {
        var clock = ManualClock.atEpochSecond(1_699_999_200L);
        var limiter = new RateLimiter(new InMemoryCounterStore(clock), clock);

        assertEquals(10, admitted(limiter, "user:race", 50));
        assertEquals(10L, limiter.usageStats("user:race", Tier.FREE).currentUsage().get(Window.HOUR),
                "rejected requests leave every window untouched");
    }

    @Test
    void testConcurrent_identifiersDoNotInterfere() throws InterruptedException {
        var clock = ManualClock.atEpochSecond(1_699_999_200L);
        var limiter = new RateLimiter(new InMemoryCounterStore(clock), clock);

        assertEquals(10, admitted(limiter, "user:a", 30));
        assertEquals(10, admitted(limiter, "user:b", 30));
    }
}
