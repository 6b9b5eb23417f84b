package qrlab.ratelimit.store;

import io.lettuce.core.RedisClient;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import qrlab.ratelimit.RateLimiter;
import qrlab.ratelimit.Tier;
import qrlab.ratelimit.clock.ManualClock;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class RedisCounterStoreTest {

    @Container
    static final GenericContainer<?> redis = new GenericContainer<>("redis:7").withExposedPorts(6379);

    private static RedisCounterStore store;

    @BeforeAll
    static void connect() {
        store = new RedisCounterStore("redis://" + redis.getHost() + ":" + redis.getMappedPort(6379),
                Duration.ofSeconds(2));
    }

    @AfterAll
    static void close() {
        store.close();
    }

    private static List<CounterSpec> batch(String prefix, long minuteCap, long hourCap) {
        return List.of(
                new CounterSpec(prefix + ":minute", minuteCap, Duration.ofSeconds(60)),
                new CounterSpec(prefix + ":hour", hourCap, Duration.ofSeconds(3600)));
    }

    @Test
    void testPing() {
        assertTrue(store.ping());
    }

    @Test
    void testBatchIsAppliedAtomically() {
        assertEquals(List.of(1L, 1L), store.incrementIfAllBelow("t1", batch("t1", 5, 2)).counts());
        assertEquals(List.of(2L, 2L), store.incrementIfAllBelow("t1", batch("t1", 5, 2)).counts());

        var outcome = store.incrementIfAllBelow("t1", batch("t1", 5, 2));

        assertFalse(outcome.applied());
        assertEquals(1, outcome.blockedIndex());
        assertEquals(List.of(2L, 2L), outcome.counts());
        assertEquals(2, store.get("t1:minute"), "blocked batch leaves the minute counter alone");
    }

    @Test
    void testMissingKeyReadsZero() {
        assertEquals(0, store.get("t2:never-written"));
    }

    @Test
    void testTtlIsSet() {
        store.incrementIfAllBelow("t3", batch("t3", 5, 5));

        var client = RedisClient.create("redis://" + redis.getHost() + ":" + redis.getMappedPort(6379));
        try (var connection = client.connect()) {
            long ttl = connection.sync().ttl("t3:hour");
            assertTrue(ttl > 3500 && ttl <= 3600, "ttl " + ttl);
        } finally {
            client.shutdown();
        }
    }

    @Test
    void testDeleteByPrefix() {
        store.incrementIfAllBelow("u", batch("rate_limit:u:1", 9, 9));
        store.incrementIfAllBelow("u", batch("rate_limit:u:10", 9, 9));
        store.incrementIfAllBelow("u", batch("rate_limit:u*:1", 9, 9));

        assertEquals(2, store.deleteByPrefix("rate_limit:u:1:"));
        assertEquals(0, store.get("rate_limit:u:1:minute"));
        assertEquals(1, store.get("rate_limit:u:10:minute"));
        assertEquals(2, store.deleteByPrefix("rate_limit:u*:"), "glob characters are literal");
        assertEquals(1, store.get("rate_limit:u:10:hour"));
    }

    @Test
    void testConcurrentLimiterAdmitsExactlyTheCap() throws InterruptedException {
        var limiter = new RateLimiter(store, ManualClock.atEpochSecond(1_699_999_200L));
        int threads = 50;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threads);
        AtomicInteger allowed = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    if (limiter.isAllowed("user:redis-race", Tier.FREE).allowed()) {
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
        assertTrue(doneLatch.await(20, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "Executor did not terminate");

        assertEquals(10, allowed.get());
        assertTrue(limiter.reset("user:redis-race"));
        assertTrue(limiter.isAllowed("user:redis-race", Tier.FREE).allowed());
    }
}
