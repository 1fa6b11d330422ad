package com.example.pipelines.refresh;

import com.example.pipelines.core.CacheService;
import com.example.pipelines.eviction.LruEvictionStrategy;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CoalescingRefreshStrategyTest {

    private final CacheService cache =
            new CacheService(new LruEvictionStrategy(), 10, Duration.ofMinutes(1), Clock.systemUTC());
    private final CoalescingRefreshStrategy strategy = new CoalescingRefreshStrategy();

    @Test
    void concurrentMissesShareOneLoad() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch loaderStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> strategy.get("hot", () -> {
                    loads.incrementAndGet();
                    loaderStarted.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return "value";
                }, cache, null)));
            }

            assertTrue(loaderStarted.await(5, TimeUnit.SECONDS));
            assertEquals(1, strategy.inFlightCount());
            release.countDown();

            for (Future<String> f : results) {
                assertEquals("value", f.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, loads.get());
        assertEquals(0, strategy.inFlightCount());
    }

    @Test
    void failureIsPropagatedAndNextCallRetries() {
        IllegalStateException boom = new IllegalStateException("down");
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> strategy.get("k", () -> { throw boom; }, cache, null));
        assertSame(boom, thrown);
        assertEquals(0, strategy.inFlightCount());

        assertEquals("ok", strategy.get("k", () -> "ok", cache, null));
        assertEquals(1, cache.size());
    }

    @Test
    void cachedValueSkipsLoader() {
        cache.set("k", "cached");
        assertEquals("cached", strategy.get("k", () -> fail("loader should not run"), cache, null));
    }
}
