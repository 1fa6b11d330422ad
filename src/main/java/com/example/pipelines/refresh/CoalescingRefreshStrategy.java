package com.example.pipelines.refresh;

import com.example.pipelines.core.CacheService;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Read-through where concurrent misses for the same key share one load. The first caller
 * runs the loader on its own thread; later callers wait for its outcome.
 */
public class CoalescingRefreshStrategy implements RefreshStrategy {

    private final ConcurrentHashMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(String key, Supplier<T> recomputeFn, CacheService cache, Duration ttl) {
        Optional<T> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            return (T) await(existing);
        }

        try {
            T value = recomputeFn.get();
            cache.set(key, value, ttl);
            mine.complete(value);
            return value;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /** Number of loads currently shared by waiters. */
    public int inFlightCount() {
        return inFlight.size();
    }

    private static Object await(CompletableFuture<Object> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }
}
