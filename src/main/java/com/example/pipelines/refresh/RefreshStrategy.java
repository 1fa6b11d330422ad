package com.example.pipelines.refresh;

import com.example.pipelines.core.CacheService;

import java.time.Duration;
import java.util.function.Supplier;

public interface RefreshStrategy {
    /**
     * Returns the cached value for {@code key}, or loads it with {@code recomputeFn}, stores it
     * for {@code ttl} and returns it. Loader failures propagate and leave the cache untouched.
     */
    <T> T get(String key, Supplier<T> recomputeFn, CacheService cache, Duration ttl);
}
