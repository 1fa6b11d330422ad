package com.example.pipelines.refresh;

import com.example.pipelines.core.CacheService;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

public class NaiveTtlRefreshStrategy implements RefreshStrategy {

    @Override
    public <T> T get(String key, Supplier<T> recomputeFn, CacheService cache, Duration ttl) {
        Optional<T> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        T value = recomputeFn.get();
        cache.set(key, value, ttl);
        return value;
    }
}
