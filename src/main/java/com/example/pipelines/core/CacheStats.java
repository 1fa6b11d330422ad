package com.example.pipelines.core;

public record CacheStats(int size, long hits, long misses, double hitRate) {

    static CacheStats of(int size, long hits, long misses) {
        long total = hits + misses;
        return new CacheStats(size, hits, misses, total > 0 ? (double) hits / total : 0.0);
    }
}
