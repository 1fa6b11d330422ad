package com.example.pipelines.core;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Sweeps expired entries so stale data does not hold capacity until it is next read.
 */
@Component
public class CacheMaintenance {

    private final CacheService cacheService;

    public CacheMaintenance(CacheService cacheService) {
        this.cacheService = Objects.requireNonNull(cacheService);
    }

    @Scheduled(fixedDelayString = "${pipelines.cache.cleanup-interval:PT1M}")
    public void purgeExpired() {
        cacheService.purgeExpired();
    }
}
