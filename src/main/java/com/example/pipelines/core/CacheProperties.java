package com.example.pipelines.core;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration for the in-memory pipeline data cache.
 */
@ConfigurationProperties(prefix = "pipelines.cache")
public class CacheProperties {

    /** When false, reads always go to the gateway and nothing is stored. */
    private boolean enabled = true;

    /** TTL applied when a caller does not pass one. */
    private Duration defaultTtl = Duration.ofMinutes(5);

    /** Maximum number of entries before LRU eviction kicks in. */
    private int maxSize = 1000;

    /** Read-through strategy: "naive" or "coalescing". */
    private String refreshStrategy = "coalescing";

    /** How often expired entries are swept proactively. */
    private Duration cleanupInterval = Duration.ofMinutes(1);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public void setMaxSize(int maxSize) {
        this.maxSize = maxSize;
    }

    public String getRefreshStrategy() {
        return refreshStrategy;
    }

    public void setRefreshStrategy(String refreshStrategy) {
        this.refreshStrategy = refreshStrategy;
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public void setCleanupInterval(Duration cleanupInterval) {
        this.cleanupInterval = cleanupInterval;
    }
}
