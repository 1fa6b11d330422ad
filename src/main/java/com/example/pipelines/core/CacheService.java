package com.example.pipelines.core;

import com.example.pipelines.eviction.EvictionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Bounded in-memory cache with per-entry TTL and pluggable eviction.
 *
 * <p>Expiry is checked lazily on read. The entry map and the eviction strategy's recency
 * list always change together under a single lock, so a key is tracked by both or by neither.
 */
public class CacheService {
    private static final Logger log = LoggerFactory.getLogger(CacheService.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CacheEntry<Object>> store = new HashMap<>();
    private final EvictionStrategy evictionStrategy;
    private final int capacity;
    private final Duration defaultTtl;
    private final Clock clock;

    private long hits;
    private long misses;

    public CacheService(EvictionStrategy evictionStrategy, int capacity, Duration defaultTtl, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        if (defaultTtl == null || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTtl must be non-negative");
        }
        this.evictionStrategy = Objects.requireNonNull(evictionStrategy);
        this.capacity = capacity;
        this.defaultTtl = defaultTtl;
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Returns the live value for {@code key}. Expired entries are dropped and count as a miss;
     * a hit promotes the key to most recently used.
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(String key) {
        lock.lock();
        try {
            CacheEntry<Object> entry = store.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (entry.isExpiredAt(clock.millis())) {
                removeLocked(key);
                misses++;
                return Optional.empty();
            }
            evictionStrategy.onHit(key);
            hits++;
            return Optional.of((T) entry.value);
        } finally {
            lock.unlock();
        }
    }

    public void set(String key, Object value) {
        set(key, value, defaultTtl);
    }

    public void set(String key, Object value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be non-negative, got " + ttl);
        }
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        CacheEntry<Object> newEntry = new CacheEntry<>(value, expiryFor(effectiveTtl));

        lock.lock();
        try {
            CacheEntry<Object> previous = store.put(key, newEntry);
            evictionStrategy.onInsert(key);
            // Only a brand-new key can push the store past capacity, and only by one.
            if (previous == null && store.size() > capacity) {
                evictionStrategy.selectVictim().ifPresent(victimKey -> {
                    store.remove(victimKey);
                    log.debug("Evicted least recently used key {}", victimKey);
                });
            }
        } finally {
            lock.unlock();
        }
    }

    // Saturates at Long.MAX_VALUE for TTLs too large to add to the clock.
    private long expiryFor(Duration ttl) {
        try {
            return Math.addExact(clock.millis(), ttl.toMillis());
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    public void invalidate(String key) {
        lock.lock();
        try {
            removeLocked(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every key matching {@code filter}. Linear in the number of entries, which is
     * bounded by capacity.
     *
     * @return number of entries removed
     */
    public int invalidateMatching(Predicate<String> filter) {
        lock.lock();
        try {
            List<String> matches = new ArrayList<>();
            for (String key : store.keySet()) {
                if (filter.test(key)) {
                    matches.add(key);
                }
            }
            matches.forEach(this::removeLocked);
            return matches.size();
        } finally {
            lock.unlock();
        }
    }

    public int invalidateByPrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        return invalidateMatching(key -> key.startsWith(prefix));
    }

    /** Drops all entries and resets the hit/miss counters. */
    public void clear() {
        lock.lock();
        try {
            store.clear();
            evictionStrategy.clear();
            hits = 0;
            misses = 0;
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return CacheStats.of(store.size(), hits, misses);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Entry with its expiry metadata. Does not touch hit/miss counters or recency, but an
     * expired entry is still removed.
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<CacheEntry<T>> getEntry(String key) {
        lock.lock();
        try {
            CacheEntry<Object> entry = store.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpiredAt(clock.millis())) {
                removeLocked(key);
                return Optional.empty();
            }
            return Optional.of((CacheEntry<T>) entry);
        } finally {
            lock.unlock();
        }
    }

    /** True when the key is absent or past its expiry. */
    public boolean isExpired(String key) {
        lock.lock();
        try {
            CacheEntry<Object> entry = store.get(key);
            return entry == null || entry.isExpiredAt(clock.millis());
        } finally {
            lock.unlock();
        }
    }

    /** @return number of expired entries removed */
    public int purgeExpired() {
        long now = clock.millis();
        int removed = invalidateMatching(key -> store.get(key).isExpiredAt(now));
        if (removed > 0) {
            log.debug("Purged {} expired cache entries", removed);
        }
        return removed;
    }

    public int size() {
        lock.lock();
        try {
            return store.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    public void dispose() {
        clear();
    }

    private void removeLocked(String key) {
        if (store.remove(key) != null) {
            evictionStrategy.onRemove(key);
        }
    }
}
