package com.example.pipelines.eviction;

import java.util.Optional;

/**
 * Recency bookkeeping for a bounded cache. Implementations are not thread-safe; the owning
 * cache mutates them under the same lock that guards its entry map.
 */
public interface EvictionStrategy {
    void onHit(String key);
    void onInsert(String key);
    void onRemove(String key);

    /** Picks and forgets the next victim, or empty when nothing is tracked. */
    Optional<String> selectVictim();

    void clear();
    int size();
}
