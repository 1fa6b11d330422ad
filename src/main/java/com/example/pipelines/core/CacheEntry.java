package com.example.pipelines.core;

public class CacheEntry<V> {
    public final V value;
    public final long expiryTime;   // absolute timestamp in millis when TTL expires

    public CacheEntry(V value, long expiryTime) {
        this.value = value;
        this.expiryTime = expiryTime;
    }

    public boolean isExpiredAt(long nowMillis) {
        return nowMillis > expiryTime;
    }
}
