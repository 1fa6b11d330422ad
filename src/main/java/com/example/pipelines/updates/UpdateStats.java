package com.example.pipelines.updates;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of the update engine's counters. {@code lastUpdateTime} is null until the first
 * refresh cycle finishes; callers use it to spot stale subscriptions.
 */
public record UpdateStats(int activeSubscriptions,
                          long totalUpdatesReceived,
                          Instant lastUpdateTime,
                          boolean backgroundRefreshActive,
                          Duration pollingInterval,
                          double averageResponseTimeMillis,
                          long errorCount) {}
