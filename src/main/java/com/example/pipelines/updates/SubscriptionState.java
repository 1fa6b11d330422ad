package com.example.pipelines.updates;

/**
 * Liveness of a run subscription slot. A RETIRED slot still exists (and still counts against
 * capacity) but is no longer polled; only disposing the handle removes it.
 */
public enum SubscriptionState {
    ACTIVE,
    RETIRED
}
