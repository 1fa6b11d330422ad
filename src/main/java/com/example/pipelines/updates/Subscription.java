package com.example.pipelines.updates;

/**
 * Handle returned by the subscribe calls. Disposing is idempotent. For a run subscription no
 * callback runs once it returns; a pipeline subscription stops with the next fetch.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void dispose();

    @Override
    default void close() {
        dispose();
    }
}
