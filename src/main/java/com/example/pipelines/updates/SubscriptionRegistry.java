package com.example.pipelines.updates;

import com.example.pipelines.model.PipelineRun;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Run-level and pipeline-level subscriptions.
 *
 * <p>Not thread-safe: {@link RealTimeUpdateService} guards every call with its state lock so
 * that registry changes and timer start/stop decisions happen atomically.
 *
 * <p>Two counts are exposed. {@link #totalCount()} counts every slot, retired ones included;
 * {@link #polledCount()} counts only what a refresh cycle actually fetches.
 */
class SubscriptionRegistry {

    private final Map<RunSubscriptionKey, RunSubscription> runs = new LinkedHashMap<>();
    private final Map<PipelineSubscriptionKey, Set<Consumer<List<PipelineRun>>>> pipelines = new LinkedHashMap<>();

    /**
     * Registers {@code callback} for {@code key}. An ACTIVE slot for the same key keeps its
     * identity and takes the new callback; a RETIRED slot is replaced by a fresh subscription.
     * Neither case counts against capacity since no slot is added.
     *
     * @throws SubscriptionCapacityExceededException when a new slot would exceed {@code maxSlots}
     */
    RunSubscription registerRun(RunSubscriptionKey key,
                                Consumer<PipelineRun> callback,
                                long registrationId,
                                int maxSlots,
                                Instant now) {
        RunSubscription existing = runs.get(key);
        if (existing != null && existing.isActive()) {
            existing.replaceCallback(callback, registrationId, now);
            return existing;
        }
        if (existing == null && runs.size() >= maxSlots) {
            throw new SubscriptionCapacityExceededException(maxSlots);
        }
        RunSubscription created = new RunSubscription(key, callback, registrationId, now);
        runs.put(key, created);
        return created;
    }

    /**
     * Removes the slot only while it still belongs to {@code registrationId}, so a stale
     * handle cannot drop a subscription that a later caller took over.
     */
    boolean removeRun(RunSubscriptionKey key, long registrationId) {
        RunSubscription existing = runs.get(key);
        if (existing == null || existing.registrationId() != registrationId) {
            return false;
        }
        runs.remove(key);
        return true;
    }

    boolean isRegistered(RunSubscription subscription) {
        return runs.get(subscription.key()) == subscription;
    }

    Optional<RunSubscription> findRun(RunSubscriptionKey key) {
        return Optional.ofNullable(runs.get(key));
    }

    List<RunSubscription> activeRunSubscriptions() {
        List<RunSubscription> out = new ArrayList<>(runs.size());
        for (RunSubscription s : runs.values()) {
            if (s.isActive()) {
                out.add(s);
            }
        }
        return out;
    }

    void registerPipeline(PipelineSubscriptionKey key, Consumer<List<PipelineRun>> callback) {
        pipelines.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(callback);
    }

    /** Drops the callback and the whole key once its last callback is gone. */
    boolean removePipeline(PipelineSubscriptionKey key, Consumer<List<PipelineRun>> callback) {
        Set<Consumer<List<PipelineRun>>> callbacks = pipelines.get(key);
        if (callbacks == null || !callbacks.remove(callback)) {
            return false;
        }
        if (callbacks.isEmpty()) {
            pipelines.remove(key);
        }
        return true;
    }

    List<PipelineSubscriptionKey> pipelineKeys() {
        return new ArrayList<>(pipelines.keySet());
    }

    List<Consumer<List<PipelineRun>>> pipelineCallbacks(PipelineSubscriptionKey key) {
        Set<Consumer<List<PipelineRun>>> callbacks = pipelines.get(key);
        return callbacks == null ? List.of() : new ArrayList<>(callbacks);
    }

    int runSlotCount() {
        return runs.size();
    }

    int activeRunCount() {
        int n = 0;
        for (RunSubscription s : runs.values()) {
            if (s.isActive()) n++;
        }
        return n;
    }

    int pipelineKeyCount() {
        return pipelines.size();
    }

    int totalCount() {
        return runs.size() + pipelines.size();
    }

    int polledCount() {
        return activeRunCount() + pipelines.size();
    }

    boolean isEmpty() {
        return runs.isEmpty() && pipelines.isEmpty();
    }

    void clear() {
        runs.clear();
        pipelines.clear();
    }
}
