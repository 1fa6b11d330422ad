package com.example.pipelines.updates;

import com.example.pipelines.model.PipelineRun;
import com.example.pipelines.model.RunResult;
import com.example.pipelines.model.RunState;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;

public final class RunSubscription {

    /** The part of a run that change detection compares. */
    public record Observation(RunState state, RunResult result) {
        static Observation of(PipelineRun run) {
            return new Observation(run.state(), run.result());
        }
    }

    private final RunSubscriptionKey key;
    private volatile Consumer<PipelineRun> callback;
    private volatile long registrationId;
    private volatile SubscriptionState state = SubscriptionState.ACTIVE;
    private volatile Instant lastUpdated;
    private volatile Observation lastObserved;

    // Guarded by this subscription's monitor.
    private long lastAppliedSequence;

    RunSubscription(RunSubscriptionKey key, Consumer<PipelineRun> callback, long registrationId, Instant now) {
        this.key = Objects.requireNonNull(key);
        this.callback = Objects.requireNonNull(callback);
        this.registrationId = registrationId;
        this.lastUpdated = now;
    }

    public RunSubscriptionKey key() { return key; }
    public Consumer<PipelineRun> callback() { return callback; }
    public long registrationId() { return registrationId; }
    public SubscriptionState state() { return state; }
    public boolean isActive() { return state == SubscriptionState.ACTIVE; }
    public Instant lastUpdated() { return lastUpdated; }
    public Observation lastObserved() { return lastObserved; }

    void replaceCallback(Consumer<PipelineRun> newCallback, long newRegistrationId, Instant now) {
        this.callback = Objects.requireNonNull(newCallback);
        this.registrationId = newRegistrationId;
        this.lastUpdated = now;
    }

    void recordObservation(Observation observation, Instant now) {
        this.lastObserved = observation;
        this.lastUpdated = now;
    }

    /** Accepts a fetch result only if it was issued after the last one applied. */
    boolean advanceSequence(long sequence) {
        if (sequence <= lastAppliedSequence) {
            return false;
        }
        lastAppliedSequence = sequence;
        return true;
    }

    void retire() {
        state = SubscriptionState.RETIRED;
    }
}
