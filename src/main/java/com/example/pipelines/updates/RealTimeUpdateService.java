package com.example.pipelines.updates;

import com.example.pipelines.model.PipelineRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Polls run and pipeline state on behalf of many subscribers.
 *
 * <p>A single background timer drives refresh cycles. Each cycle fetches every ACTIVE run
 * subscription and every pipeline subscription concurrently on the fetch executor and waits
 * for all of them to settle. A run subscription whose run reaches a terminal state is retired:
 * it keeps its slot but is no longer polled. Fetch failures are logged and counted, never
 * thrown to callers.
 *
 * <p>Locking: {@code stateLock} guards the registry, the timer handle and the configuration;
 * {@code tickLock} serializes refresh cycles. Callbacks never run under {@code stateLock}.
 */
public class RealTimeUpdateService {
    private static final Logger log = LoggerFactory.getLogger(RealTimeUpdateService.class);

    private final RunSource runSource;
    private final TaskScheduler scheduler;
    private final Executor fetchExecutor;
    private final Clock clock;

    private final ReentrantLock stateLock = new ReentrantLock();
    private final ReentrantLock tickLock = new ReentrantLock();
    private final SubscriptionRegistry registry = new SubscriptionRegistry();
    private final List<RunStatusChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong registrationSeq = new AtomicLong();
    private final AtomicLong fetchSeq = new AtomicLong();

    private UpdateConfiguration config;
    private ScheduledFuture<?> backgroundTimer;
    private volatile boolean disposed;

    private final AtomicLong totalUpdatesReceived = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private volatile double averageResponseTimeMillis;
    private volatile Instant lastUpdateTime;

    public RealTimeUpdateService(RunSource runSource,
                                 TaskScheduler scheduler,
                                 Executor fetchExecutor,
                                 Clock clock,
                                 UpdateConfiguration initialConfig) {
        this.runSource = Objects.requireNonNull(runSource);
        this.scheduler = Objects.requireNonNull(scheduler);
        this.fetchExecutor = Objects.requireNonNull(fetchExecutor);
        this.clock = Objects.requireNonNull(clock);
        this.config = Objects.requireNonNull(initialConfig);
    }

    // --- subscriptions ---

    /**
     * Observes one run. Re-subscribing with the same key replaces the callback instead of
     * adding a slot. An initial fetch is issued right away; its failure is only logged.
     *
     * @throws SubscriptionCapacityExceededException when all run slots are taken
     * @throws ServiceDisposedException after {@link #dispose()}
     */
    public Subscription subscribeToRunUpdates(int runId, int pipelineId, String projectId,
                                              Consumer<PipelineRun> callback) {
        Objects.requireNonNull(callback, "callback");
        RunSubscriptionKey key = new RunSubscriptionKey(runId, pipelineId, projectId);
        long registrationId = registrationSeq.incrementAndGet();

        RunSubscription subscription;
        stateLock.lock();
        try {
            ensureNotDisposed();
            subscription = registry.registerRun(key, callback, registrationId,
                    config.maxActiveSubscriptions(), clock.instant());
            if (config.backgroundRefreshEnabled()) {
                scheduleTimerLocked();
            }
        } finally {
            stateLock.unlock();
        }

        fetchRunUpdate(subscription).whenComplete((ignored, ex) -> {
            if (ex != null) {
                log.warn("Failed to fetch initial run status for {}: {}", key, describe(ex));
            }
        });

        return () -> unsubscribeFromRun(key, registrationId);
    }

    /**
     * Observes all recent runs of a pipeline. Callbacks for the same pipeline share one fetch
     * per cycle.
     *
     * @throws ServiceDisposedException after {@link #dispose()}
     */
    public Subscription subscribeToPipelineUpdates(int pipelineId, String projectId,
                                                   Consumer<List<PipelineRun>> callback) {
        Objects.requireNonNull(callback, "callback");
        PipelineSubscriptionKey key = new PipelineSubscriptionKey(pipelineId, projectId);

        boolean incremental;
        stateLock.lock();
        try {
            ensureNotDisposed();
            registry.registerPipeline(key, callback);
            incremental = config.enableIncrementalFetch();
            if (config.backgroundRefreshEnabled()) {
                scheduleTimerLocked();
            }
        } finally {
            stateLock.unlock();
        }

        fetchPipelineUpdate(key, incremental).whenComplete((ignored, ex) -> {
            if (ex != null) {
                log.warn("Failed to fetch initial pipeline runs for {}: {}", key, describe(ex));
            }
        });

        return () -> unsubscribeFromPipeline(key, callback);
    }

    /** Registers a listener for (state, result) transitions. */
    public Subscription onRunStatusChanged(RunStatusChangeListener listener) {
        Objects.requireNonNull(listener, "listener");
        ensureNotDisposed();
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Removal takes the subscription monitor first, so once this returns no callback for the
     * handle is running or will start.
     */
    private void unsubscribeFromRun(RunSubscriptionKey key, long registrationId) {
        Optional<RunSubscription> current;
        stateLock.lock();
        try {
            if (disposed) return;
            current = registry.findRun(key);
        } finally {
            stateLock.unlock();
        }
        if (current.isEmpty()) {
            return;
        }
        synchronized (current.get()) {
            stateLock.lock();
            try {
                if (disposed) return;
                if (registry.removeRun(key, registrationId)) {
                    log.debug("Unsubscribed from run {}", key);
                    stopTimerIfIdleLocked();
                }
            } finally {
                stateLock.unlock();
            }
        }
    }

    private void unsubscribeFromPipeline(PipelineSubscriptionKey key, Consumer<List<PipelineRun>> callback) {
        stateLock.lock();
        try {
            if (disposed) return;
            if (registry.removePipeline(key, callback)) {
                log.debug("Unsubscribed from pipeline {}", key);
                stopTimerIfIdleLocked();
            }
        } finally {
            stateLock.unlock();
        }
    }

    // --- background timer ---

    public void startBackgroundRefresh() {
        stateLock.lock();
        try {
            ensureNotDisposed();
            scheduleTimerLocked();
        } finally {
            stateLock.unlock();
        }
    }

    public void stopBackgroundRefresh() {
        stateLock.lock();
        try {
            ensureNotDisposed();
            cancelTimerLocked();
        } finally {
            stateLock.unlock();
        }
    }

    public boolean isBackgroundRefreshActive() {
        stateLock.lock();
        try {
            return backgroundTimer != null;
        } finally {
            stateLock.unlock();
        }
    }

    private void scheduleTimerLocked() {
        if (backgroundTimer != null) {
            return;
        }
        Duration interval = config.pollingInterval();
        backgroundTimer = scheduler.scheduleWithFixedDelay(
                this::performBackgroundRefresh, clock.instant().plus(interval), interval);
        log.info("Background refresh started (interval {})", interval);
    }

    private void cancelTimerLocked() {
        if (backgroundTimer == null) {
            return;
        }
        backgroundTimer.cancel(false);
        backgroundTimer = null;
        log.info("Background refresh stopped");
    }

    private void stopTimerIfIdleLocked() {
        if (registry.isEmpty()) {
            cancelTimerLocked();
        }
    }

    // --- configuration ---

    public UpdateConfiguration getConfiguration() {
        stateLock.lock();
        try {
            return config;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Applies a partial configuration change. A new polling interval restarts a running timer;
     * an explicit background-refresh flag starts or stops it.
     */
    public void updateConfiguration(UpdateConfigurationPatch patch) {
        Objects.requireNonNull(patch, "patch");
        stateLock.lock();
        try {
            ensureNotDisposed();
            UpdateConfiguration previous = config;
            UpdateConfiguration updated = previous.merge(patch);
            config = updated;

            if (!updated.pollingInterval().equals(previous.pollingInterval()) && backgroundTimer != null) {
                cancelTimerLocked();
                if (updated.backgroundRefreshEnabled()) {
                    scheduleTimerLocked();
                }
            }

            if (patch.backgroundRefreshEnabled() != null) {
                if (patch.backgroundRefreshEnabled()) {
                    scheduleTimerLocked();
                } else {
                    cancelTimerLocked();
                }
            }
            log.info("Real-time update configuration changed: {}", updated);
        } finally {
            stateLock.unlock();
        }
    }

    // --- counts & stats ---

    /** Every run slot (retired ones included) plus every subscribed pipeline. */
    public int getActiveSubscriptionCount() {
        stateLock.lock();
        try {
            return registry.totalCount();
        } finally {
            stateLock.unlock();
        }
    }

    /** Run slots still being polled plus every subscribed pipeline. */
    public int getPolledSubscriptionCount() {
        stateLock.lock();
        try {
            return registry.polledCount();
        } finally {
            stateLock.unlock();
        }
    }

    /** Current state of a run subscription slot, empty when there is none. */
    public Optional<SubscriptionState> getRunSubscriptionState(int runId, int pipelineId, String projectId) {
        stateLock.lock();
        try {
            return registry.findRun(new RunSubscriptionKey(runId, pipelineId, projectId))
                    .map(RunSubscription::state);
        } finally {
            stateLock.unlock();
        }
    }

    public UpdateStats getStats() {
        stateLock.lock();
        try {
            return new UpdateStats(
                    registry.runSlotCount(),
                    totalUpdatesReceived.get(),
                    lastUpdateTime,
                    backgroundTimer != null,
                    config.pollingInterval(),
                    averageResponseTimeMillis,
                    errorCount.get());
        } finally {
            stateLock.unlock();
        }
    }

    public boolean isDisposed() {
        return disposed;
    }

    // --- refresh cycles ---

    /**
     * Fetches every polled subscription and blocks until all fetches have settled. Individual
     * failures are counted and do not affect the others.
     *
     * @throws ServiceDisposedException after {@link #dispose()}
     */
    public void refreshAllSubscriptions() {
        ensureNotDisposed();
        runRefreshCycle();
    }

    /** Timer entry point; must never throw or the scheduler would stop repeating it. */
    void performBackgroundRefresh() {
        if (disposed) {
            return;
        }
        try {
            runRefreshCycle();
        } catch (RuntimeException e) {
            log.error("Background refresh failed", e);
            countIfLive(errorCount, 1);
        }
    }

    private void runRefreshCycle() {
        tickLock.lock();
        try {
            long start = System.nanoTime();

            List<RunSubscription> runs;
            List<PipelineSubscriptionKey> pipelines;
            boolean incremental;
            stateLock.lock();
            try {
                runs = registry.activeRunSubscriptions();
                pipelines = registry.pipelineKeys();
                incremental = config.enableIncrementalFetch();
            } finally {
                stateLock.unlock();
            }

            AtomicInteger failures = new AtomicInteger();
            List<CompletableFuture<Void>> pending = new ArrayList<>(runs.size() + pipelines.size());
            for (RunSubscription subscription : runs) {
                pending.add(fetchRunUpdate(subscription).exceptionally(ex -> {
                    failures.incrementAndGet();
                    log.warn("Background refresh failed for run {}: {}", subscription.key(), describe(ex));
                    return null;
                }));
            }
            for (PipelineSubscriptionKey key : pipelines) {
                pending.add(fetchPipelineUpdate(key, incremental).exceptionally(ex -> {
                    failures.incrementAndGet();
                    log.warn("Background refresh failed for pipeline {}: {}", key, describe(ex));
                    return null;
                }));
            }

            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).join();

            double elapsedMillis = (System.nanoTime() - start) / 1_000_000.0;
            stateLock.lock();
            try {
                if (disposed) {
                    return;
                }
                averageResponseTimeMillis = averageResponseTimeMillis == 0
                        ? elapsedMillis
                        : (averageResponseTimeMillis + elapsedMillis) / 2;
                errorCount.addAndGet(failures.get());
                lastUpdateTime = clock.instant();
            } finally {
                stateLock.unlock();
            }
            log.debug("Refresh cycle: {} runs, {} pipelines, {} failures in {} ms",
                    runs.size(), pipelines.size(), failures.get(), String.format("%.1f", elapsedMillis));
        } finally {
            tickLock.unlock();
        }
    }

    private CompletableFuture<Void> fetchRunUpdate(RunSubscription subscription) {
        RunSubscriptionKey key = subscription.key();
        long sequence = fetchSeq.incrementAndGet();
        return supplyOnFetchExecutor(() -> runSource.fetchRunDetails(key.runId(), key.pipelineId(), key.projectId()))
                .thenAccept(run -> applyRunUpdate(subscription, run, sequence));
    }

    private CompletableFuture<Void> fetchPipelineUpdate(PipelineSubscriptionKey key, boolean incremental) {
        return supplyOnFetchExecutor(() -> {
            if (!incremental) {
                runSource.evictCollection(key.pipelineId(), key.projectId());
            }
            return runSource.fetchCollectionRuns(key.pipelineId(), key.projectId());
        }).thenAccept(runs -> deliverCollection(key, runs));
    }

    private <T> CompletableFuture<T> supplyOnFetchExecutor(Supplier<T> fetch) {
        try {
            return CompletableFuture.supplyAsync(fetch, fetchExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Change detection, notification, callback and retirement for one fetched run, in that
     * order. The subscription monitor keeps concurrent results for the same key from
     * interleaving; a result issued before one already applied is dropped.
     */
    private void applyRunUpdate(RunSubscription subscription, PipelineRun run, long sequence) {
        synchronized (subscription) {
            if (!isStillRegistered(subscription)) {
                log.debug("Dropping update for {}: subscription no longer registered", subscription.key());
                return;
            }
            if (!subscription.isActive()) {
                return;
            }
            if (!subscription.advanceSequence(sequence)) {
                log.debug("Dropping out-of-order update for {}", subscription.key());
                return;
            }

            RunSubscription.Observation previous = subscription.lastObserved();
            RunSubscription.Observation current = RunSubscription.Observation.of(run);
            Instant now = clock.instant();

            if (!current.equals(previous)) {
                RunSubscriptionKey key = subscription.key();
                publish(new RunStatusChangeEvent(
                        key.runId(), key.pipelineId(), key.projectId(),
                        previous == null ? null : previous.state(), current.state(),
                        previous == null ? null : previous.result(), current.result(),
                        now));
                countIfLive(totalUpdatesReceived, 1);
            }
            subscription.recordObservation(current, now);

            try {
                subscription.callback().accept(run);
            } catch (RuntimeException e) {
                countIfLive(errorCount, 1);
                log.warn("Run subscriber for {} threw: {}", subscription.key(), e.toString());
            }

            if (run.state().isTerminal()) {
                subscription.retire();
                log.debug("Run {} reached {}; subscription retired", subscription.key(), run.state());
            }
        }
    }

    private void deliverCollection(PipelineSubscriptionKey key, List<PipelineRun> runs) {
        List<Consumer<List<PipelineRun>>> callbacks;
        stateLock.lock();
        try {
            if (disposed) {
                return;
            }
            callbacks = registry.pipelineCallbacks(key);
        } finally {
            stateLock.unlock();
        }
        if (callbacks.isEmpty()) {
            log.debug("Dropping runs for {}: no subscribers left", key);
            return;
        }
        int failures = 0;
        for (Consumer<List<PipelineRun>> callback : callbacks) {
            try {
                callback.accept(runs);
            } catch (RuntimeException e) {
                failures++;
                log.warn("Pipeline subscriber for {} threw: {}", key, e.toString());
            }
        }
        countIfLive(totalUpdatesReceived, 1);
        countIfLive(errorCount, failures);
    }

    /** Counters are only touched while the engine is live, so dispose leaves them at zero. */
    private void countIfLive(AtomicLong counter, long delta) {
        if (delta == 0) {
            return;
        }
        stateLock.lock();
        try {
            if (!disposed) {
                counter.addAndGet(delta);
            }
        } finally {
            stateLock.unlock();
        }
    }

    private void publish(RunStatusChangeEvent event) {
        for (RunStatusChangeListener listener : listeners) {
            try {
                listener.onRunStatusChanged(event);
            } catch (RuntimeException e) {
                countIfLive(errorCount, 1);
                log.warn("Run status listener threw for run {}: {}", event.runId(), e.toString());
            }
        }
    }

    private boolean isStillRegistered(RunSubscription subscription) {
        stateLock.lock();
        try {
            return !disposed && registry.isRegistered(subscription);
        } finally {
            stateLock.unlock();
        }
    }

    // --- lifecycle ---

    /**
     * Stops the timer, drops every subscription and listener and zeroes the statistics. The
     * service cannot be used afterwards.
     */
    public void dispose() {
        stateLock.lock();
        try {
            if (disposed) {
                return;
            }
            disposed = true;
            cancelTimerLocked();
            registry.clear();
            listeners.clear();
            totalUpdatesReceived.set(0);
            errorCount.set(0);
            averageResponseTimeMillis = 0;
            lastUpdateTime = null;
        } finally {
            stateLock.unlock();
        }
        log.info("Real-time update service disposed");
    }

    private void ensureNotDisposed() {
        if (disposed) {
            throw new ServiceDisposedException("Real-time update service has been disposed");
        }
    }

    private static String describe(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        return cause.toString();
    }
}
