package com.example.pipelines.loadgen;

import com.example.pipelines.backend.GatewayProperties;
import com.example.pipelines.backend.SimulatedPipelineGateway;
import com.example.pipelines.core.CacheProperties;
import com.example.pipelines.core.CacheService;
import com.example.pipelines.core.CacheStats;
import com.example.pipelines.data.PipelineDataService;
import com.example.pipelines.eviction.LruEvictionStrategy;
import com.example.pipelines.model.RunResult;
import com.example.pipelines.model.RunState;
import com.example.pipelines.refresh.CoalescingRefreshStrategy;
import com.example.pipelines.refresh.NaiveTtlRefreshStrategy;
import com.example.pipelines.refresh.RefreshStrategy;
import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process workload driver: worker threads read pipeline run lists through
 * {@link PipelineDataService}, picking pipelines with Zipf-distributed popularity, and the
 * result compares client requests against requests that reached the gateway.
 *
 * <p>Usage: {@code CacheLoadGenerator [threads] [requestsPerThread] [pipelines] [alpha]
 * [latencyMs] [naive|coalescing]}
 */
public class CacheLoadGenerator {
    private static final Logger log = LoggerFactory.getLogger(CacheLoadGenerator.class);

    public static final String PROJECT_ID = "load";

    public record Workload(int threads, int requestsPerThread, int pipelines, double alpha) {
        public Workload {
            if (threads < 1 || requestsPerThread < 1 || pipelines < 1) {
                throw new IllegalArgumentException("threads, requestsPerThread and pipelines must be >= 1");
            }
            if (alpha <= 0) {
                throw new IllegalArgumentException("alpha must be > 0");
            }
        }
    }

    public record Report(long requests,
                         long failures,
                         long gatewayRequests,
                         double hitRate,
                         double meanMillis,
                         double p95Millis,
                         double p99Millis,
                         double maxMillis) {

        @Override
        public String toString() {
            return String.format("Requests=%d, Failures=%d, GatewayRequests=%d, HitRate=%.3f, "
                            + "Avg=%.2fms, P95=%.2fms, P99=%.2fms, Max=%.2fms",
                    requests, failures, gatewayRequests, hitRate, meanMillis, p95Millis, p99Millis, maxMillis);
        }
    }

    private final PipelineDataService data;
    private final SimulatedPipelineGateway gateway;
    private final CacheService cache;

    public CacheLoadGenerator(PipelineDataService data, SimulatedPipelineGateway gateway, CacheService cache) {
        this.data = data;
        this.gateway = gateway;
        this.cache = cache;
    }

    /** Adds a project with {@code pipelines} pipelines (ids 1..n), each with one finished run. */
    public static void seed(SimulatedPipelineGateway gateway, int pipelines) {
        gateway.addProject(PROJECT_ID, "Load test");
        for (int id = 1; id <= pipelines; id++) {
            gateway.addPipeline(PROJECT_ID, id, "pipeline-" + id);
            gateway.addRun(PROJECT_ID, id, RunState.COMPLETED, RunResult.SUCCEEDED);
        }
    }

    public Report run(Workload workload) throws InterruptedException {
        ZipfDistribution zipf = new ZipfDistribution(workload.pipelines(), workload.alpha());
        ConcurrentLinkedQueue<Double> latencies = new ConcurrentLinkedQueue<>();
        AtomicLong requests = new AtomicLong();
        AtomicLong failures = new AtomicLong();

        cache.clear();
        gateway.resetCount();

        ExecutorService executor = Executors.newFixedThreadPool(workload.threads());
        try {
            for (int i = 0; i < workload.threads(); i++) {
                executor.submit(() -> {
                    for (int n = 0; n < workload.requestsPerThread(); n++) {
                        int pipelineId;
                        synchronized (zipf) {
                            pipelineId = zipf.sample();
                        }
                        long start = System.nanoTime();
                        try {
                            data.getPipelineRuns(pipelineId, PROJECT_ID, PipelineDataService.DEFAULT_RUNS_TOP);
                        } catch (RuntimeException e) {
                            failures.incrementAndGet();
                            log.debug("Request for pipeline {} failed: {}", pipelineId, e.getMessage());
                        }
                        latencies.add((System.nanoTime() - start) / 1_000_000.0);
                        requests.incrementAndGet();
                    }
                });
            }
            executor.shutdown();
            if (!executor.awaitTermination(10, TimeUnit.MINUTES)) {
                log.warn("Load generator workers did not finish in time");
            }
        } finally {
            executor.shutdownNow();
        }

        DescriptiveStatistics stats = new DescriptiveStatistics();
        latencies.forEach(stats::addValue);
        CacheStats cacheStats = cache.stats();
        return new Report(requests.get(), failures.get(), gateway.getRequestCount(), cacheStats.hitRate(),
                stats.getN() > 0 ? stats.getMean() : 0,
                stats.getN() > 0 ? stats.getPercentile(95) : 0,
                stats.getN() > 0 ? stats.getPercentile(99) : 0,
                stats.getN() > 0 ? stats.getMax() : 0);
    }

    public static void main(String[] args) throws Exception {
        int threads = args.length > 0 ? Integer.parseInt(args[0]) : 50;
        int requestsPerThread = args.length > 1 ? Integer.parseInt(args[1]) : 200;
        int pipelines = args.length > 2 ? Integer.parseInt(args[2]) : 100;
        double alpha = args.length > 3 ? Double.parseDouble(args[3]) : 0.9;
        long latencyMs = args.length > 4 ? Long.parseLong(args[4]) : 20;
        String mode = args.length > 5 ? args[5] : "coalescing";

        GatewayProperties gatewayProps = new GatewayProperties();
        gatewayProps.setLatency(Duration.ofMillis(latencyMs));
        SimulatedPipelineGateway gateway = new SimulatedPipelineGateway(gatewayProps);
        seed(gateway, pipelines);

        CacheProperties cacheProps = new CacheProperties();
        CacheService cache = new CacheService(new LruEvictionStrategy(), cacheProps.getMaxSize(),
                cacheProps.getDefaultTtl(), Clock.systemUTC());
        RefreshStrategy strategy = "naive".equals(mode) ? new NaiveTtlRefreshStrategy() : new CoalescingRefreshStrategy();
        PipelineDataService data = new PipelineDataService(gateway, cache, strategy, cacheProps);

        Workload workload = new Workload(threads, requestsPerThread, pipelines, alpha);
        log.info("Running {} with {} refresh, gateway latency {}ms", workload, mode, latencyMs);
        Report report = new CacheLoadGenerator(data, gateway, cache).run(workload);
        log.info("Finished: {}", report);
    }
}
