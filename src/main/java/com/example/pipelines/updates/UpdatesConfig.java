package com.example.pipelines.updates;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class UpdatesConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService runFetchExecutor(UpdateProperties props) {
        int threads = Math.max(1, props.getFetchThreads());
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "pipeline-fetch-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "dispose")
    public RealTimeUpdateService realTimeUpdateService(RunSource runSource,
                                                       TaskScheduler taskScheduler,
                                                       ExecutorService runFetchExecutor,
                                                       Clock clock,
                                                       UpdateProperties props) {
        return new RealTimeUpdateService(runSource, taskScheduler, runFetchExecutor, clock, props.toConfiguration());
    }
}
