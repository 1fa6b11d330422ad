package com.example.pipelines.core;

import com.example.pipelines.eviction.LruEvictionStrategy;
import com.example.pipelines.refresh.CoalescingRefreshStrategy;
import com.example.pipelines.refresh.NaiveTtlRefreshStrategy;
import com.example.pipelines.refresh.RefreshStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "dispose")
    public CacheService cacheService(CacheProperties props, Clock clock) {
        return new CacheService(
                new LruEvictionStrategy(Math.min(props.getMaxSize() + 1, 1024)),
                props.getMaxSize(),
                props.getDefaultTtl(),
                clock);
    }

    @Bean
    public RefreshStrategy refreshStrategy(CacheProperties props) {
        String mode = props.getRefreshStrategy() == null ? "coalescing" : props.getRefreshStrategy();
        switch (mode) {
            case "naive":
                return new NaiveTtlRefreshStrategy();
            case "coalescing":
                return new CoalescingRefreshStrategy();
            default:
                throw new IllegalArgumentException("Unknown refresh strategy: " + mode);
        }
    }
}
