package com.example.pipelines.core;

import com.example.pipelines.refresh.CoalescingRefreshStrategy;
import com.example.pipelines.refresh.NaiveTtlRefreshStrategy;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CacheConfigTest {

    private final CacheConfig config = new CacheConfig();

    @Test
    void cacheServiceUsesConfiguredSizeAndTtl() {
        CacheProperties props = new CacheProperties();
        props.setMaxSize(7);
        props.setDefaultTtl(Duration.ofSeconds(42));

        CacheService cache = config.cacheService(props, Clock.systemUTC());

        assertEquals(7, cache.capacity());
        assertEquals(Duration.ofSeconds(42), cache.defaultTtl());
    }

    @Test
    void refreshStrategyIsChosenByName() {
        CacheProperties props = new CacheProperties();
        assertInstanceOf(CoalescingRefreshStrategy.class, config.refreshStrategy(props));

        props.setRefreshStrategy("naive");
        assertInstanceOf(NaiveTtlRefreshStrategy.class, config.refreshStrategy(props));

        props.setRefreshStrategy("bogus");
        assertThrows(IllegalArgumentException.class, () -> config.refreshStrategy(props));
    }
}
