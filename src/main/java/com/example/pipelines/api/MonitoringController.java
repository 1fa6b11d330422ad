package com.example.pipelines.api;

import com.example.pipelines.core.CacheService;
import com.example.pipelines.core.CacheStats;
import com.example.pipelines.data.PipelineDataService;
import com.example.pipelines.updates.RealTimeUpdateService;
import com.example.pipelines.updates.ServiceDisposedException;
import com.example.pipelines.updates.UpdateConfiguration;
import com.example.pipelines.updates.UpdateConfigurationPatch;
import com.example.pipelines.updates.UpdateStats;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Cache and update-engine introspection plus a few operator actions.
 */
@RestController
@RequestMapping("/api")
public class MonitoringController {

    private final CacheService cache;
    private final PipelineDataService data;
    private final RealTimeUpdateService updates;

    public MonitoringController(CacheService cache, PipelineDataService data, RealTimeUpdateService updates) {
        this.cache = Objects.requireNonNull(cache);
        this.data = Objects.requireNonNull(data);
        this.updates = Objects.requireNonNull(updates);
    }

    @GetMapping("/cache/stats")
    public Map<String, Object> cacheStats() {
        CacheStats stats = cache.stats();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("size", stats.size());
        out.put("capacity", cache.capacity());
        out.put("hits", stats.hits());
        out.put("misses", stats.misses());
        out.put("hitRate", stats.hitRate());
        out.put("defaultTtl", cache.defaultTtl().toString());
        return out;
    }

    @PostMapping("/cache/clear")
    public Map<String, Object> clearCache() {
        data.clearCache();
        return Map.of("cleared", true);
    }

    @GetMapping("/updates/stats")
    public Map<String, Object> updateStats() {
        UpdateStats stats = updates.getStats();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("activeSubscriptions", stats.activeSubscriptions());
        out.put("polledSubscriptions", updates.getPolledSubscriptionCount());
        out.put("totalUpdatesReceived", stats.totalUpdatesReceived());
        out.put("lastUpdateTime", stats.lastUpdateTime() != null ? stats.lastUpdateTime().toString() : null);
        out.put("backgroundRefreshActive", stats.backgroundRefreshActive());
        out.put("pollingInterval", stats.pollingInterval().toString());
        out.put("averageResponseTimeMillis", stats.averageResponseTimeMillis());
        out.put("errorCount", stats.errorCount());
        return out;
    }

    @GetMapping("/updates/config")
    public Map<String, Object> updateConfig() {
        return describe(updates.getConfiguration());
    }

    @PutMapping("/updates/config")
    public Map<String, Object> changeUpdateConfig(@RequestBody UpdateConfigurationPatch patch) {
        try {
            updates.updateConfiguration(patch);
        } catch (ServiceDisposedException e) {
            throw unavailable(e);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        return describe(updates.getConfiguration());
    }

    @PostMapping("/updates/refresh")
    public Map<String, Object> refreshNow() {
        try {
            updates.refreshAllSubscriptions();
        } catch (ServiceDisposedException e) {
            throw unavailable(e);
        }
        return updateStats();
    }

    @PostMapping("/updates/background/{action}")
    public Map<String, Object> background(@PathVariable String action) {
        try {
            switch (action) {
                case "start" -> updates.startBackgroundRefresh();
                case "stop" -> updates.stopBackgroundRefresh();
                default -> throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown action: " + action);
            }
        } catch (ServiceDisposedException e) {
            throw unavailable(e);
        }
        return Map.of("backgroundRefreshActive", updates.isBackgroundRefreshActive());
    }

    private static Map<String, Object> describe(UpdateConfiguration config) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("pollingInterval", config.pollingInterval().toString());
        out.put("maxActiveSubscriptions", config.maxActiveSubscriptions());
        out.put("enableIncrementalFetch", config.enableIncrementalFetch());
        out.put("backgroundRefreshEnabled", config.backgroundRefreshEnabled());
        return out;
    }

    private static ResponseStatusException unavailable(ServiceDisposedException e) {
        return new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), e);
    }
}
