package com.example.pipelines.updates;

import java.time.Duration;

/**
 * Partial configuration change; null fields keep their current value.
 */
public record UpdateConfigurationPatch(Duration pollingInterval,
                                       Integer maxActiveSubscriptions,
                                       Boolean enableIncrementalFetch,
                                       Boolean backgroundRefreshEnabled) {

    public static UpdateConfigurationPatch pollingInterval(Duration interval) {
        return new UpdateConfigurationPatch(interval, null, null, null);
    }

    public static UpdateConfigurationPatch maxActiveSubscriptions(int max) {
        return new UpdateConfigurationPatch(null, max, null, null);
    }

    public static UpdateConfigurationPatch incrementalFetch(boolean enabled) {
        return new UpdateConfigurationPatch(null, null, enabled, null);
    }

    public static UpdateConfigurationPatch backgroundRefresh(boolean enabled) {
        return new UpdateConfigurationPatch(null, null, null, enabled);
    }
}
