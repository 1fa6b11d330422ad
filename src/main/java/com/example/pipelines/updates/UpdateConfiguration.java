package com.example.pipelines.updates;

import java.time.Duration;
import java.util.Objects;

public record UpdateConfiguration(Duration pollingInterval,
                                  int maxActiveSubscriptions,
                                  boolean enableIncrementalFetch,
                                  boolean backgroundRefreshEnabled) {

    public static final Duration DEFAULT_POLLING_INTERVAL = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_ACTIVE_SUBSCRIPTIONS = 50;

    public UpdateConfiguration {
        Objects.requireNonNull(pollingInterval, "pollingInterval");
        if (pollingInterval.isZero() || pollingInterval.isNegative()) {
            throw new IllegalArgumentException("pollingInterval must be positive, got " + pollingInterval);
        }
        if (maxActiveSubscriptions < 1) {
            throw new IllegalArgumentException("maxActiveSubscriptions must be >= 1, got " + maxActiveSubscriptions);
        }
    }

    public static UpdateConfiguration defaults() {
        return new UpdateConfiguration(DEFAULT_POLLING_INTERVAL, DEFAULT_MAX_ACTIVE_SUBSCRIPTIONS, true, true);
    }

    /** Applies the non-null fields of {@code patch} on top of this configuration. */
    public UpdateConfiguration merge(UpdateConfigurationPatch patch) {
        if (patch == null) {
            return this;
        }
        return new UpdateConfiguration(
                patch.pollingInterval() != null ? patch.pollingInterval() : pollingInterval,
                patch.maxActiveSubscriptions() != null ? patch.maxActiveSubscriptions() : maxActiveSubscriptions,
                patch.enableIncrementalFetch() != null ? patch.enableIncrementalFetch() : enableIncrementalFetch,
                patch.backgroundRefreshEnabled() != null ? patch.backgroundRefreshEnabled() : backgroundRefreshEnabled);
    }
}
