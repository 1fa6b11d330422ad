package com.example.pipelines.updates;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Initial configuration of the real-time update engine. Runtime changes go through
 * {@link RealTimeUpdateService#updateConfiguration(UpdateConfigurationPatch)}.
 */
@ConfigurationProperties(prefix = "pipelines.updates")
public class UpdateProperties {

    private Duration pollingInterval = UpdateConfiguration.DEFAULT_POLLING_INTERVAL;

    private int maxActiveSubscriptions = UpdateConfiguration.DEFAULT_MAX_ACTIVE_SUBSCRIPTIONS;

    /** Let collection polling reuse cached run lists inside their TTL window. */
    private boolean enableIncrementalFetch = true;

    private boolean backgroundRefreshEnabled = true;

    /** Threads used to fan out fetches within one refresh cycle. */
    private int fetchThreads = 4;

    public UpdateConfiguration toConfiguration() {
        return new UpdateConfiguration(pollingInterval, maxActiveSubscriptions,
                enableIncrementalFetch, backgroundRefreshEnabled);
    }

    public Duration getPollingInterval() {
        return pollingInterval;
    }

    public void setPollingInterval(Duration pollingInterval) {
        this.pollingInterval = pollingInterval;
    }

    public int getMaxActiveSubscriptions() {
        return maxActiveSubscriptions;
    }

    public void setMaxActiveSubscriptions(int maxActiveSubscriptions) {
        this.maxActiveSubscriptions = maxActiveSubscriptions;
    }

    public boolean isEnableIncrementalFetch() {
        return enableIncrementalFetch;
    }

    public void setEnableIncrementalFetch(boolean enableIncrementalFetch) {
        this.enableIncrementalFetch = enableIncrementalFetch;
    }

    public boolean isBackgroundRefreshEnabled() {
        return backgroundRefreshEnabled;
    }

    public void setBackgroundRefreshEnabled(boolean backgroundRefreshEnabled) {
        this.backgroundRefreshEnabled = backgroundRefreshEnabled;
    }

    public int getFetchThreads() {
        return fetchThreads;
    }

    public void setFetchThreads(int fetchThreads) {
        this.fetchThreads = fetchThreads;
    }
}
