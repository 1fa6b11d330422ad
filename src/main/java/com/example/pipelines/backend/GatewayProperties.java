package com.example.pipelines.backend;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "pipelines.gateway")
public class GatewayProperties {

    /** "simulated" serves in-memory data; any other value expects a PipelineGateway bean from elsewhere. */
    private String mode = "simulated";

    /** Artificial delay added to every simulated call. */
    private Duration latency = Duration.ZERO;

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public Duration getLatency() {
        return latency;
    }

    public void setLatency(Duration latency) {
        this.latency = latency;
    }
}
