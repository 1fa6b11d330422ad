package com.example.pipelines.updates;

import java.util.Objects;

public record RunSubscriptionKey(int runId, int pipelineId, String projectId) {

    public RunSubscriptionKey {
        Objects.requireNonNull(projectId, "projectId");
    }

    @Override
    public String toString() {
        return projectId + ":" + pipelineId + ":" + runId;
    }
}
