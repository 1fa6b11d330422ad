package com.example.pipelines.updates;

import java.util.Objects;

public record PipelineSubscriptionKey(int pipelineId, String projectId) {

    public PipelineSubscriptionKey {
        Objects.requireNonNull(projectId, "projectId");
    }

    @Override
    public String toString() {
        return projectId + ":" + pipelineId;
    }
}
