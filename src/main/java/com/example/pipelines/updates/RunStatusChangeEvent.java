package com.example.pipelines.updates;

import com.example.pipelines.model.RunResult;
import com.example.pipelines.model.RunState;

import java.time.Instant;

/**
 * A run moved to a new (state, result) pair. The previous values are null on the first
 * observation of a subscription.
 */
public record RunStatusChangeEvent(int runId,
                                   int pipelineId,
                                   String projectId,
                                   RunState previousState,
                                   RunState currentState,
                                   RunResult previousResult,
                                   RunResult currentResult,
                                   Instant timestamp) {

    public boolean isFirstObservation() {
        return previousState == null;
    }
}
