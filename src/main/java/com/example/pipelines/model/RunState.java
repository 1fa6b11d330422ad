package com.example.pipelines.model;

/**
 * Lifecycle state of a pipeline run as reported by the CI service.
 */
public enum RunState {
    IN_PROGRESS,
    CANCELLING,
    CANCELLED,
    COMPLETED;

    /** No further transitions are expected once a run reports this state. */
    public boolean isTerminal() {
        return this == COMPLETED;
    }
}
