package com.example.pipelines.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single execution of a pipeline. {@code result} and {@code finishedDate} stay null
 * until the run completes.
 */
public record PipelineRun(int id,
                          String name,
                          RunState state,
                          RunResult result,
                          Instant createdDate,
                          Instant finishedDate,
                          int pipelineId,
                          String projectId,
                          String url) {

    public PipelineRun {
        Objects.requireNonNull(state, "state");
    }

    public PipelineRun withState(RunState newState, RunResult newResult, Instant finishedAt) {
        return new PipelineRun(id, name, newState, newResult, createdDate, finishedAt, pipelineId, projectId, url);
    }
}
