package com.example.pipelines.updates;

import com.example.pipelines.model.PipelineRun;

import java.util.List;

/**
 * What the update engine needs from the remote side. Errors are opaque; the engine only
 * cares whether a fetch succeeded.
 */
public interface RunSource {

    PipelineRun fetchRunDetails(int runId, int pipelineId, String projectId);

    List<PipelineRun> fetchCollectionRuns(int pipelineId, String projectId);

    /** Forgets any locally held copy of the collection so the next fetch goes remote. */
    default void evictCollection(int pipelineId, String projectId) {
    }
}
