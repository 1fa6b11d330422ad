package com.example.pipelines.gateway;

import com.example.pipelines.model.Pipeline;
import com.example.pipelines.model.PipelineRun;
import com.example.pipelines.model.Project;
import com.example.pipelines.model.RunParameters;

import java.util.List;

/**
 * Remote CI service access. Implementations own transport, authentication, retries and
 * timeouts; callers only see success or a {@link GatewayException}.
 */
public interface PipelineGateway {

    List<Project> listProjects();

    List<Pipeline> listPipelines(String projectId);

    /** Most recent runs first, at most {@code top} of them. */
    List<PipelineRun> listRuns(int pipelineId, String projectId, int top);

    PipelineRun getRunDetails(int runId, int pipelineId, String projectId);

    PipelineRun triggerRun(int pipelineId, String projectId, RunParameters parameters);

    void cancelRun(int runId, int pipelineId, String projectId);
}
