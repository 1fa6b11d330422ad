package com.example.pipelines.data;

import com.example.pipelines.core.CacheProperties;
import com.example.pipelines.core.CacheService;
import com.example.pipelines.gateway.GatewayException;
import com.example.pipelines.gateway.PipelineGateway;
import com.example.pipelines.model.Pipeline;
import com.example.pipelines.model.PipelineRun;
import com.example.pipelines.model.Project;
import com.example.pipelines.model.RunParameters;
import com.example.pipelines.refresh.RefreshStrategy;
import com.example.pipelines.updates.RunSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Cache-aware access to projects, pipelines and runs. Reads go through the configured
 * {@link RefreshStrategy}; mutations invalidate the affected runs entry afterwards.
 */
@Service
public class PipelineDataService implements RunSource {
    private static final Logger logger = LoggerFactory.getLogger(PipelineDataService.class);

    public static final int DEFAULT_RUNS_TOP = 50;

    private final PipelineGateway gateway;
    private final CacheService cache;
    private final RefreshStrategy refreshStrategy;
    private final CacheProperties props;

    public PipelineDataService(PipelineGateway gateway,
                               CacheService cache,
                               RefreshStrategy refreshStrategy,
                               CacheProperties props) {
        this.gateway = Objects.requireNonNull(gateway);
        this.cache = Objects.requireNonNull(cache);
        this.refreshStrategy = Objects.requireNonNull(refreshStrategy);
        this.props = Objects.requireNonNull(props);
    }

    public List<Project> getProjects() {
        return cached(CacheKeys.PROJECTS, "Failed to fetch projects", gateway::listProjects);
    }

    public List<Pipeline> getPipelines(String projectId) {
        Objects.requireNonNull(projectId, "projectId");
        return cached(CacheKeys.pipelines(projectId),
                "Failed to fetch pipelines for project " + projectId,
                () -> gateway.listPipelines(projectId));
    }

    public List<PipelineRun> getPipelineRuns(int pipelineId, String projectId, int top) {
        Objects.requireNonNull(projectId, "projectId");
        int limit = Math.max(1, top);
        List<PipelineRun> runs = cached(CacheKeys.runs(projectId, pipelineId),
                "Failed to fetch runs for pipeline " + pipelineId,
                () -> gateway.listRuns(pipelineId, projectId, Math.max(limit, DEFAULT_RUNS_TOP)));
        return runs.size() <= limit ? runs : List.copyOf(runs.subList(0, limit));
    }

    /** Always fetched fresh; run details change too quickly to be worth caching. */
    public PipelineRun getRunDetails(int runId, int pipelineId, String projectId) {
        try {
            return gateway.getRunDetails(runId, pipelineId, projectId);
        } catch (GatewayException e) {
            throw new PipelineDataException("Failed to fetch run details for run " + runId, e);
        }
    }

    public PipelineRun triggerPipelineRun(int pipelineId, String projectId, RunParameters parameters) {
        RunParameters effective = parameters != null ? parameters : RunParameters.defaults();
        PipelineRun run;
        try {
            run = gateway.triggerRun(pipelineId, projectId, effective);
        } catch (GatewayException e) {
            throw new PipelineDataException("Failed to trigger pipeline run for pipeline " + pipelineId, e);
        }
        invalidatePipeline(pipelineId, projectId);
        logger.info("Triggered run {} for pipeline {} in project {} on {}",
                run.id(), pipelineId, projectId, effective.effectiveBranch());
        return run;
    }

    public void cancelRun(int runId, int pipelineId, String projectId) {
        try {
            gateway.cancelRun(runId, pipelineId, projectId);
        } catch (GatewayException e) {
            throw new PipelineDataException("Failed to cancel run " + runId, e);
        }
        invalidatePipeline(pipelineId, projectId);
        logger.info("Requested cancellation of run {} (pipeline {}, project {})", runId, pipelineId, projectId);
    }

    public void invalidateProject(String projectId) {
        if (!props.isEnabled()) return;
        cache.invalidate(CacheKeys.pipelines(projectId));
        int runs = cache.invalidateByPrefix(CacheKeys.projectRunsPrefix(projectId));
        logger.debug("Invalidated project {} ({} runs entries)", projectId, runs);
    }

    public void invalidatePipeline(int pipelineId, String projectId) {
        if (!props.isEnabled()) return;
        cache.invalidate(CacheKeys.runs(projectId, pipelineId));
    }

    public List<Pipeline> refreshProject(String projectId) {
        invalidateProject(projectId);
        return getPipelines(projectId);
    }

    public List<PipelineRun> refreshPipeline(int pipelineId, String projectId) {
        invalidatePipeline(pipelineId, projectId);
        return getPipelineRuns(pipelineId, projectId, DEFAULT_RUNS_TOP);
    }

    public void clearCache() {
        if (!props.isEnabled()) return;
        cache.clear();
        logger.info("Pipeline data cache cleared");
    }

    // --- RunSource ---

    @Override
    public PipelineRun fetchRunDetails(int runId, int pipelineId, String projectId) {
        return getRunDetails(runId, pipelineId, projectId);
    }

    @Override
    public List<PipelineRun> fetchCollectionRuns(int pipelineId, String projectId) {
        return getPipelineRuns(pipelineId, projectId, DEFAULT_RUNS_TOP);
    }

    @Override
    public void evictCollection(int pipelineId, String projectId) {
        invalidatePipeline(pipelineId, projectId);
    }

    private <T> T cached(String key, String failureMessage, Supplier<T> loader) {
        Supplier<T> guarded = () -> {
            try {
                return loader.get();
            } catch (GatewayException e) {
                throw new PipelineDataException(failureMessage, e);
            }
        };
        if (!props.isEnabled()) {
            return guarded.get();
        }
        return refreshStrategy.get(key, guarded, cache, props.getDefaultTtl());
    }
}
