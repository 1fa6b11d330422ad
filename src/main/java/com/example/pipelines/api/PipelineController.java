package com.example.pipelines.api;

import com.example.pipelines.data.PipelineDataException;
import com.example.pipelines.data.PipelineDataService;
import com.example.pipelines.model.Pipeline;
import com.example.pipelines.model.PipelineRun;
import com.example.pipelines.model.Project;
import com.example.pipelines.model.RunParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/projects")
public class PipelineController {
    private static final Logger log = LoggerFactory.getLogger(PipelineController.class);

    private final PipelineDataService data;

    public PipelineController(PipelineDataService data) {
        this.data = Objects.requireNonNull(data);
    }

    @GetMapping
    public List<Project> projects() {
        return call(data::getProjects);
    }

    @GetMapping("/{projectId}/pipelines")
    public List<Pipeline> pipelines(@PathVariable String projectId) {
        return call(() -> data.getPipelines(projectId));
    }

    @GetMapping("/{projectId}/pipelines/{pipelineId}/runs")
    public List<PipelineRun> runs(@PathVariable String projectId,
                                  @PathVariable int pipelineId,
                                  @RequestParam(defaultValue = "" + PipelineDataService.DEFAULT_RUNS_TOP) int top) {
        return call(() -> data.getPipelineRuns(pipelineId, projectId, top));
    }

    @GetMapping("/{projectId}/pipelines/{pipelineId}/runs/{runId}")
    public PipelineRun run(@PathVariable String projectId,
                           @PathVariable int pipelineId,
                           @PathVariable int runId) {
        return call(() -> data.getRunDetails(runId, pipelineId, projectId));
    }

    @PostMapping("/{projectId}/pipelines/{pipelineId}/runs")
    public PipelineRun trigger(@PathVariable String projectId,
                               @PathVariable int pipelineId,
                               @RequestBody(required = false) RunParameters parameters) {
        return call(() -> data.triggerPipelineRun(pipelineId, projectId, parameters));
    }

    @PostMapping("/{projectId}/pipelines/{pipelineId}/runs/{runId}/cancel")
    public Map<String, Object> cancel(@PathVariable String projectId,
                                      @PathVariable int pipelineId,
                                      @PathVariable int runId) {
        call(() -> {
            data.cancelRun(runId, pipelineId, projectId);
            return null;
        });
        return Map.of("runId", runId, "cancelRequested", true);
    }

    @PostMapping("/{projectId}/refresh")
    public List<Pipeline> refresh(@PathVariable String projectId) {
        return call(() -> data.refreshProject(projectId));
    }

    private static <T> T call(Supplier<T> action) {
        try {
            return action.get();
        } catch (PipelineDataException e) {
            log.warn("{}: {}", e.getMessage(), e.getCause() != null ? e.getCause().getMessage() : "");
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, e.getMessage(), e);
        }
    }
}
