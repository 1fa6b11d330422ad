package com.example.pipelines.backend;

import com.example.pipelines.gateway.GatewayException;
import com.example.pipelines.gateway.PipelineGateway;
import com.example.pipelines.model.Pipeline;
import com.example.pipelines.model.PipelineRun;
import com.example.pipelines.model.Project;
import com.example.pipelines.model.RunParameters;
import com.example.pipelines.model.RunResult;
import com.example.pipelines.model.RunState;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory stand-in for the remote CI service, with adjustable latency and scripted run
 * progression. Used for local runs and tests.
 */
@Component
@ConditionalOnProperty(prefix = "pipelines.gateway", name = "mode", havingValue = "simulated", matchIfMissing = true)
public class SimulatedPipelineGateway implements PipelineGateway {

    private static final String BASE_URL = "https://ci.example.test";

    private final AtomicLong requestCount = new AtomicLong();
    private final AtomicInteger failuresToInject = new AtomicInteger();
    private final AtomicInteger runIds = new AtomicInteger(1000);
    private volatile long latencyMillis;

    private final Map<String, Project> projects = new LinkedHashMap<>();
    private final Map<String, List<Pipeline>> pipelinesByProject = new LinkedHashMap<>();
    private final Map<Integer, PipelineRun> runsById = new LinkedHashMap<>();

    public SimulatedPipelineGateway(GatewayProperties props) {
        this.latencyMillis = props.getLatency() == null ? 0 : props.getLatency().toMillis();
    }

    @PostConstruct
    public void seedDemoData() {
        addProject("demo", "Demo Project");
        addPipeline("demo", 1, "build");
        addPipeline("demo", 2, "release");
        addRun("demo", 1, RunState.COMPLETED, RunResult.SUCCEEDED);
        addRun("demo", 1, RunState.IN_PROGRESS, null);
        addRun("demo", 2, RunState.COMPLETED, RunResult.FAILED);
    }

    // --- PipelineGateway ---

    @Override
    public List<Project> listProjects() {
        simulateCall();
        synchronized (this) {
            return List.copyOf(projects.values());
        }
    }

    @Override
    public List<Pipeline> listPipelines(String projectId) {
        simulateCall();
        synchronized (this) {
            requireProject(projectId);
            return List.copyOf(pipelinesByProject.getOrDefault(projectId, List.of()));
        }
    }

    @Override
    public List<PipelineRun> listRuns(int pipelineId, String projectId, int top) {
        simulateCall();
        synchronized (this) {
            requireProject(projectId);
            return runsById.values().stream()
                    .filter(r -> r.pipelineId() == pipelineId && r.projectId().equals(projectId))
                    .sorted(Comparator.comparingInt(PipelineRun::id).reversed())
                    .limit(Math.max(1, top))
                    .toList();
        }
    }

    @Override
    public PipelineRun getRunDetails(int runId, int pipelineId, String projectId) {
        simulateCall();
        synchronized (this) {
            PipelineRun run = runsById.get(runId);
            if (run == null || run.pipelineId() != pipelineId || !run.projectId().equals(projectId)) {
                throw new GatewayException("Run " + runId + " not found in pipeline " + pipelineId);
            }
            return run;
        }
    }

    @Override
    public PipelineRun triggerRun(int pipelineId, String projectId, RunParameters parameters) {
        simulateCall();
        synchronized (this) {
            requireProject(projectId);
            return addRun(projectId, pipelineId, RunState.IN_PROGRESS, null);
        }
    }

    @Override
    public void cancelRun(int runId, int pipelineId, String projectId) {
        simulateCall();
        synchronized (this) {
            PipelineRun run = getRunUnchecked(runId);
            if (!run.state().isTerminal()) {
                runsById.put(runId, run.withState(RunState.CANCELLING, null, null));
            }
        }
    }

    // --- scripting ---

    public synchronized void addProject(String id, String name) {
        projects.put(id, new Project(id, name, null, BASE_URL + "/" + id));
        pipelinesByProject.putIfAbsent(id, new ArrayList<>());
    }

    public synchronized void addPipeline(String projectId, int pipelineId, String name) {
        requireProject(projectId);
        pipelinesByProject.get(projectId).add(new Pipeline(pipelineId, name, projectId, "\\", 1,
                BASE_URL + "/" + projectId + "/_build?definitionId=" + pipelineId));
    }

    public synchronized PipelineRun addRun(String projectId, int pipelineId, RunState state, RunResult result) {
        int id = runIds.incrementAndGet();
        Instant now = Instant.now();
        PipelineRun run = new PipelineRun(id, "#" + id, state, result, now,
                state.isTerminal() ? now : null, pipelineId, projectId,
                BASE_URL + "/" + projectId + "/_build/results?buildId=" + id);
        runsById.put(id, run);
        return run;
    }

    public synchronized PipelineRun advanceRun(int runId, RunState state, RunResult result) {
        PipelineRun updated = getRunUnchecked(runId).withState(state, result, state.isTerminal() ? Instant.now() : null);
        runsById.put(runId, updated);
        return updated;
    }

    public PipelineRun completeRun(int runId, RunResult result) {
        return advanceRun(runId, RunState.COMPLETED, result);
    }

    /** The next {@code n} calls fail with a {@link GatewayException}. */
    public void failNext(int n) {
        failuresToInject.set(Math.max(0, n));
    }

    public void setLatencyMillis(long ms) {
        this.latencyMillis = ms;
    }

    public void setLatency(Duration latency) {
        this.latencyMillis = latency.toMillis();
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public void resetCount() {
        requestCount.set(0);
    }

    private void simulateCall() {
        requestCount.incrementAndGet();
        try {
            if (latencyMillis > 0) {
                Thread.sleep(latencyMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("Interrupted while calling simulated gateway", e);
        }
        if (failuresToInject.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new GatewayException("Simulated gateway failure");
        }
    }

    private void requireProject(String projectId) {
        if (!projects.containsKey(projectId)) {
            throw new GatewayException("Project " + projectId + " not found");
        }
    }

    private PipelineRun getRunUnchecked(int runId) {
        PipelineRun run = runsById.get(runId);
        if (run == null) {
            throw new GatewayException("Run " + runId + " not found");
        }
        return run;
    }
}
