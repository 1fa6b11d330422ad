package com.example.pipelines.backend;

import com.example.pipelines.gateway.GatewayException;
import com.example.pipelines.model.PipelineRun;
import com.example.pipelines.model.RunParameters;
import com.example.pipelines.model.RunResult;
import com.example.pipelines.model.RunState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedPipelineGatewayTest {

    private SimulatedPipelineGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new SimulatedPipelineGateway(new GatewayProperties());
        gateway.seedDemoData();
    }

    @Test
    void demoDataIsServed() {
        assertEquals(1, gateway.listProjects().size());
        assertEquals(2, gateway.listPipelines("demo").size());

        List<PipelineRun> runs = gateway.listRuns(1, "demo", 10);
        assertEquals(2, runs.size());
        assertTrue(runs.get(0).id() > runs.get(1).id());
        assertEquals(3, gateway.getRequestCount());
    }

    @Test
    void triggeredRunProgressesToCompletion() {
        PipelineRun run = gateway.triggerRun(2, "demo", RunParameters.defaults());
        assertEquals(RunState.IN_PROGRESS, run.state());

        gateway.completeRun(run.id(), RunResult.SUCCEEDED);

        PipelineRun details = gateway.getRunDetails(run.id(), 2, "demo");
        assertEquals(RunState.COMPLETED, details.state());
        assertEquals(RunResult.SUCCEEDED, details.result());
        assertNotNull(details.finishedDate());
    }

    @Test
    void cancelOnlyAffectsUnfinishedRuns() {
        PipelineRun running = gateway.addRun("demo", 1, RunState.IN_PROGRESS, null);
        PipelineRun done = gateway.addRun("demo", 1, RunState.COMPLETED, RunResult.FAILED);

        gateway.cancelRun(running.id(), 1, "demo");
        gateway.cancelRun(done.id(), 1, "demo");

        assertEquals(RunState.CANCELLING, gateway.getRunDetails(running.id(), 1, "demo").state());
        assertEquals(RunState.COMPLETED, gateway.getRunDetails(done.id(), 1, "demo").state());
    }

    @Test
    void unknownEntitiesFail() {
        assertThrows(GatewayException.class, () -> gateway.listPipelines("nope"));
        assertThrows(GatewayException.class, () -> gateway.getRunDetails(99_999, 1, "demo"));
    }

    @Test
    void injectedFailuresAreConsumed() {
        gateway.failNext(2);

        assertThrows(GatewayException.class, gateway::listProjects);
        assertThrows(GatewayException.class, gateway::listProjects);
        assertEquals(1, gateway.listProjects().size());

        assertEquals(3, gateway.getRequestCount());
        gateway.resetCount();
        assertEquals(0, gateway.getRequestCount());
    }
}
