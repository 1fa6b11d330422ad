package com.example.pipelines.api;

import com.example.pipelines.data.PipelineDataException;
import com.example.pipelines.data.PipelineDataService;
import com.example.pipelines.gateway.GatewayException;
import com.example.pipelines.model.Pipeline;
import com.example.pipelines.model.PipelineRun;
import com.example.pipelines.model.Project;
import com.example.pipelines.model.RunParameters;
import com.example.pipelines.model.RunState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class PipelineControllerTest {

    private PipelineDataService data;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        data = mock(PipelineDataService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new PipelineController(data)).build();
    }

    private static PipelineRun run(int id) {
        return new PipelineRun(id, "#" + id, RunState.IN_PROGRESS, null,
                Instant.parse("2024-01-01T00:00:00Z"), null, 7, "p1", null);
    }

    /* ---------- reads ---------- */

    @Test
    void listsProjects() throws Exception {
        when(data.getProjects()).thenReturn(List.of(new Project("p1", "One", null, null)));

        mockMvc.perform(get("/api/projects"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("p1"))
                .andExpect(jsonPath("$[0].name").value("One"));
    }

    @Test
    void listsPipelines() throws Exception {
        when(data.getPipelines("p1")).thenReturn(List.of(new Pipeline(7, "build", "p1", "\\", 1, null)));

        mockMvc.perform(get("/api/projects/p1/pipelines"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].id").value(7));
    }

    @Test
    void runsUseDefaultTop() throws Exception {
        when(data.getPipelineRuns(7, "p1", PipelineDataService.DEFAULT_RUNS_TOP)).thenReturn(List.of(run(2), run(1)));

        mockMvc.perform(get("/api/projects/p1/pipelines/7/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].state").value("IN_PROGRESS"));
    }

    @Test
    void runsHonourTop() throws Exception {
        when(data.getPipelineRuns(7, "p1", 1)).thenReturn(List.of(run(2)));

        mockMvc.perform(get("/api/projects/p1/pipelines/7/runs").param("top", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void runDetails() throws Exception {
        when(data.getRunDetails(3, 7, "p1")).thenReturn(run(3));

        mockMvc.perform(get("/api/projects/p1/pipelines/7/runs/3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(3))
                .andExpect(jsonPath("$.pipelineId").value(7));
    }

    /* ---------- mutations ---------- */

    @Test
    void triggerWithBranch() throws Exception {
        when(data.triggerPipelineRun(anyInt(), any(), any())).thenReturn(run(9));

        mockMvc.perform(post("/api/projects/p1/pipelines/7/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceBranch\":\"refs/heads/dev\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(9));

        verify(data).triggerPipelineRun(7, "p1", new RunParameters("refs/heads/dev", Map.of()));
    }

    @Test
    void triggerWithoutBody() throws Exception {
        when(data.triggerPipelineRun(anyInt(), any(), isNull())).thenReturn(run(9));

        mockMvc.perform(post("/api/projects/p1/pipelines/7/runs"))
                .andExpect(status().isOk());

        verify(data).triggerPipelineRun(7, "p1", null);
    }

    @Test
    void cancel() throws Exception {
        mockMvc.perform(post("/api/projects/p1/pipelines/7/runs/3/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value(3))
                .andExpect(jsonPath("$.cancelRequested").value(true));

        verify(data).cancelRun(3, 7, "p1");
    }

    @Test
    void refreshProject() throws Exception {
        when(data.refreshProject("p1")).thenReturn(List.of());

        mockMvc.perform(post("/api/projects/p1/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        verify(data).refreshProject("p1");
    }

    /* ---------- failures ---------- */

    @Test
    void dataFailureMapsToBadGateway() throws Exception {
        when(data.getProjects()).thenThrow(
                new PipelineDataException("Failed to fetch projects", new GatewayException("timeout")));

        mockMvc.perform(get("/api/projects"))
                .andExpect(status().isBadGateway());
    }

    @Test
    void cancelFailureMapsToBadGateway() throws Exception {
        doThrow(new PipelineDataException("Failed to cancel run 3", new GatewayException("409")))
                .when(data).cancelRun(3, 7, "p1");

        mockMvc.perform(post("/api/projects/p1/pipelines/7/runs/3/cancel"))
                .andExpect(status().isBadGateway());
    }
}
