package com.example.pipelines.data;

import com.example.pipelines.core.CacheProperties;
import com.example.pipelines.core.CacheService;
import com.example.pipelines.eviction.LruEvictionStrategy;
import com.example.pipelines.gateway.GatewayException;
import com.example.pipelines.gateway.PipelineGateway;
import com.example.pipelines.model.Pipeline;
import com.example.pipelines.model.PipelineRun;
import com.example.pipelines.model.Project;
import com.example.pipelines.model.RunParameters;
import com.example.pipelines.model.RunState;
import com.example.pipelines.refresh.NaiveTtlRefreshStrategy;
import com.example.pipelines.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PipelineDataServiceTest {

    private PipelineGateway gateway;
    private CacheService cache;
    private CacheProperties props;
    private MutableClock clock;
    private PipelineDataService service;

    @BeforeEach
    void setUp() {
        gateway = mock(PipelineGateway.class);
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        props = new CacheProperties();
        props.setDefaultTtl(Duration.ofMinutes(5));
        cache = new CacheService(new LruEvictionStrategy(), 100, props.getDefaultTtl(), clock);
        service = new PipelineDataService(gateway, cache, new NaiveTtlRefreshStrategy(), props);
    }

    private static PipelineRun run(int id, int pipelineId, String projectId) {
        return new PipelineRun(id, "#" + id, RunState.IN_PROGRESS, null, Instant.EPOCH, null,
                pipelineId, projectId, null);
    }

    private static List<PipelineRun> runs(int count, int pipelineId, String projectId) {
        List<PipelineRun> out = new ArrayList<>();
        for (int i = count; i >= 1; i--) {
            out.add(run(i, pipelineId, projectId));
        }
        return out;
    }

    @Test
    void projectsAreCachedWithinTtl() {
        when(gateway.listProjects()).thenReturn(List.of(new Project("p1", "One", null, null)));

        service.getProjects();
        service.getProjects();
        verify(gateway, times(1)).listProjects();

        clock.advance(Duration.ofMinutes(6));
        service.getProjects();
        verify(gateway, times(2)).listProjects();
    }

    @Test
    void runsAreFetchedOnceAndSlicedPerCall() {
        when(gateway.listRuns(7, "p1", PipelineDataService.DEFAULT_RUNS_TOP)).thenReturn(runs(10, 7, "p1"));

        List<PipelineRun> top3 = service.getPipelineRuns(7, "p1", 3);
        List<PipelineRun> top50 = service.getPipelineRuns(7, "p1", 50);

        assertEquals(3, top3.size());
        assertEquals(10, top3.get(0).id());
        assertEquals(10, top50.size());
        verify(gateway, times(1)).listRuns(anyInt(), any(), anyInt());
    }

    @Test
    void triggerInvalidatesPipelineRuns() {
        when(gateway.listRuns(anyInt(), eq("p1"), anyInt())).thenReturn(runs(1, 7, "p1"));
        when(gateway.triggerRun(eq(7), eq("p1"), any())).thenReturn(run(2, 7, "p1"));

        service.getPipelineRuns(7, "p1", 50);
        service.triggerPipelineRun(7, "p1", null);
        service.getPipelineRuns(7, "p1", 50);

        verify(gateway, times(2)).listRuns(7, "p1", PipelineDataService.DEFAULT_RUNS_TOP);
        verify(gateway).triggerRun(7, "p1", RunParameters.defaults());
    }

    @Test
    void cancelInvalidatesPipelineRuns() {
        when(gateway.listRuns(anyInt(), eq("p1"), anyInt())).thenReturn(runs(1, 7, "p1"));

        service.getPipelineRuns(7, "p1", 50);
        service.cancelRun(1, 7, "p1");
        service.getPipelineRuns(7, "p1", 50);

        verify(gateway).cancelRun(1, 7, "p1");
        verify(gateway, times(2)).listRuns(7, "p1", PipelineDataService.DEFAULT_RUNS_TOP);
    }

    @Test
    void failedTriggerLeavesCacheUntouched() {
        when(gateway.listRuns(anyInt(), eq("p1"), anyInt())).thenReturn(runs(1, 7, "p1"));
        when(gateway.triggerRun(anyInt(), any(), any())).thenThrow(new GatewayException("503"));

        service.getPipelineRuns(7, "p1", 50);
        assertThrows(PipelineDataException.class, () -> service.triggerPipelineRun(7, "p1", null));

        assertTrue(cache.getEntry(CacheKeys.runs("p1", 7)).isPresent());
    }

    @Test
    void invalidateProjectDoesNotTouchOtherProjects() {
        when(gateway.listPipelines(any())).thenReturn(List.<Pipeline>of());
        when(gateway.listRuns(anyInt(), any(), anyInt())).thenReturn(List.of());

        service.getPipelines("p1");
        service.getPipelines("p10");
        service.getPipelineRuns(1, "p1", 50);
        service.getPipelineRuns(2, "p1", 50);
        service.getPipelineRuns(1, "p10", 50);

        service.invalidateProject("p1");

        assertTrue(cache.getEntry(CacheKeys.pipelines("p1")).isEmpty());
        assertTrue(cache.getEntry(CacheKeys.runs("p1", 1)).isEmpty());
        assertTrue(cache.getEntry(CacheKeys.runs("p1", 2)).isEmpty());
        assertTrue(cache.getEntry(CacheKeys.pipelines("p10")).isPresent());
        assertTrue(cache.getEntry(CacheKeys.runs("p10", 1)).isPresent());
    }

    @Test
    void gatewayFailuresAreWrapped() {
        GatewayException cause = new GatewayException("timeout");
        when(gateway.listProjects()).thenThrow(cause);

        PipelineDataException ex = assertThrows(PipelineDataException.class, service::getProjects);
        assertEquals("Failed to fetch projects", ex.getMessage());
        assertSame(cause, ex.getCause());
        assertEquals(0, cache.size());
    }

    @Test
    void runDetailsAreNeverCached() {
        when(gateway.getRunDetails(1, 7, "p1")).thenReturn(run(1, 7, "p1"));

        service.getRunDetails(1, 7, "p1");
        service.getRunDetails(1, 7, "p1");

        verify(gateway, times(2)).getRunDetails(1, 7, "p1");
        assertEquals(0, cache.size());
    }

    @Test
    void disabledCacheAlwaysHitsGateway() {
        props.setEnabled(false);
        when(gateway.listProjects()).thenReturn(List.of());

        service.getProjects();
        service.getProjects();

        verify(gateway, times(2)).listProjects();
        assertEquals(0, cache.size());
    }

    @Test
    void refreshPipelineBypassesCachedCopy() {
        when(gateway.listRuns(anyInt(), any(), anyInt())).thenReturn(runs(1, 7, "p1"), runs(2, 7, "p1"));

        service.getPipelineRuns(7, "p1", 50);
        List<PipelineRun> refreshed = service.refreshPipeline(7, "p1");

        assertEquals(2, refreshed.size());
    }

    @Test
    void clearCacheEmptiesEverything() {
        when(gateway.listProjects()).thenReturn(List.of());
        service.getProjects();

        service.clearCache();

        assertEquals(0, cache.size());
        assertEquals(0, cache.stats().misses());
    }

    @Test
    void collectionEvictionDropsOnlyThatPipeline() {
        when(gateway.listRuns(anyInt(), any(), anyInt())).thenReturn(List.of());
        service.fetchCollectionRuns(1, "p1");
        service.fetchCollectionRuns(2, "p1");

        service.evictCollection(1, "p1");

        assertTrue(cache.getEntry(CacheKeys.runs("p1", 1)).isEmpty());
        assertTrue(cache.getEntry(CacheKeys.runs("p1", 2)).isPresent());
    }
}
