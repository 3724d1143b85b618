package com.citeval.runs.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.citeval.runs.domain.CitationAccuracyRunEntity;
import com.citeval.runs.domain.CitationTally;
import com.citeval.runs.service.CitationAccuracyRunService;
import com.citeval.runs.service.RunNotFoundException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = CitationRunController.class)
class CitationRunControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    CitationAccuracyRunService runService;

    @Test
    void startReturnsAcceptedWithRunId() throws Exception {
        UUID runId = UUID.randomUUID();
        when(runService.startRun(Map.of("model", "judge-v1"))).thenReturn(runId);

        mvc.perform(post("/v1/citation-accuracy/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"config\":{\"model\":\"judge-v1\"}}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.runId").value(runId.toString()));
    }

    @Test
    void startWithoutBodyPassesNoConfig() throws Exception {
        UUID runId = UUID.randomUUID();
        when(runService.startRun(isNull())).thenReturn(runId);

        mvc.perform(post("/v1/citation-accuracy/runs"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.runId").value(runId.toString()));
    }

    @Test
    void getRunReturnsEveryColumn() throws Exception {
        CitationAccuracyRunEntity run = CitationAccuracyRunEntity.startNew(Map.of("threshold", "0.7"));
        run.recordExample(new CitationTally(120, 100, 15, 5), Map.of("exampleId", "ex-9"));
        run.complete(0.833);
        when(runService.getRun(run.getRunId())).thenReturn(Optional.of(run));

        mvc.perform(get("/v1/citation-accuracy/runs/{runId}", run.getRunId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.runId").value(run.getRunId().toString()))
            .andExpect(jsonPath("$.inProgress").value(false))
            .andExpect(jsonPath("$.totalExamples").value(1))
            .andExpect(jsonPath("$.totalCitations").value(120))
            .andExpect(jsonPath("$.validCitations").value(100))
            .andExpect(jsonPath("$.misusedCitations").value(15))
            .andExpect(jsonPath("$.hallucinatedCitations").value(5))
            .andExpect(jsonPath("$.overallAccuracy").value(0.833))
            .andExpect(jsonPath("$.results[0].exampleId").value("ex-9"))
            .andExpect(jsonPath("$.config.threshold").value("0.7"))
            .andExpect(jsonPath("$.startedAt").isNotEmpty())
            .andExpect(jsonPath("$.completedAt").isNotEmpty());
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        UUID runId = UUID.randomUUID();
        when(runService.getRun(runId)).thenReturn(Optional.empty());

        mvc.perform(get("/v1/citation-accuracy/runs/{runId}", runId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void recordExampleRejectsNegativeCounts() throws Exception {
        mvc.perform(post("/v1/citation-accuracy/runs/{runId}/examples", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"citations\":3,\"valid\":-1,\"misused\":0,\"hallucinated\":0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("validation_error"));

        verify(runService, never()).recordExample(any(), any(), any());
    }

    @Test
    void recordExamplePassesTallyAndResult() throws Exception {
        CitationAccuracyRunEntity run = CitationAccuracyRunEntity.startNew(Map.of());
        run.recordExample(new CitationTally(2, 1, 1, 0), Map.of("exampleId", "ex-1"));
        when(runService.recordExample(
            eq(run.getRunId()),
            eq(new CitationTally(2, 1, 1, 0)),
            eq(Map.of("exampleId", "ex-1"))
        )).thenReturn(run);

        mvc.perform(post("/v1/citation-accuracy/runs/{runId}/examples", run.getRunId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"citations\":2,\"valid\":1,\"misused\":1,\"hallucinated\":0,"
                    + "\"result\":{\"exampleId\":\"ex-1\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.inProgress").value(true))
            .andExpect(jsonPath("$.misusedCitations").value(1));
    }

    @Test
    void completeRejectsAccuracyAboveOne() throws Exception {
        mvc.perform(post("/v1/citation-accuracy/runs/{runId}/complete", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"overallAccuracy\":1.5}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("validation_error"));
    }

    @Test
    void completingFinishedRunConflicts() throws Exception {
        UUID runId = UUID.randomUUID();
        when(runService.completeRun(runId, 0.9)).thenThrow(new IllegalStateException("Run already completed: " + runId));

        mvc.perform(post("/v1/citation-accuracy/runs/{runId}/complete", runId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"overallAccuracy\":0.9}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("conflict"));
    }

    @Test
    void completeOnMissingRunIsNotFound() throws Exception {
        UUID runId = UUID.randomUUID();
        when(runService.completeRun(runId, null)).thenThrow(new RunNotFoundException(runId));

        mvc.perform(post("/v1/citation-accuracy/runs/{runId}/complete", runId))
            .andExpect(status().isNotFound());
    }

    @Test
    void listForwardsFilters() throws Exception {
        Instant since = Instant.parse("2026-04-01T00:00:00Z");
        CitationAccuracyRunEntity run = CitationAccuracyRunEntity.startNew(Map.of());
        when(runService.recentRuns(5, true, since)).thenReturn(List.of(run));

        mvc.perform(get("/v1/citation-accuracy/runs")
                .param("limit", "5")
                .param("inProgress", "true")
                .param("since", "2026-04-01T00:00:00Z"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].runId").value(run.getRunId().toString()))
            .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void malformedRunIdIsBadRequest() throws Exception {
        mvc.perform(get("/v1/citation-accuracy/runs/{runId}", "not-a-uuid"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    void malformedSinceIsBadRequest() throws Exception {
        mvc.perform(get("/v1/citation-accuracy/runs").param("since", "yesterday"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));

        verify(runService, never()).recentRuns(any(), anyBoolean(), any());
    }

    @Test
    void unreadableBodyIsBadRequest() throws Exception {
        mvc.perform(post("/v1/citation-accuracy/runs/{runId}/examples", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"citations\":"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    void counterOverflowIsBadRequest() throws Exception {
        UUID runId = UUID.randomUUID();
        when(runService.recordExample(eq(runId), any(), any()))
            .thenThrow(new IllegalArgumentException("totalCitations would exceed 2147483647"));

        mvc.perform(post("/v1/citation-accuracy/runs/{runId}/examples", runId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"citations\":2000000000,\"valid\":0,\"misused\":0,\"hallucinated\":0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
    }
}
