package com.citeval.runs.controller;

import com.citeval.runs.service.CitationAccuracyRunService;
import com.citeval.runs.service.RunNotFoundException;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/citation-accuracy/runs")
public class CitationRunController {

    private final CitationAccuracyRunService runService;

    public CitationRunController(CitationAccuracyRunService runService) {
        this.runService = runService;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> start(@RequestBody(required = false) StartRunRequest request) {
        UUID runId = runService.startRun(request == null ? null : request.config());
        return ResponseEntity.accepted().body(Map.of("runId", runId));
    }

    @PostMapping("/{runId}/examples")
    public CitationRunResponse recordExample(
        @PathVariable UUID runId,
        @Valid @RequestBody RecordExampleRequest request
    ) {
        return CitationRunResponse.from(runService.recordExample(runId, request.toTally(), request.result()));
    }

    @PostMapping("/{runId}/complete")
    public CitationRunResponse complete(
        @PathVariable UUID runId,
        @Valid @RequestBody(required = false) CompleteRunRequest request
    ) {
        Double accuracy = request == null ? null : request.overallAccuracy();
        return CitationRunResponse.from(runService.completeRun(runId, accuracy));
    }

    @GetMapping("/{runId}")
    public CitationRunResponse getRun(@PathVariable UUID runId) {
        return runService.getRun(runId)
            .map(CitationRunResponse::from)
            .orElseThrow(() -> new RunNotFoundException(runId));
    }

    @GetMapping
    public List<CitationRunResponse> list(
        @RequestParam(required = false) Integer limit,
        @RequestParam(defaultValue = "false") boolean inProgress,
        @RequestParam(required = false) Instant since
    ) {
        return runService.recentRuns(limit, inProgress, since)
            .stream()
            .map(CitationRunResponse::from)
            .toList();
    }
}
