package com.citeval.runs.controller;

import com.citeval.runs.domain.CitationAccuracyRunEntity;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record CitationRunResponse(
    UUID runId,
    boolean inProgress,
    Instant startedAt,
    Instant completedAt,
    int totalExamples,
    int totalCitations,
    int validCitations,
    int misusedCitations,
    int hallucinatedCitations,
    double overallAccuracy,
    List<Map<String, Object>> results,
    Map<String, Object> config
) {
    public static CitationRunResponse from(CitationAccuracyRunEntity entity) {
        return new CitationRunResponse(
            entity.getRunId(),
            entity.isInProgress(),
            entity.getStartedAt(),
            entity.getCompletedAt(),
            entity.getTotalExamples(),
            entity.getTotalCitations(),
            entity.getValidCitations(),
            entity.getMisusedCitations(),
            entity.getHallucinatedCitations(),
            entity.getOverallAccuracy(),
            entity.getResults() == null ? List.of() : entity.getResults(),
            entity.getConfig() == null ? Map.of() : entity.getConfig()
        );
    }
}
