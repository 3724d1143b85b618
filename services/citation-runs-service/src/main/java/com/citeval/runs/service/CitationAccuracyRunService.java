package com.citeval.runs.service;

import com.citeval.runs.config.CitationRunsProperties;
import com.citeval.runs.domain.CitationAccuracyRunEntity;
import com.citeval.runs.domain.CitationTally;
import com.citeval.runs.repository.CitationAccuracyRunRepository;
import jakarta.transaction.Transactional;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

@Service
public class CitationAccuracyRunService {

    private static final Logger LOGGER = LoggerFactory.getLogger(CitationAccuracyRunService.class);

    private final CitationAccuracyRunRepository runRepository;
    private final CitationRunsProperties properties;

    public CitationAccuracyRunService(CitationAccuracyRunRepository runRepository, CitationRunsProperties properties) {
        this.runRepository = runRepository;
        this.properties = properties;
    }

    @Transactional
    public UUID startRun(Map<String, Object> config) {
        CitationAccuracyRunEntity run = runRepository.save(CitationAccuracyRunEntity.startNew(config));
        LOGGER.info("Started citation accuracy run {}", run.getRunId());
        return run.getRunId();
    }

    @Transactional
    public CitationAccuracyRunEntity recordExample(UUID runId, CitationTally tally, Map<String, Object> result) {
        CitationAccuracyRunEntity run = requireRun(runId);
        run.recordExample(tally, result);
        return runRepository.save(run);
    }

    @Transactional
    public CitationAccuracyRunEntity completeRun(UUID runId, Double overallAccuracy) {
        if (overallAccuracy != null && (overallAccuracy.isNaN() || overallAccuracy < 0.0 || overallAccuracy > 1.0)) {
            throw new IllegalArgumentException("overallAccuracy must be within [0, 1]: " + overallAccuracy);
        }
        CitationAccuracyRunEntity run = requireRun(runId);
        if (!run.hasConsistentCitationCounts()) {
            LOGGER.warn(
                "Run {} classifies more citations than it counted: valid={} misused={} hallucinated={} total={}",
                runId,
                run.getValidCitations(),
                run.getMisusedCitations(),
                run.getHallucinatedCitations(),
                run.getTotalCitations()
            );
        }
        double accuracy = overallAccuracy == null ? validShare(run) : overallAccuracy;
        run.complete(accuracy);
        CitationAccuracyRunEntity saved = runRepository.save(run);
        LOGGER.info("Completed citation accuracy run {} with {} examples, accuracy {}",
            runId, saved.getTotalExamples(), accuracy);
        return saved;
    }

    public Optional<CitationAccuracyRunEntity> getRun(UUID runId) {
        return runRepository.findById(runId);
    }

    public List<CitationAccuracyRunEntity> recentRuns(Integer limit, boolean inProgressOnly, Instant since) {
        Pageable page = PageRequest.of(0, clampLimit(limit));
        if (inProgressOnly) {
            return since == null
                ? runRepository.findByCompletedAtIsNullOrderByStartedAtDesc(page)
                : runRepository.findByCompletedAtIsNullAndStartedAtGreaterThanEqualOrderByStartedAtDesc(since, page);
        }
        return since == null
            ? runRepository.findAllByOrderByStartedAtDesc(page)
            : runRepository.findByStartedAtGreaterThanEqualOrderByStartedAtDesc(since, page);
    }

    private CitationAccuracyRunEntity requireRun(UUID runId) {
        return runRepository.findByIdForUpdate(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    private int clampLimit(Integer limit) {
        int requested = limit == null ? properties.getDefaultRecentLimit() : limit;
        return Math.max(1, Math.min(requested, properties.getMaxRecentLimit()));
    }

    private double validShare(CitationAccuracyRunEntity run) {
        if (run.getTotalCitations() == 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) run.getValidCitations() / run.getTotalCitations());
    }
}
