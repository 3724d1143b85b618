package com.citeval.runs.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "citation_accuracy_runs")
public class CitationAccuracyRunEntity {

    @Id
    @Column(name = "run_id", nullable = false, updatable = false)
    private UUID runId;

    @Column(name = "started_at", updatable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "total_examples", nullable = false)
    private int totalExamples;

    @Column(name = "total_citations", nullable = false)
    private int totalCitations;

    @Column(name = "valid_citations", nullable = false)
    private int validCitations;

    @Column(name = "misused_citations", nullable = false)
    private int misusedCitations;

    @Column(name = "hallucinated_citations", nullable = false)
    private int hallucinatedCitations;

    @Column(name = "overall_accuracy", nullable = false)
    private double overallAccuracy;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "results", nullable = false)
    private List<Map<String, Object>> results = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "config")
    private Map<String, Object> config = new LinkedHashMap<>();

    protected CitationAccuracyRunEntity() {
    }

    public static CitationAccuracyRunEntity startNew(Map<String, Object> config) {
        CitationAccuracyRunEntity run = new CitationAccuracyRunEntity();
        run.runId = UUID.randomUUID();
        // TIMESTAMPTZ keeps microseconds
        run.startedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
        if (config != null) {
            run.config = new LinkedHashMap<>(config);
        }
        return run;
    }

    public void recordExample(CitationTally tally, Map<String, Object> result) {
        ensureInProgress();
        int examples = add("totalExamples", totalExamples, 1);
        int citations = add("totalCitations", totalCitations, tally.citations());
        int valid = add("validCitations", validCitations, tally.valid());
        int misused = add("misusedCitations", misusedCitations, tally.misused());
        int hallucinated = add("hallucinatedCitations", hallucinatedCitations, tally.hallucinated());
        this.totalExamples = examples;
        this.totalCitations = citations;
        this.validCitations = valid;
        this.misusedCitations = misused;
        this.hallucinatedCitations = hallucinated;
        if (result != null) {
            List<Map<String, Object>> appended = new ArrayList<>(results);
            appended.add(new LinkedHashMap<>(result));
            this.results = appended;
        }
    }

    public void complete(double overallAccuracy) {
        ensureInProgress();
        this.overallAccuracy = overallAccuracy;
        this.completedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    public boolean isInProgress() {
        return completedAt == null;
    }

    public boolean hasConsistentCitationCounts() {
        return (long) validCitations + misusedCitations + hallucinatedCitations <= totalCitations;
    }

    private static int add(String counter, int current, int increment) {
        try {
            return Math.addExact(current, increment);
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException(counter + " would exceed " + Integer.MAX_VALUE, ex);
        }
    }

    private void ensureInProgress() {
        if (!isInProgress()) {
            throw new IllegalStateException("Run already completed: " + runId);
        }
    }

    public UUID getRunId() {
        return runId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public int getTotalExamples() {
        return totalExamples;
    }

    public int getTotalCitations() {
        return totalCitations;
    }

    public int getValidCitations() {
        return validCitations;
    }

    public int getMisusedCitations() {
        return misusedCitations;
    }

    public int getHallucinatedCitations() {
        return hallucinatedCitations;
    }

    public double getOverallAccuracy() {
        return overallAccuracy;
    }

    public List<Map<String, Object>> getResults() {
        return results;
    }

    public Map<String, Object> getConfig() {
        return config;
    }
}
