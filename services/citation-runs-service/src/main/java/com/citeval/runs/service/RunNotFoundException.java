package com.citeval.runs.service;

import java.util.UUID;

public class RunNotFoundException extends RuntimeException {

    private final UUID runId;

    public RunNotFoundException(UUID runId) {
        super("Run not found: " + runId);
        this.runId = runId;
    }

    public UUID getRunId() {
        return runId;
    }
}
