package com.stresscast.scenario.service;

import java.util.UUID;

public class RunNotFoundException extends RuntimeException {

    private final UUID runId;

    public RunNotFoundException(UUID runId) {
        super("Simulation run not found: " + runId);
        this.runId = runId;
    }

    public UUID getRunId() {
        return runId;
    }
}
