package com.stresscast.scenario.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A completed simulation as returned to callers and kept by the run store.
 *
 * @param runId {@code null} until the run has been stored
 */
public record SimulationRun(
        UUID runId,
        Domain domain,
        ScenarioParameters scenario,
        List<SimulationResult> dailyResults,
        SimulationSummary summary,
        EconomicAnalysis economicAnalysis,
        long executionTimeMs,
        Instant createdAt
) {

    public SimulationRun withRunId(UUID id) {
        return new SimulationRun(id, domain, scenario, dailyResults, summary, economicAnalysis, executionTimeMs, createdAt);
    }
}
