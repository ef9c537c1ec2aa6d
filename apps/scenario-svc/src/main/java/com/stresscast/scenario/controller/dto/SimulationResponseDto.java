package com.stresscast.scenario.controller.dto;

import com.stresscast.scenario.model.EconomicAnalysis;
import com.stresscast.scenario.model.ScenarioParameters;
import com.stresscast.scenario.model.SimulationResult;
import com.stresscast.scenario.model.SimulationRun;
import com.stresscast.scenario.model.SimulationSummary;
import java.util.List;

/**
 * @param runId {@code not-stored} when the run could not be persisted
 */
public record SimulationResponseDto(
        String runId,
        String domain,
        ScenarioParameters scenario,
        List<SimulationResult> dailyResults,
        SimulationSummary summary,
        EconomicAnalysis economicAnalysis,
        long executionTimeMs,
        String traceId
) {

    public static final String NOT_STORED = "not-stored";

    public static SimulationResponseDto from(SimulationRun run, String traceId) {
        return new SimulationResponseDto(
                run.runId() != null ? run.runId().toString() : NOT_STORED,
                run.domain().code(),
                run.scenario(),
                run.dailyResults(),
                run.summary(),
                run.economicAnalysis(),
                run.executionTimeMs(),
                traceId);
    }
}
