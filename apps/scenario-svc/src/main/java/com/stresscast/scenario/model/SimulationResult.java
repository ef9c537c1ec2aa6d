package com.stresscast.scenario.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDate;

/**
 * Projected demand, supply and stress for one region on one day.
 *
 * @param unmetDemand only set for domains that track shortage volume
 * @param crop only set for agriculture runs
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SimulationResult(
        LocalDate date,
        String regionId,
        String regionName,
        double demand,
        double supply,
        double stress,
        Double unmetDemand,
        CropOutcome crop
) {

    public record CropOutcome(String cropType, double baselineYieldKg, double actualYieldKg, double yieldChangePct) {
    }
}
