package com.stresscast.scenario.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SimulationSummary(
        double avgStress,
        double maxStress,
        int criticalDays,
        Double totalUnmetDemand,
        YieldImpact yieldImpact,
        List<TopStressedRegion> topStressedRegions
) {

    public static SimulationSummary empty(Domain domain) {
        return new SimulationSummary(
                0,
                0,
                0,
                domain.tracksUnmetDemand() ? 0.0 : null,
                domain == Domain.AGRICULTURE ? YieldImpact.none() : null,
                List.of());
    }

    public record TopStressedRegion(String regionId, String regionName, double avgStress) {
    }

    /**
     * @param yieldLossKgPerHectareByCrop mean per-hectare loss for each simulated crop code
     */
    public record YieldImpact(
            double totalYieldLossKg,
            double totalYieldLossPct,
            String mostAffectedCrop,
            Map<String, Double> yieldLossKgPerHectareByCrop
    ) {
        public static YieldImpact none() {
            return new YieldImpact(0, 0, null, Map.of());
        }
    }
}
