package com.stresscast.scenario.model;

import java.util.List;

public record WaterScenario(
        double waterDemandGrowthPct,
        double rainfallChangePct,
        double conservationRatePct,
        String startDate,
        String endDate
) implements ScenarioParameters {

    @Override
    public Domain domain() {
        return Domain.WATER;
    }

    @Override
    public List<BoundedValue> boundedValues() {
        return List.of(
                new BoundedValue("Water demand growth", waterDemandGrowthPct, -50, 200, "%"),
                new BoundedValue("Rainfall change", rainfallChangePct, -100, 200, "%"),
                new BoundedValue("Conservation rate", conservationRatePct, 0, 100, "%")
        );
    }
}
