package com.stresscast.scenario.model;

import java.util.List;

public record EnergyScenario(
        double solarGrowthPct,
        double rainfallChangePct,
        String startDate,
        String endDate
) implements ScenarioParameters {

    @Override
    public Domain domain() {
        return Domain.ENERGY;
    }

    @Override
    public List<BoundedValue> boundedValues() {
        return List.of(
                new BoundedValue("Solar growth", solarGrowthPct, -100, 200, "%"),
                new BoundedValue("Rainfall change", rainfallChangePct, -100, 200, "%")
        );
    }
}
