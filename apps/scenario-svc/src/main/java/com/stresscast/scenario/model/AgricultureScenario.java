package com.stresscast.scenario.model;

import java.util.List;

/**
 * @param cropType crop code as received; {@code all} simulates every crop
 */
public record AgricultureScenario(
        double rainfallChangePct,
        double temperatureChangeC,
        double irrigationImprovementPct,
        String cropType,
        String startDate,
        String endDate
) implements ScenarioParameters {

    @Override
    public Domain domain() {
        return Domain.AGRICULTURE;
    }

    @Override
    public List<BoundedValue> boundedValues() {
        return List.of(
                new BoundedValue("Rainfall change", rainfallChangePct, -100, 200, "%"),
                new BoundedValue("Temperature change", temperatureChangeC, -5, 10, "°C"),
                new BoundedValue("Irrigation improvement", irrigationImprovementPct, 0, 100, "%")
        );
    }

    public CropType crop() {
        return CropType.fromCode(cropType).orElse(CropType.ALL);
    }
}
