package com.stresscast.scenario.controller.dto;

import com.stresscast.scenario.model.EnergyScenario;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record EnergySimulationRequestDto(
        @NotNull Double solarGrowthPct,
        @NotNull Double rainfallChangePct,
        @NotBlank String startDate,
        @NotBlank String endDate
) {

    public EnergyScenario toScenario() {
        return new EnergyScenario(orNaN(solarGrowthPct), orNaN(rainfallChangePct), startDate, endDate);
    }

    static double orNaN(Double value) {
        return value != null ? value : Double.NaN;
    }
}
