package com.stresscast.scenario.controller.dto;

import com.stresscast.scenario.model.WaterScenario;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import static com.stresscast.scenario.controller.dto.EnergySimulationRequestDto.orNaN;

public record WaterSimulationRequestDto(
        @NotNull Double waterDemandGrowthPct,
        @NotNull Double rainfallChangePct,
        @NotNull Double conservationRatePct,
        @NotBlank String startDate,
        @NotBlank String endDate
) {

    public WaterScenario toScenario() {
        return new WaterScenario(orNaN(waterDemandGrowthPct), orNaN(rainfallChangePct), orNaN(conservationRatePct),
                startDate, endDate);
    }
}
