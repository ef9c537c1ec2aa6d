package com.stresscast.scenario.controller.dto;

import com.stresscast.scenario.model.AgricultureScenario;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import static com.stresscast.scenario.controller.dto.EnergySimulationRequestDto.orNaN;

/**
 * @param cropType optional; defaults to {@code all}
 */
public record AgricultureSimulationRequestDto(
        @NotNull Double rainfallChangePct,
        @NotNull Double temperatureChangeC,
        @NotNull Double irrigationImprovementPct,
        String cropType,
        @NotBlank String startDate,
        @NotBlank String endDate
) {

    public AgricultureScenario toScenario() {
        return new AgricultureScenario(orNaN(rainfallChangePct), orNaN(temperatureChangeC), orNaN(irrigationImprovementPct),
                cropType == null || cropType.isBlank() ? "all" : cropType, startDate, endDate);
    }
}
