package com.stresscast.scenario.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stresscast.scenario.controller.dto.AgricultureSimulationRequestDto;
import com.stresscast.scenario.controller.dto.EnergySimulationRequestDto;
import com.stresscast.scenario.controller.dto.WaterSimulationRequestDto;
import com.stresscast.scenario.model.Domain;
import com.stresscast.scenario.model.ScenarioParameters;
import com.stresscast.scenario.model.ValidationResult;
import com.stresscast.scenario.service.SimulationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Dry-run check of scenario parameters. Missing numbers are reported by the validator
 * instead of failing request binding.
 */
@RestController
@RequestMapping("/api/validate")
public class ValidationController {

    private final SimulationService simulationService;
    private final ObjectMapper objectMapper;

    public ValidationController(SimulationService simulationService, ObjectMapper objectMapper) {
        this.simulationService = simulationService;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/{domain}")
    public ResponseEntity<ValidationResult> validate(@PathVariable("domain") String domain, @RequestBody JsonNode body) {
        ScenarioParameters scenario = switch (Domain.fromCode(domain)) {
            case ENERGY -> objectMapper.convertValue(body, EnergySimulationRequestDto.class).toScenario();
            case WATER -> objectMapper.convertValue(body, WaterSimulationRequestDto.class).toScenario();
            case AGRICULTURE -> objectMapper.convertValue(body, AgricultureSimulationRequestDto.class).toScenario();
        };
        return ResponseEntity.ok(simulationService.validate(scenario));
    }
}
