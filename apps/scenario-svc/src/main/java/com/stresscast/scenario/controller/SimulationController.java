package com.stresscast.scenario.controller;

import com.stresscast.scenario.controller.dto.AgricultureSimulationRequestDto;
import com.stresscast.scenario.controller.dto.EnergySimulationRequestDto;
import com.stresscast.scenario.controller.dto.SimulationResponseDto;
import com.stresscast.scenario.controller.dto.WaterSimulationRequestDto;
import com.stresscast.scenario.model.Domain;
import com.stresscast.scenario.model.SimulationRun;
import com.stresscast.scenario.service.RunNotFoundException;
import com.stresscast.scenario.service.SimulationService;
import com.stresscast.scenario.web.RequestContextHolder;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class SimulationController {

    private final SimulationService simulationService;

    public SimulationController(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    @PostMapping("/simulate")
    public ResponseEntity<SimulationResponseDto> simulateEnergy(@Valid @RequestBody EnergySimulationRequestDto request) {
        return respond(simulationService.simulateEnergy(request.toScenario()));
    }

    @PostMapping("/simulate-water")
    public ResponseEntity<SimulationResponseDto> simulateWater(@Valid @RequestBody WaterSimulationRequestDto request) {
        return respond(simulationService.simulateWater(request.toScenario()));
    }

    @PostMapping("/simulate-agriculture")
    public ResponseEntity<SimulationResponseDto> simulateAgriculture(@Valid @RequestBody AgricultureSimulationRequestDto request) {
        return respond(simulationService.simulateAgriculture(request.toScenario()));
    }

    @GetMapping("/simulate")
    public ResponseEntity<SimulationResponseDto> getEnergyRun(@RequestParam("run_id") String runId) {
        return respond(findRun(runId, Domain.ENERGY));
    }

    @GetMapping("/simulate-water")
    public ResponseEntity<SimulationResponseDto> getWaterRun(@RequestParam("run_id") String runId) {
        return respond(findRun(runId, Domain.WATER));
    }

    @GetMapping("/simulate-agriculture")
    public ResponseEntity<SimulationResponseDto> getAgricultureRun(@RequestParam("run_id") String runId) {
        return respond(findRun(runId, Domain.AGRICULTURE));
    }

    private SimulationRun findRun(String rawRunId, Domain domain) {
        UUID runId = parseRunId(rawRunId);
        SimulationRun run = simulationService.findRun(runId);
        // A run id from another domain is reported as missing on this path.
        if (run.domain() != domain) {
            throw new RunNotFoundException(runId);
        }
        return run;
    }

    static UUID parseRunId(String raw) {
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("run_id must be a UUID");
        }
    }

    private ResponseEntity<SimulationResponseDto> respond(SimulationRun run) {
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.ok(SimulationResponseDto.from(run, traceId));
    }
}
