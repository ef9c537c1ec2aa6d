package com.stresscast.scenario.controller;

import com.stresscast.scenario.ai.ScenarioExplainer;
import com.stresscast.scenario.controller.dto.ExplainRequestDto;
import com.stresscast.scenario.model.ScenarioExplanation;
import com.stresscast.scenario.model.SimulationRun;
import com.stresscast.scenario.service.SimulationService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/explain")
public class ExplainController {

    private final SimulationService simulationService;
    private final ScenarioExplainer scenarioExplainer;

    public ExplainController(SimulationService simulationService, ScenarioExplainer scenarioExplainer) {
        this.simulationService = simulationService;
        this.scenarioExplainer = scenarioExplainer;
    }

    @PostMapping
    public ResponseEntity<ScenarioExplanation> explain(@Valid @RequestBody ExplainRequestDto request) {
        SimulationRun run = simulationService.findRun(SimulationController.parseRunId(request.runId()));
        return ResponseEntity.ok(scenarioExplainer.explain(run));
    }
}
