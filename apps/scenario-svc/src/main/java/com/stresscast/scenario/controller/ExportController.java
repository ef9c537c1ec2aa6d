package com.stresscast.scenario.controller;

import com.stresscast.scenario.export.ResultCsvExporter;
import com.stresscast.scenario.model.SimulationRun;
import com.stresscast.scenario.service.SimulationService;
import java.nio.charset.StandardCharsets;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/runs/{runId}")
public class ExportController {

    static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final SimulationService simulationService;

    public ExportController(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    @GetMapping("/export.csv")
    public ResponseEntity<String> exportDaily(@PathVariable("runId") String runId) {
        SimulationRun run = simulationService.findRun(SimulationController.parseRunId(runId));
        return csv(ResultCsvExporter.dailyResults(run.dailyResults()),
                "stresscast-" + run.domain().code() + "-" + run.runId() + ".csv");
    }

    @GetMapping("/summary.csv")
    public ResponseEntity<String> exportSummary(@PathVariable("runId") String runId) {
        SimulationRun run = simulationService.findRun(SimulationController.parseRunId(runId));
        return csv(ResultCsvExporter.topRegions(run.summary().topStressedRegions()),
                "stresscast-" + run.domain().code() + "-" + run.runId() + "-summary.csv");
    }

    private ResponseEntity<String> csv(String body, String filename) {
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment().filename(filename).build().toString())
                .body(body);
    }
}
