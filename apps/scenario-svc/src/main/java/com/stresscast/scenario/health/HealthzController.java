package com.stresscast.scenario.health;

import com.stresscast.scenario.config.StresscastProperties;
import com.stresscast.scenario.model.Domain;
import com.stresscast.scenario.runs.SimulationRunRetentionManager;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness probe for load balancers. Reports the configured run store, the simulated domains and
 * the latest run purge; dependency health stays on Actuator.
 */
@RestController
public class HealthzController {

    private final StresscastProperties properties;
    private final SimulationRunRetentionManager retentionManager;

    public HealthzController(StresscastProperties properties, SimulationRunRetentionManager retentionManager) {
        this.properties = properties;
        this.retentionManager = retentionManager;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> healthz() {
        List<String> domains = Arrays.stream(Domain.values()).map(Domain::code).toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("store", properties.store());
        body.put("domains", domains);
        body.put("runRetention", runRetention());
        return body;
    }

    private Map<String, Object> runRetention() {
        Map<String, Object> retention = new LinkedHashMap<>();
        retention.put("retentionDays", retentionManager.retentionPeriod().toDays());
        retentionManager.lastPurge().ifPresent(report -> {
            retention.put("lastPurgeAt", report.completedAt().toString());
            retention.put("lastPurgeTrigger", report.trigger().name().toLowerCase(Locale.ROOT));
            retention.put("lastPurgeRemoved", report.removed());
            retention.put("lastPurgeFailed", report.failed());
        });
        return retention;
    }
}
