package com.stresscast.scenario.health;

import com.stresscast.scenario.runs.SimulationRunRetentionManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class HealthzControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    SimulationRunRetentionManager retentionManager;

    @Test
    void healthzReportsUpWithStoreAndDomains() throws Exception {
        mockMvc.perform(get("/healthz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.store").value("memory"))
                .andExpect(jsonPath("$.domains[0]").value("energy"))
                .andExpect(jsonPath("$.domains.length()").value(3))
                .andExpect(jsonPath("$.runRetention.retentionDays").value(30));
    }

    @Test
    void healthzReportsLatestPurge() throws Exception {
        retentionManager.purgeNow();

        mockMvc.perform(get("/healthz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runRetention.lastPurgeTrigger").value("manual"))
                .andExpect(jsonPath("$.runRetention.lastPurgeRemoved").value(0))
                .andExpect(jsonPath("$.runRetention.lastPurgeFailed").value(false))
                .andExpect(jsonPath("$.runRetention.lastPurgeAt").isNotEmpty());
    }
}
