package com.stresscast.scenario.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stresscast.scenario.entity.SimulationRunEntity;
import com.stresscast.scenario.model.AgricultureScenario;
import com.stresscast.scenario.model.Domain;
import com.stresscast.scenario.model.EconomicAnalysis;
import com.stresscast.scenario.model.EnergyScenario;
import com.stresscast.scenario.model.ScenarioParameters;
import com.stresscast.scenario.model.SimulationResult;
import com.stresscast.scenario.model.SimulationRun;
import com.stresscast.scenario.model.SimulationSummary;
import com.stresscast.scenario.model.WaterScenario;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@ConditionalOnProperty(prefix = "stresscast", name = "store", havingValue = "jpa", matchIfMissing = true)
public class PostgreSQLSimulationRunRepository implements SimulationRunRepository {

    private final JpaSimulationRunRepository jpaSimulationRunRepository;
    private final ObjectMapper objectMapper;

    public PostgreSQLSimulationRunRepository(JpaSimulationRunRepository jpaSimulationRunRepository, ObjectMapper objectMapper) {
        this.jpaSimulationRunRepository = jpaSimulationRunRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    public SimulationRun save(SimulationRun run) {
        UUID id = run.runId() != null ? run.runId() : UUID.randomUUID();
        Instant createdAt = run.createdAt() != null ? run.createdAt() : Instant.now();
        StoredResults results = new StoredResults(run.dailyResults(), run.summary(), run.economicAnalysis());
        SimulationRunEntity entity = new SimulationRunEntity(
                id,
                run.domain().code(),
                write(run.scenario()),
                write(results),
                run.executionTimeMs(),
                createdAt);
        jpaSimulationRunRepository.save(entity);
        return new SimulationRun(id, run.domain(), run.scenario(), run.dailyResults(), run.summary(),
                run.economicAnalysis(), run.executionTimeMs(), createdAt);
    }

    @Override
    public Optional<SimulationRun> findById(UUID runId) {
        return jpaSimulationRunRepository.findById(runId).map(this::toModel);
    }

    @Override
    @Transactional
    public int deleteCreatedBefore(Instant cutoff) {
        return jpaSimulationRunRepository.deleteCreatedBefore(cutoff);
    }

    private SimulationRun toModel(SimulationRunEntity entity) {
        Domain domain = Domain.fromCode(entity.getDomain());
        try {
            ScenarioParameters scenario = objectMapper.readValue(entity.getScenario(), scenarioType(domain));
            StoredResults results = objectMapper.readValue(entity.getResults(), StoredResults.class);
            return new SimulationRun(
                    entity.getId(),
                    domain,
                    scenario,
                    results.dailyResults() != null ? results.dailyResults() : List.of(),
                    results.summary(),
                    results.economicAnalysis(),
                    entity.getExecutionTimeMs(),
                    entity.getCreatedAt());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored run " + entity.getId() + " could not be read", ex);
        }
    }

    private static Class<? extends ScenarioParameters> scenarioType(Domain domain) {
        return switch (domain) {
            case ENERGY -> EnergyScenario.class;
            case WATER -> WaterScenario.class;
            case AGRICULTURE -> AgricultureScenario.class;
        };
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize simulation run", ex);
        }
    }

    record StoredResults(List<SimulationResult> dailyResults, SimulationSummary summary, EconomicAnalysis economicAnalysis) {
    }
}
