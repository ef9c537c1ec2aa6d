package com.stresscast.scenario.repository;

import com.stresscast.scenario.model.SimulationRun;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(prefix = "stresscast", name = "store", havingValue = "memory")
public class InMemorySimulationRunRepository implements SimulationRunRepository {

    private final Map<UUID, SimulationRun> storage = new ConcurrentHashMap<>();

    @Override
    public SimulationRun save(SimulationRun run) {
        SimulationRun stored = run.runId() != null ? run : run.withRunId(UUID.randomUUID());
        storage.put(stored.runId(), stored);
        return stored;
    }

    @Override
    public Optional<SimulationRun> findById(UUID runId) {
        return Optional.ofNullable(storage.get(runId));
    }

    @Override
    public int deleteCreatedBefore(Instant cutoff) {
        int before = storage.size();
        storage.entrySet().removeIf(entry -> entry.getValue().createdAt().isBefore(cutoff));
        return before - storage.size();
    }
}
