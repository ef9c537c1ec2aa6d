package com.stresscast.scenario.repository;

import com.stresscast.scenario.model.SimulationRun;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface SimulationRunRepository {

    /**
     * Stores the run and returns it with its assigned id.
     */
    SimulationRun save(SimulationRun run);

    Optional<SimulationRun> findById(UUID runId);

    int deleteCreatedBefore(Instant cutoff);
}
