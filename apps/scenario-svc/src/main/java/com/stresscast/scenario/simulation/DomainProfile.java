package com.stresscast.scenario.simulation;

import com.stresscast.scenario.model.DailyRecord;
import com.stresscast.scenario.model.Domain;
import com.stresscast.scenario.model.ScenarioParameters;
import com.stresscast.scenario.model.SimulationResult;

/**
 * Domain-specific half of the simulator: turns one historical record plus the scenario into
 * adjusted demand and supply. Everything else (region lookup, stress, unmet demand, ordering)
 * is shared by {@link ScenarioSimulator}.
 */
public interface DomainProfile<R extends DailyRecord, S extends ScenarioParameters> {

    Domain domain();

    Flows adjust(R record, S scenario);

    /**
     * Extra per-record crop figures; {@code null} for domains without them.
     */
    default SimulationResult.CropOutcome cropOutcome(R record, double stress) {
        return null;
    }

    /**
     * @param buffer storage reserve 0-100 passed to the stress calculator, or {@code null}
     */
    record Flows(double demand, double supply, Double buffer) {
    }
}
