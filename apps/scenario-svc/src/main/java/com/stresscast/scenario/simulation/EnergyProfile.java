package com.stresscast.scenario.simulation;

import com.stresscast.scenario.model.Domain;
import com.stresscast.scenario.model.EnergyDailyRecord;
import com.stresscast.scenario.model.EnergyScenario;
import org.springframework.stereotype.Component;

/**
 * Energy records carry demand only; the grid is sized to meet baseline demand, split into
 * thermal/geothermal, solar and hydro generation.
 */
@Component
public class EnergyProfile implements DomainProfile<EnergyDailyRecord, EnergyScenario> {

    static final double BASELINE_SUPPLY_RATIO = 1.0;
    static final SupplyMix MIX = new SupplyMix(0.55, 0.15, 0.30, 0.66);

    @Override
    public Domain domain() {
        return Domain.ENERGY;
    }

    @Override
    public Flows adjust(EnergyDailyRecord record, EnergyScenario scenario) {
        double demand = record.demandMwh();
        double baselineSupply = demand * BASELINE_SUPPLY_RATIO;
        double supply = baselineSupply * MIX.factor(scenario.solarGrowthPct(), scenario.rainfallChangePct());
        return new Flows(demand, supply, null);
    }
}
