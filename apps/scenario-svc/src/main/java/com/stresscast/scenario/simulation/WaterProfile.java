package com.stresscast.scenario.simulation;

import com.stresscast.scenario.model.Domain;
import com.stresscast.scenario.model.WaterDailyRecord;
import com.stresscast.scenario.model.WaterScenario;
import org.springframework.stereotype.Component;

/**
 * Demand grows and is cut by conservation; supply splits into groundwater and rain-fed
 * surface water. The reservoir level acts as the stress buffer.
 */
@Component
public class WaterProfile implements DomainProfile<WaterDailyRecord, WaterScenario> {

    static final SupplyMix MIX = new SupplyMix(0.40, 0.0, 0.60, 0.66);

    @Override
    public Domain domain() {
        return Domain.WATER;
    }

    @Override
    public Flows adjust(WaterDailyRecord record, WaterScenario scenario) {
        double demand = record.waterDemandM3()
                * (1 + scenario.waterDemandGrowthPct() / 100)
                * (1 - scenario.conservationRatePct() / 100);
        double supply = record.waterSupplyM3() * MIX.factor(0, scenario.rainfallChangePct());
        return new Flows(Math.max(0, demand), supply, record.reservoirLevelPct());
    }
}
