package com.stresscast.scenario.simulation;

import com.stresscast.scenario.model.AgricultureDailyRecord;
import com.stresscast.scenario.model.AgricultureScenario;
import com.stresscast.scenario.model.CropType;
import com.stresscast.scenario.model.Domain;
import com.stresscast.scenario.model.SimulationResult;
import org.springframework.stereotype.Component;

/**
 * Crop water balance in mm/day. Demand is the crop's water need, raised by warming;
 * supply is rainfall plus irrigation, with soil moisture as the buffer. Yield falls
 * with stress.
 */
@Component
public class AgricultureProfile implements DomainProfile<AgricultureDailyRecord, AgricultureScenario> {

    static final double NEED_INCREASE_PER_DEGREE = 0.05;
    static final double BASELINE_IRRIGATION_SHARE = 0.20;
    static final double YIELD_SENSITIVITY = 0.5;
    static final SupplyMix MIX = new SupplyMix(0.0, BASELINE_IRRIGATION_SHARE, 1.0, 0.66);

    @Override
    public Domain domain() {
        return Domain.AGRICULTURE;
    }

    @Override
    public Flows adjust(AgricultureDailyRecord record, AgricultureScenario scenario) {
        double need = record.cropType().waterNeedMmPerDay()
                * Math.max(0, 1 + NEED_INCREASE_PER_DEGREE * scenario.temperatureChangeC());
        double rainfall = Math.max(0, record.rainfallMm()) * MIX.rainfallFactor(scenario.rainfallChangePct());
        double irrigation = need * MIX.renewableShare() * (1 + scenario.irrigationImprovementPct() / 100);
        return new Flows(need, rainfall + irrigation, record.soilMoisturePct());
    }

    @Override
    public SimulationResult.CropOutcome cropOutcome(AgricultureDailyRecord record, double stress) {
        CropType crop = record.cropType();
        double baseline = record.yieldKgPerHectare() > 0 ? record.yieldKgPerHectare() : crop.baselineYieldKgPerHectare();
        double actual = baseline * (1 - YIELD_SENSITIVITY * stress);
        double changePct = baseline > 0 ? (actual - baseline) / baseline * 100 : 0;
        return new SimulationResult.CropOutcome(
                crop.code(),
                ScenarioSimulator.round(baseline, 2),
                ScenarioSimulator.round(actual, 2),
                ScenarioSimulator.round(changePct, 2));
    }
}
