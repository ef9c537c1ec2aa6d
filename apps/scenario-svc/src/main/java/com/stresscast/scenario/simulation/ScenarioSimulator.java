package com.stresscast.scenario.simulation;

import com.stresscast.scenario.model.DailyRecord;
import com.stresscast.scenario.model.Region;
import com.stresscast.scenario.model.ScenarioParameters;
import com.stresscast.scenario.model.SimulationResult;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Domain-agnostic projection pass. Emits one result per input record, in input order.
 */
@Component
public class ScenarioSimulator {

    public <R extends DailyRecord, S extends ScenarioParameters> List<SimulationResult> simulate(
            S scenario,
            List<R> records,
            Map<String, Region> regions,
            DomainProfile<R, S> profile) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        boolean tracksUnmet = profile.domain().tracksUnmetDemand();
        List<SimulationResult> results = new ArrayList<>(records.size());
        for (R record : records) {
            DomainProfile.Flows flows = profile.adjust(record, scenario);
            double stress = StressCalculator.calculate(flows.demand(), flows.supply(), flows.buffer());
            Double unmet = tracksUnmet ? round(Math.max(0, flows.demand() - flows.supply()), 2) : null;
            Region region = regions.get(record.regionId());
            results.add(new SimulationResult(
                    record.date(),
                    record.regionId(),
                    region != null ? region.name() : record.regionId(),
                    round(flows.demand(), 2),
                    round(flows.supply(), 2),
                    round(stress, 4),
                    unmet,
                    profile.cropOutcome(record, stress)
            ));
        }
        return results;
    }

    static double round(double value, int scale) {
        if (!Double.isFinite(value)) {
            return 0;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
