package com.stresscast.scenario.simulation;

import com.stresscast.scenario.model.Domain;
import com.stresscast.scenario.model.SimulationResult;
import com.stresscast.scenario.model.SimulationSummary;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

@Component
public class SummaryAggregator {

    static final int TOP_REGION_LIMIT = 5;

    public SimulationSummary summarize(Domain domain, List<SimulationResult> results) {
        if (results == null || results.isEmpty()) {
            return SimulationSummary.empty(domain);
        }
        double total = 0;
        double max = 0;
        int criticalDays = 0;
        double unmet = 0;
        for (SimulationResult result : results) {
            total += result.stress();
            max = Math.max(max, result.stress());
            if (result.stress() > domain.criticalThreshold()) {
                criticalDays++;
            }
            if (result.unmetDemand() != null) {
                unmet += result.unmetDemand();
            }
        }
        List<SimulationSummary.TopStressedRegion> topRegions = regionAverages(results).stream()
                .sorted(Comparator.comparingDouble(SimulationSummary.TopStressedRegion::avgStress).reversed())
                .limit(TOP_REGION_LIMIT)
                .toList();
        return new SimulationSummary(
                ScenarioSimulator.round(total / results.size(), 3),
                ScenarioSimulator.round(max, 3),
                criticalDays,
                domain.tracksUnmetDemand() ? ScenarioSimulator.round(unmet, 2) : null,
                domain == Domain.AGRICULTURE ? yieldImpact(results) : null,
                topRegions);
    }

    /**
     * Mean stress per region, in the order regions first appear in the results.
     */
    public List<SimulationSummary.TopStressedRegion> regionAverages(List<SimulationResult> results) {
        Map<String, RegionAccumulator> byRegion = new LinkedHashMap<>();
        for (SimulationResult result : results) {
            byRegion.computeIfAbsent(result.regionId(), id -> new RegionAccumulator(id, result.regionName()))
                    .add(result.stress());
        }
        List<SimulationSummary.TopStressedRegion> averages = new ArrayList<>(byRegion.size());
        for (RegionAccumulator accumulator : byRegion.values()) {
            averages.add(new SimulationSummary.TopStressedRegion(
                    accumulator.regionId,
                    accumulator.regionName,
                    ScenarioSimulator.round(accumulator.sum / accumulator.count, 3)));
        }
        return averages;
    }

    private SimulationSummary.YieldImpact yieldImpact(List<SimulationResult> results) {
        Map<String, CropAccumulator> byCrop = new LinkedHashMap<>();
        double baselineTotal = 0;
        double lossTotal = 0;
        for (SimulationResult result : results) {
            SimulationResult.CropOutcome crop = result.crop();
            if (crop == null) {
                continue;
            }
            double loss = Math.max(0, crop.baselineYieldKg() - crop.actualYieldKg());
            baselineTotal += crop.baselineYieldKg();
            lossTotal += loss;
            byCrop.computeIfAbsent(crop.cropType(), code -> new CropAccumulator()).add(loss, crop.baselineYieldKg());
        }
        if (byCrop.isEmpty()) {
            return SimulationSummary.YieldImpact.none();
        }
        Map<String, Double> lossPerHectare = new LinkedHashMap<>();
        String mostAffected = null;
        double worstShare = -1;
        for (Map.Entry<String, CropAccumulator> entry : byCrop.entrySet()) {
            CropAccumulator accumulator = entry.getValue();
            lossPerHectare.put(entry.getKey(), ScenarioSimulator.round(accumulator.loss / accumulator.count, 2));
            double share = accumulator.baseline > 0 ? accumulator.loss / accumulator.baseline : 0;
            if (share > worstShare) {
                worstShare = share;
                mostAffected = entry.getKey();
            }
        }
        double lossPct = baselineTotal > 0 ? lossTotal / baselineTotal * 100 : 0;
        return new SimulationSummary.YieldImpact(
                ScenarioSimulator.round(lossTotal, 2),
                ScenarioSimulator.round(lossPct, 2),
                Objects.requireNonNull(mostAffected),
                Collections.unmodifiableMap(lossPerHectare));
    }

    private static final class RegionAccumulator {
        private final String regionId;
        private final String regionName;
        private double sum;
        private int count;

        private RegionAccumulator(String regionId, String regionName) {
            this.regionId = regionId;
            this.regionName = regionName;
        }

        private void add(double stress) {
            sum += stress;
            count++;
        }
    }

    private static final class CropAccumulator {
        private double loss;
        private double baseline;
        private int count;

        private void add(double lossKg, double baselineKg) {
            loss += lossKg;
            baseline += baselineKg;
            count++;
        }
    }
}
