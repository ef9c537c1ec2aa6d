package com.stresscast.scenario.simulation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import com.stresscast.scenario.model.Domain;
import com.stresscast.scenario.model.SimulationResult;
import com.stresscast.scenario.model.SimulationSummary;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.assertj.core.groups.Tuple;
import org.junit.jupiter.api.Test;

class SummaryAggregatorTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    private final SummaryAggregator aggregator = new SummaryAggregator();

    @Test
    void emptyResultsDegradeToZeros() {
        SimulationSummary energy = aggregator.summarize(Domain.ENERGY, List.of());
        assertThat(energy.avgStress()).isZero();
        assertThat(energy.maxStress()).isZero();
        assertThat(energy.criticalDays()).isZero();
        assertThat(energy.totalUnmetDemand()).isNull();
        assertThat(energy.topStressedRegions()).isEmpty();

        SimulationSummary water = aggregator.summarize(Domain.WATER, null);
        assertThat(water.totalUnmetDemand()).isZero();

        SimulationSummary agriculture = aggregator.summarize(Domain.AGRICULTURE, List.of());
        assertThat(agriculture.yieldImpact().totalYieldLossKg()).isZero();
        assertThat(agriculture.yieldImpact().mostAffectedCrop()).isNull();
    }

    @Test
    void singleRegionSummary() {
        List<SimulationResult> results = List.of(
                energy("SS", 0.2),
                energy("SS", 0.5),
                energy("SS", 0.65));

        SimulationSummary summary = aggregator.summarize(Domain.ENERGY, results);

        assertThat(summary.avgStress()).isEqualTo(0.45);
        assertThat(summary.maxStress()).isEqualTo(0.65);
        assertThat(summary.criticalDays()).isEqualTo(1);
        assertThat(summary.topStressedRegions()).hasSize(1);
        assertThat(summary.topStressedRegions().get(0).regionId()).isEqualTo("SS");
        assertThat(summary.topStressedRegions().get(0).avgStress()).isEqualTo(0.45);
    }

    @Test
    void criticalThresholdIsStrictAndDomainSpecific() {
        List<SimulationResult> results = List.of(energy("SS", 0.6), energy("SS", 0.65), energy("SS", 0.7), energy("SS", 0.71));

        assertThat(aggregator.summarize(Domain.ENERGY, results).criticalDays()).isEqualTo(3);
        assertThat(aggregator.summarize(Domain.WATER, results).criticalDays()).isEqualTo(1);
    }

    @Test
    void topRegionsLimitedToFiveInDescendingOrder() {
        List<SimulationResult> results = new ArrayList<>();
        String[] regions = {"AH", "CA", "CH", "CU", "LI", "LP", "LU"};
        double[] stress = {0.1, 0.7, 0.3, 0.9, 0.5, 0.2, 0.8};
        for (int i = 0; i < regions.length; i++) {
            results.add(energy(regions[i], stress[i]));
        }

        List<SimulationSummary.TopStressedRegion> top = aggregator.summarize(Domain.ENERGY, results).topStressedRegions();

        assertThat(top).extracting(SimulationSummary.TopStressedRegion::regionId)
                .containsExactly("CU", "LU", "CA", "LI", "CH");
        for (int i = 1; i < top.size(); i++) {
            assertThat(top.get(i).avgStress()).isLessThan(top.get(i - 1).avgStress());
        }
    }

    @Test
    void tiesKeepFirstAppearanceOrder() {
        List<SimulationResult> results = List.of(energy("SM", 0.4), energy("SS", 0.4), energy("AH", 0.4));

        assertThat(aggregator.summarize(Domain.ENERGY, results).topStressedRegions())
                .extracting(SimulationSummary.TopStressedRegion::regionId)
                .containsExactly("SM", "SS", "AH");
    }

    @Test
    void waterSumsUnmetDemand() {
        List<SimulationResult> results = List.of(
                new SimulationResult(DAY, "SS", "San Salvador", 100, 80, 0.2, 20.0, null),
                new SimulationResult(DAY, "SM", "San Miguel", 50, 45.5, 0.09, 4.5, null));

        assertThat(aggregator.summarize(Domain.WATER, results).totalUnmetDemand()).isEqualTo(24.5);
    }

    @Test
    void agricultureReportsYieldImpact() {
        List<SimulationResult> results = List.of(
                crop("SS", "coffee", 1000, 850, 0.3),
                crop("SS", "coffee", 1000, 950, 0.1),
                crop("SM", "corn", 2750, 2612.5, 0.1));

        SimulationSummary.YieldImpact impact = aggregator.summarize(Domain.AGRICULTURE, results).yieldImpact();

        assertThat(impact.totalYieldLossKg()).isEqualTo(337.5);
        assertThat(impact.totalYieldLossPct()).isEqualTo(7.11);
        assertThat(impact.mostAffectedCrop()).isEqualTo("coffee");
        assertThat(impact.yieldLossKgPerHectareByCrop())
                .containsEntry("coffee", 100.0)
                .containsEntry("corn", 137.5);
    }

    @Test
    void yieldLossByCropKeepsFirstAppearanceOrder() {
        List<SimulationResult> results = List.of(
                crop("SS", "sugar_cane", 1000, 900, 0.2),
                crop("SS", "beans", 800, 760, 0.1),
                crop("SM", "coffee", 1000, 950, 0.1),
                crop("SM", "corn", 2000, 1900, 0.1));

        assertThat(aggregator.summarize(Domain.AGRICULTURE, results).yieldImpact().yieldLossKgPerHectareByCrop())
                .containsExactly(
                        entry("sugar_cane", 100.0),
                        entry("beans", 40.0),
                        entry("coffee", 50.0),
                        entry("corn", 100.0));
    }

    @Test
    void regionAveragesFollowFirstAppearance() {
        List<SimulationResult> results = List.of(energy("SM", 0.2), energy("SS", 0.9), energy("SM", 0.4));

        assertThat(aggregator.regionAverages(results))
                .extracting(SimulationSummary.TopStressedRegion::regionId, SimulationSummary.TopStressedRegion::avgStress)
                .containsExactly(
                        Tuple.tuple("SM", 0.3),
                        Tuple.tuple("SS", 0.9));
    }

    private static SimulationResult energy(String regionId, double stress) {
        return new SimulationResult(DAY, regionId, regionId + " name", 100, 100 * (1 - stress), stress, null, null);
    }

    private static SimulationResult crop(String regionId, String crop, double baseline, double actual, double stress) {
        double change = (actual - baseline) / baseline * 100;
        return new SimulationResult(DAY, regionId, regionId, 4, 4 * (1 - stress), stress, 4 * stress,
                new SimulationResult.CropOutcome(crop, baseline, actual, change));
    }
}
