package com.stresscast.scenario.simulation;

import static org.assertj.core.api.Assertions.assertThat;

import com.stresscast.scenario.model.AgricultureDailyRecord;
import com.stresscast.scenario.model.AgricultureScenario;
import com.stresscast.scenario.model.CropType;
import com.stresscast.scenario.model.EnergyDailyRecord;
import com.stresscast.scenario.model.EnergyScenario;
import com.stresscast.scenario.model.Region;
import com.stresscast.scenario.model.SimulationResult;
import com.stresscast.scenario.model.WaterDailyRecord;
import com.stresscast.scenario.model.WaterScenario;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ScenarioSimulatorTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 1);
    private static final Map<String, Region> REGIONS = Map.of(
            "SS", new Region("SS", "San Salvador", 1_800_000),
            "SM", new Region("SM", "San Miguel", 520_000));

    private final ScenarioSimulator simulator = new ScenarioSimulator();

    @Test
    void emptyInputYieldsEmptyOutput() {
        assertThat(simulator.simulate(energy(0, 0), List.of(), REGIONS, new EnergyProfile())).isEmpty();
    }

    @Test
    void energyBaselineIsBalanced() {
        List<SimulationResult> results = simulator.simulate(
                energy(0, 0), List.of(new EnergyDailyRecord(DAY, "SS", 1000)), REGIONS, new EnergyProfile());

        SimulationResult result = results.get(0);
        assertThat(result.regionName()).isEqualTo("San Salvador");
        assertThat(result.demand()).isEqualTo(1000.0);
        assertThat(result.supply()).isEqualTo(1000.0);
        assertThat(result.stress()).isZero();
        assertThat(result.unmetDemand()).isNull();
        assertThat(result.crop()).isNull();
    }

    @Test
    void losingSolarAndRainRaisesEnergyStress() {
        SimulationResult noSolar = simulator.simulate(
                energy(-100, 0), List.of(new EnergyDailyRecord(DAY, "SS", 1000)), REGIONS, new EnergyProfile()).get(0);
        SimulationResult drought = simulator.simulate(
                energy(0, -100), List.of(new EnergyDailyRecord(DAY, "SS", 1000)), REGIONS, new EnergyProfile()).get(0);

        assertThat(noSolar.supply()).isEqualTo(850.0);
        assertThat(noSolar.stress()).isEqualTo(0.15);
        assertThat(drought.supply()).isEqualTo(802.0);
        assertThat(drought.stress()).isEqualTo(0.198);
    }

    @Test
    void unknownRegionFallsBackToId() {
        SimulationResult result = simulator.simulate(
                energy(0, 0), List.of(new EnergyDailyRecord(DAY, "XX", 10)), REGIONS, new EnergyProfile()).get(0);
        assertThat(result.regionName()).isEqualTo("XX");
    }

    @Test
    void keepsInputOrderAndCount() {
        List<EnergyDailyRecord> records = List.of(
                new EnergyDailyRecord(DAY, "SS", 1000),
                new EnergyDailyRecord(DAY, "SM", 500),
                new EnergyDailyRecord(DAY.plusDays(1), "SS", 1100));

        List<SimulationResult> results = simulator.simulate(energy(-50, 0), records, REGIONS, new EnergyProfile());

        assertThat(results).extracting(SimulationResult::regionId).containsExactly("SS", "SM", "SS");
        assertThat(results).extracting(SimulationResult::date).containsExactly(DAY, DAY, DAY.plusDays(1));
    }

    @Test
    void waterShortageIsDampenedByReservoir() {
        WaterDailyRecord record = new WaterDailyRecord(DAY, "SS", 165_000, 145_000, 70.0);

        SimulationResult result = simulator.simulate(
                new WaterScenario(0, 0, 0, "2024-01-01", "2024-01-31"), List.of(record), REGIONS, new WaterProfile()).get(0);

        assertThat(result.demand()).isEqualTo(165_000.0);
        assertThat(result.supply()).isEqualTo(145_000.0);
        assertThat(result.stress()).isEqualTo(0.0958);
        assertThat(result.unmetDemand()).isEqualTo(20_000.0);
    }

    @Test
    void fullConservationRemovesWaterDemand() {
        WaterDailyRecord record = new WaterDailyRecord(DAY, "SS", 165_000, 145_000, null);

        SimulationResult result = simulator.simulate(
                new WaterScenario(50, 0, 100, "2024-01-01", "2024-01-31"), List.of(record), REGIONS, new WaterProfile()).get(0);

        assertThat(result.demand()).isZero();
        assertThat(result.stress()).isZero();
        assertThat(result.unmetDemand()).isZero();
    }

    @Test
    void agricultureStressFromWaterBalance() {
        AgricultureDailyRecord record = coffee(2.0);

        SimulationResult result = simulator.simulate(
                agriculture(0, 0, 0), List.of(record), REGIONS, new AgricultureProfile()).get(0);

        assertThat(result.demand()).isEqualTo(4.0);
        assertThat(result.supply()).isEqualTo(2.8);
        assertThat(result.stress()).isEqualTo(0.3);
        assertThat(result.unmetDemand()).isEqualTo(1.2);
        assertThat(result.crop().cropType()).isEqualTo("coffee");
        assertThat(result.crop().baselineYieldKg()).isEqualTo(1000.0);
        assertThat(result.crop().actualYieldKg()).isEqualTo(850.0);
        assertThat(result.crop().yieldChangePct()).isEqualTo(-15.0);
    }

    @Test
    void irrigationImprovementReducesCropStress() {
        AgricultureDailyRecord record = coffee(2.0);

        double baseline = simulator.simulate(agriculture(0, 0, 0), List.of(record), REGIONS, new AgricultureProfile()).get(0).stress();
        double improved = simulator.simulate(agriculture(0, 0, 100), List.of(record), REGIONS, new AgricultureProfile()).get(0).stress();

        assertThat(improved).isEqualTo(0.1);
        assertThat(improved).isLessThan(baseline);
    }

    @Test
    void warmingRaisesCropWaterNeed() {
        SimulationResult result = simulator.simulate(
                agriculture(0, 10, 0), List.of(coffee(2.0)), REGIONS, new AgricultureProfile()).get(0);

        assertThat(result.demand()).isEqualTo(6.0);
        assertThat(result.supply()).isEqualTo(3.2);
        assertThat(result.stress()).isEqualTo(0.4667);
    }

    @Test
    void missingRecordedYieldUsesCropBaseline() {
        AgricultureDailyRecord record = new AgricultureDailyRecord(DAY, "SM", CropType.CORN, 0, 10, 25, 0);

        SimulationResult result = simulator.simulate(
                agriculture(0, 0, 0), List.of(record), REGIONS, new AgricultureProfile()).get(0);

        assertThat(result.stress()).isZero();
        assertThat(result.crop().baselineYieldKg()).isEqualTo(2750.0);
        assertThat(result.crop().actualYieldKg()).isEqualTo(2750.0);
    }

    private static EnergyScenario energy(double solar, double rainfall) {
        return new EnergyScenario(solar, rainfall, "2024-01-01", "2024-01-31");
    }

    private static AgricultureScenario agriculture(double rainfall, double temperature, double irrigation) {
        return new AgricultureScenario(rainfall, temperature, irrigation, "coffee", "2024-01-01", "2024-01-31");
    }

    private static AgricultureDailyRecord coffee(double rainfallMm) {
        return new AgricultureDailyRecord(DAY, "SS", CropType.COFFEE, 1000, rainfallMm, 24, 0);
    }
}
