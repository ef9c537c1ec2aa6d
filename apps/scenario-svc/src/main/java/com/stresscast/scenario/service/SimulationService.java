package com.stresscast.scenario.service;

import com.stresscast.scenario.config.StresscastProperties;
import com.stresscast.scenario.economics.EconomicAnalyzer;
import com.stresscast.scenario.economics.RegionExposure;
import com.stresscast.scenario.model.AgricultureScenario;
import com.stresscast.scenario.model.DailyRecord;
import com.stresscast.scenario.model.Domain;
import com.stresscast.scenario.model.EconomicAnalysis;
import com.stresscast.scenario.model.EnergyScenario;
import com.stresscast.scenario.model.Region;
import com.stresscast.scenario.model.ScenarioParameters;
import com.stresscast.scenario.model.SimulationResult;
import com.stresscast.scenario.model.SimulationRun;
import com.stresscast.scenario.model.SimulationSummary;
import com.stresscast.scenario.model.ValidationResult;
import com.stresscast.scenario.model.WaterScenario;
import com.stresscast.scenario.repository.HistoricalDataSource;
import com.stresscast.scenario.repository.RegionDirectory;
import com.stresscast.scenario.repository.SimulationRunRepository;
import com.stresscast.scenario.simulation.AgricultureProfile;
import com.stresscast.scenario.simulation.DomainProfile;
import com.stresscast.scenario.simulation.EnergyProfile;
import com.stresscast.scenario.simulation.ScenarioSimulator;
import com.stresscast.scenario.simulation.ScenarioValidator;
import com.stresscast.scenario.simulation.SummaryAggregator;
import com.stresscast.scenario.simulation.WaterProfile;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs one scenario end to end: validate, fetch, simulate, summarize, price, store.
 */
@Service
public class SimulationService {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    private final ScenarioValidator validator;
    private final RegionDirectory regionDirectory;
    private final HistoricalDataSource dataSource;
    private final ScenarioSimulator simulator;
    private final SummaryAggregator aggregator;
    private final EconomicAnalyzer economicAnalyzer;
    private final SimulationRunRepository runRepository;
    private final StresscastProperties properties;
    private final EnergyProfile energyProfile;
    private final WaterProfile waterProfile;
    private final AgricultureProfile agricultureProfile;
    private final Clock clock;

    @Autowired
    public SimulationService(ScenarioValidator validator,
                             RegionDirectory regionDirectory,
                             HistoricalDataSource dataSource,
                             ScenarioSimulator simulator,
                             SummaryAggregator aggregator,
                             EconomicAnalyzer economicAnalyzer,
                             SimulationRunRepository runRepository,
                             StresscastProperties properties,
                             EnergyProfile energyProfile,
                             WaterProfile waterProfile,
                             AgricultureProfile agricultureProfile) {
        this(validator, regionDirectory, dataSource, simulator, aggregator, economicAnalyzer, runRepository,
                properties, energyProfile, waterProfile, agricultureProfile, Clock.systemUTC());
    }

    SimulationService(ScenarioValidator validator,
                      RegionDirectory regionDirectory,
                      HistoricalDataSource dataSource,
                      ScenarioSimulator simulator,
                      SummaryAggregator aggregator,
                      EconomicAnalyzer economicAnalyzer,
                      SimulationRunRepository runRepository,
                      StresscastProperties properties,
                      EnergyProfile energyProfile,
                      WaterProfile waterProfile,
                      AgricultureProfile agricultureProfile,
                      Clock clock) {
        this.validator = validator;
        this.regionDirectory = regionDirectory;
        this.dataSource = dataSource;
        this.simulator = simulator;
        this.aggregator = aggregator;
        this.economicAnalyzer = economicAnalyzer;
        this.runRepository = runRepository;
        this.properties = properties;
        this.energyProfile = energyProfile;
        this.waterProfile = waterProfile;
        this.agricultureProfile = agricultureProfile;
        this.clock = clock;
    }

    public SimulationRun simulateEnergy(EnergyScenario scenario) {
        return run(Domain.ENERGY, scenario, energyProfile, dataSource::findEnergy);
    }

    public SimulationRun simulateWater(WaterScenario scenario) {
        return run(Domain.WATER, scenario, waterProfile, dataSource::findWater);
    }

    public SimulationRun simulateAgriculture(AgricultureScenario scenario) {
        return run(Domain.AGRICULTURE, scenario, agricultureProfile,
                (from, to) -> dataSource.findAgriculture(from, to, scenario.crop()));
    }

    public ValidationResult validate(ScenarioParameters scenario) {
        return validator.validate(scenario);
    }

    public SimulationRun findRun(UUID runId) {
        return runRepository.findById(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    private <R extends DailyRecord, S extends ScenarioParameters> SimulationRun run(
            Domain domain,
            S scenario,
            DomainProfile<R, S> profile,
            BiFunction<LocalDate, LocalDate, List<R>> fetch) {
        long started = System.nanoTime();
        ValidationResult validation = validator.validate(scenario);
        if (!validation.valid()) {
            log.info("Rejected {} scenario: {}", domain.code(), validation.error());
            throw new InvalidScenarioException(domain, validation.error());
        }

        LocalDate from = ScenarioValidator.parseDate(scenario.startDate());
        LocalDate to = ScenarioValidator.parseDate(scenario.endDate());
        Map<String, Region> regions = regionDirectory.byId();
        List<R> records = fetch.apply(from, to);
        if (records.isEmpty()) {
            log.info("No {} records between {} and {}", domain.code(), from, to);
        }

        List<SimulationResult> results = simulator.simulate(scenario, records, regions, profile);
        SimulationSummary summary = aggregator.summarize(domain, results);
        List<RegionExposure> exposures = exposures(results, regions);
        EconomicAnalysis economics = economicAnalyzer.analyze(domain, summary, exposures, scenario, properties.economics());
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        SimulationRun run = new SimulationRun(null, domain, scenario, results, summary, economics, elapsedMs, clock.instant());
        SimulationRun stored = store(run);
        log.info("Simulated {} scenario: {} records, {} regions, avgStress={}, {} ms, run={}",
                domain.code(), records.size(), exposures.size(), summary.avgStress(), elapsedMs,
                stored.runId() != null ? stored.runId() : "not-stored");
        return stored;
    }

    private SimulationRun store(SimulationRun run) {
        try {
            return runRepository.save(run);
        } catch (RuntimeException ex) {
            log.warn("Failed to store {} simulation run: {}", run.domain().code(), ex.getMessage());
            return run;
        }
    }

    private List<RegionExposure> exposures(List<SimulationResult> results, Map<String, Region> regions) {
        return aggregator.regionAverages(results).stream()
                .map(average -> {
                    Region region = regions.get(average.regionId());
                    long population = region != null ? region.population() : 0L;
                    return new RegionExposure(average.regionId(), average.regionName(), population, average.avgStress());
                })
                .toList();
    }
}
