package com.stresscast.scenario.economics;

import com.stresscast.scenario.config.StresscastProperties;
import com.stresscast.scenario.model.Domain;
import com.stresscast.scenario.model.EconomicAnalysis;
import com.stresscast.scenario.model.EnergyScenario;
import com.stresscast.scenario.model.ScenarioParameters;
import com.stresscast.scenario.model.SimulationSummary;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Turns simulated stress into investment, savings and cost-of-inaction figures.
 * Pure arithmetic over the supplied cost constants; zero constants yield zero outputs.
 */
@Component
public class EconomicAnalyzer {

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(0);

    public EconomicAnalysis analyze(
            Domain domain,
            SimulationSummary summary,
            List<RegionExposure> exposures,
            ScenarioParameters scenario,
            StresscastProperties.Economics constants) {
        CostBasis basis = switch (domain) {
            case ENERGY -> energy(exposures, scenario, constants);
            case WATER -> water(exposures, constants);
            case AGRICULTURE -> agriculture(summary, exposures, constants);
        };
        return finance(basis, constants.finance());
    }

    private CostBasis energy(List<RegionExposure> exposures, ScenarioParameters scenario, StresscastProperties.Economics constants) {
        StresscastProperties.Energy energy = constants.energy();
        StresscastProperties.Infrastructure infrastructure = constants.infrastructure();
        double threshold = constants.finance().investmentStressThreshold();
        double investment = 0;
        double annualCost = 0;
        for (RegionExposure exposure : exposures) {
            double stress = safe(exposure.avgStress());
            if (stress > threshold) {
                double capacityIncreasePct = (stress - 0.5) * 100;
                investment += infrastructure.gridUpgradeCostPer10Pct() * (capacityIncreasePct / 10)
                        * locationMultiplier(exposure.regionId(), infrastructure);
            }
            double outageHours = stress * energy.outageHoursAtFullStress();
            annualCost += outageCost(exposure.population(), outageHours, energy);
        }
        if (scenario instanceof EnergyScenario energyScenario && energyScenario.solarGrowthPct() > 0) {
            double solarMw = energyScenario.solarGrowthPct() / 100 * energy.solarBaselineMw();
            investment += solarMw * 1000 * infrastructure.solarCostPerKw();
        }
        return new CostBasis(investment, annualCost, energy.savingsShare());
    }

    private double outageCost(long population, double outageHours, StresscastProperties.Energy energy) {
        double productivity = population * energy.outageCostPerCapitaHour() * outageHours;
        double businesses = energy.peoplePerBusiness() > 0 ? population / energy.peoplePerBusiness() : 0;
        double business = businesses * energy.businessCostPerOutageHour() * outageHours;
        double extended = outageHours > energy.extendedOutageHours() ? population * energy.extendedOutageCostPerCapita() : 0;
        return productivity + business + extended;
    }

    private CostBasis water(List<RegionExposure> exposures, StresscastProperties.Economics constants) {
        StresscastProperties.Water water = constants.water();
        double threshold = constants.finance().investmentStressThreshold();
        double investment = 0;
        double annualCost = 0;
        for (RegionExposure exposure : exposures) {
            double stress = safe(exposure.avgStress());
            if (stress > threshold) {
                double dailyCapacityM3 = exposure.population() * water.dailyCapacityPerCapitaM3() * stress;
                investment += constants.infrastructure().waterTreatmentCostPer100kM3() * (dailyCapacityM3 / 100_000);
            }
            double shortageDays = stress * water.shortageDaysAtFullStress();
            annualCost += exposure.population()
                    * (water.healthCostPerShortageDay() + water.timeCostPerShortageDay())
                    * shortageDays;
        }
        return new CostBasis(investment, annualCost, water.savingsShare());
    }

    private CostBasis agriculture(SimulationSummary summary, List<RegionExposure> exposures, StresscastProperties.Economics constants) {
        StresscastProperties.Agriculture agriculture = constants.agriculture();
        StresscastProperties.Infrastructure infrastructure = constants.infrastructure();
        double annualCost = 0;
        if (summary != null && summary.yieldImpact() != null) {
            for (Map.Entry<String, Double> entry : summary.yieldImpact().yieldLossKgPerHectareByCrop().entrySet()) {
                double hectares = agriculture.plantedHectares().getOrDefault(entry.getKey(), 0.0);
                double price = agriculture.pricePerKg().getOrDefault(entry.getKey(), 0.0);
                annualCost += safe(entry.getValue()) * hectares * price * agriculture.gdpMultiplier();
            }
        }
        double threshold = constants.finance().investmentStressThreshold();
        long stressedRegions = exposures.stream().filter(exposure -> safe(exposure.avgStress()) > threshold).count();
        double hectares = Math.min(agriculture.maxIrrigatedHectares(), stressedRegions * agriculture.hectaresPerStressedRegion());
        double installation = hectares * infrastructure.dripIrrigationCostPerHectare();
        double maintenance = installation * infrastructure.annualMaintenanceRate() * constants.finance().horizonYears();
        return new CostBasis(installation + maintenance, annualCost, agriculture.savingsShare());
    }

    EconomicAnalysis finance(CostBasis basis, StresscastProperties.Finance finance) {
        double investment = safe(basis.investment());
        double annualCost = safe(basis.annualCost());
        double annualSavings = annualCost * basis.savingsShare();
        int horizon = finance.horizonYears();

        double discountedBenefits = 0;
        double inaction = 0;
        for (int year = 1; year <= horizon; year++) {
            discountedBenefits += annualSavings / Math.pow(1 + finance.discountRate(), year);
            inaction += annualCost * Math.pow(1 + finance.inactionEscalationRate(), year);
        }
        double roi = investment > 0 ? (discountedBenefits - investment) / investment : 0;
        double npv = discountedBenefits - investment;
        double opportunityCost = annualSavings * finance.delayMonths() / 12.0 * finance.delayPenaltyMonthlyRate();

        return new EconomicAnalysis(
                usd(investment),
                usd(annualSavings),
                usd(annualCost),
                BigDecimal.valueOf(safe(roi)).setScale(2, RoundingMode.HALF_UP),
                paybackMonths(investment, annualSavings, finance.paybackCapMonths()),
                usd(npv),
                usd(opportunityCost),
                usd(annualCost),
                usd(inaction));
    }

    static int paybackMonths(double investment, double annualSavings, int capMonths) {
        if (!(annualSavings > 0) || !Double.isFinite(investment)) {
            return capMonths;
        }
        double months = Math.max(0, investment) / annualSavings * 12;
        if (!Double.isFinite(months)) {
            return capMonths;
        }
        return (int) Math.min(capMonths, Math.round(months));
    }

    private static double locationMultiplier(String regionId, StresscastProperties.Infrastructure infrastructure) {
        return infrastructure.remoteRegions().contains(regionId) ? infrastructure.remoteRegionMultiplier() : 1.0;
    }

    private static BigDecimal usd(double value) {
        if (!Double.isFinite(value)) {
            return ZERO;
        }
        return BigDecimal.valueOf(value).setScale(0, RoundingMode.HALF_UP);
    }

    private static double safe(double value) {
        return Double.isFinite(value) ? value : 0;
    }

    record CostBasis(double investment, double annualCost, double savingsShare) {
    }
}
