package com.stresscast.scenario.config;

import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "stresscast")
public record StresscastProperties(
        String store,
        Economics economics,
        Ai ai
) {

    public static final String STORE_JPA = "jpa";
    public static final String STORE_MEMORY = "memory";

    @ConstructorBinding
    public StresscastProperties {
        if (store == null || store.isBlank()) {
            store = STORE_JPA;
        }
        if (!STORE_JPA.equalsIgnoreCase(store) && !STORE_MEMORY.equalsIgnoreCase(store)) {
            throw new IllegalArgumentException("store must be 'jpa' or 'memory'");
        }
        if (economics == null) {
            economics = Economics.defaults();
        }
        if (ai == null) {
            ai = new Ai(null, null, null, null);
        }
    }

    /**
     * Cost tables and financial parameters consumed by the economic analyzer.
     * Any value left out of the configuration falls back to the reference figures.
     */
    public record Economics(
            Energy energy,
            Water water,
            Agriculture agriculture,
            Infrastructure infrastructure,
            Finance finance
    ) {
        public Economics {
            if (energy == null) energy = new Energy(null, null, null, null, null, null, null, null);
            if (water == null) water = new Water(null, null, null, null, null);
            if (agriculture == null) agriculture = new Agriculture(null, null, null, null, null, null);
            if (infrastructure == null) infrastructure = new Infrastructure(null, null, null, null, null, null, null);
            if (finance == null) finance = new Finance(null, null, null, null, null, null, null);
        }

        public static Economics defaults() {
            return new Economics(null, null, null, null, null);
        }
    }

    public record Energy(
            Double outageCostPerCapitaHour,
            Double businessCostPerOutageHour,
            Double peoplePerBusiness,
            Double extendedOutageHours,
            Double extendedOutageCostPerCapita,
            Double outageHoursAtFullStress,
            Double solarBaselineMw,
            Double savingsShare
    ) {
        public Energy {
            outageCostPerCapitaHour = nonNegative("outageCostPerCapitaHour", outageCostPerCapitaHour, 5.0);
            businessCostPerOutageHour = nonNegative("businessCostPerOutageHour", businessCostPerOutageHour, 50.0);
            peoplePerBusiness = nonNegative("peoplePerBusiness", peoplePerBusiness, 50.0);
            extendedOutageHours = nonNegative("extendedOutageHours", extendedOutageHours, 4.0);
            extendedOutageCostPerCapita = nonNegative("extendedOutageCostPerCapita", extendedOutageCostPerCapita, 2.0);
            outageHoursAtFullStress = nonNegative("outageHoursAtFullStress", outageHoursAtFullStress, 100.0);
            solarBaselineMw = nonNegative("solarBaselineMw", solarBaselineMw, 500.0);
            savingsShare = share("savingsShare", savingsShare, 0.80);
        }
    }

    public record Water(
            Double healthCostPerShortageDay,
            Double timeCostPerShortageDay,
            Double shortageDaysAtFullStress,
            Double dailyCapacityPerCapitaM3,
            Double savingsShare
    ) {
        public Water {
            healthCostPerShortageDay = nonNegative("healthCostPerShortageDay", healthCostPerShortageDay, 10.0);
            timeCostPerShortageDay = nonNegative("timeCostPerShortageDay", timeCostPerShortageDay, 6.0);
            shortageDaysAtFullStress = nonNegative("shortageDaysAtFullStress", shortageDaysAtFullStress, 60.0);
            dailyCapacityPerCapitaM3 = nonNegative("dailyCapacityPerCapitaM3", dailyCapacityPerCapitaM3, 0.15);
            savingsShare = share("savingsShare", savingsShare, 0.85);
        }
    }

    public record Agriculture(
            Map<String, Double> pricePerKg,
            Map<String, Double> plantedHectares,
            Double gdpMultiplier,
            Double hectaresPerStressedRegion,
            Double maxIrrigatedHectares,
            Double savingsShare
    ) {
        public Agriculture {
            if (pricePerKg == null || pricePerKg.isEmpty()) {
                pricePerKg = Map.of("coffee", 2.50, "sugar_cane", 0.08, "corn", 0.40, "beans", 1.20);
            }
            if (plantedHectares == null || plantedHectares.isEmpty()) {
                plantedHectares = Map.of("coffee", 150_000.0, "sugar_cane", 80_000.0, "corn", 300_000.0, "beans", 100_000.0);
            }
            gdpMultiplier = nonNegative("gdpMultiplier", gdpMultiplier, 1.3);
            hectaresPerStressedRegion = nonNegative("hectaresPerStressedRegion", hectaresPerStressedRegion, 5_000.0);
            maxIrrigatedHectares = nonNegative("maxIrrigatedHectares", maxIrrigatedHectares, 50_000.0);
            savingsShare = share("savingsShare", savingsShare, 0.70);
        }
    }

    /**
     * @param remoteRegions region ids whose build-out costs carry the remote multiplier
     */
    public record Infrastructure(
            Double solarCostPerKw,
            Double gridUpgradeCostPer10Pct,
            Double remoteRegionMultiplier,
            List<String> remoteRegions,
            Double waterTreatmentCostPer100kM3,
            Double dripIrrigationCostPerHectare,
            Double annualMaintenanceRate
    ) {
        public Infrastructure {
            solarCostPerKw = nonNegative("solarCostPerKw", solarCostPerKw, 1_200.0);
            gridUpgradeCostPer10Pct = nonNegative("gridUpgradeCostPer10Pct", gridUpgradeCostPer10Pct, 2_000_000.0);
            remoteRegionMultiplier = nonNegative("remoteRegionMultiplier", remoteRegionMultiplier, 1.5);
            if (remoteRegions == null) {
                remoteRegions = List.of("MO", "LU", "CA", "CH");
            }
            waterTreatmentCostPer100kM3 = nonNegative("waterTreatmentCostPer100kM3", waterTreatmentCostPer100kM3, 5_000_000.0);
            dripIrrigationCostPerHectare = nonNegative("dripIrrigationCostPerHectare", dripIrrigationCostPerHectare, 3_000.0);
            annualMaintenanceRate = nonNegative("annualMaintenanceRate", annualMaintenanceRate, 0.05);
        }
    }

    public record Finance(
            Double discountRate,
            Double inactionEscalationRate,
            Double delayPenaltyMonthlyRate,
            Integer delayMonths,
            Integer horizonYears,
            Integer paybackCapMonths,
            Double investmentStressThreshold
    ) {
        public Finance {
            discountRate = nonNegative("discountRate", discountRate, 0.05);
            inactionEscalationRate = nonNegative("inactionEscalationRate", inactionEscalationRate, 0.05);
            delayPenaltyMonthlyRate = nonNegative("delayPenaltyMonthlyRate", delayPenaltyMonthlyRate, 0.02);
            if (delayMonths == null) delayMonths = 6;
            if (horizonYears == null) horizonYears = 5;
            if (paybackCapMonths == null) paybackCapMonths = 60;
            if (delayMonths < 0) {
                throw new IllegalArgumentException("delayMonths must not be negative");
            }
            if (horizonYears <= 0) {
                throw new IllegalArgumentException("horizonYears must be positive");
            }
            if (paybackCapMonths <= 0) {
                throw new IllegalArgumentException("paybackCapMonths must be positive");
            }
            investmentStressThreshold = share("investmentStressThreshold", investmentStressThreshold, 0.6);
        }
    }

    /**
     * Outbound text generation used for scenario explanations. Without an API key the
     * service answers with a rule-based explanation.
     */
    public record Ai(String endpoint, String model, String apiKey, Integer timeoutMs) {
        public Ai {
            if (endpoint == null || endpoint.isBlank()) {
                endpoint = "https://api.openai.com/v1/responses";
            }
            if (model == null || model.isBlank()) {
                model = "gpt-4o-mini";
            }
            if (timeoutMs == null || timeoutMs <= 0) {
                timeoutMs = 30_000;
            }
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    private static Double nonNegative(String name, Double value, double fallback) {
        double resolved = value != null ? value : fallback;
        if (!Double.isFinite(resolved) || resolved < 0) {
            throw new IllegalArgumentException(name + " must be a non-negative number");
        }
        return resolved;
    }

    private static Double share(String name, Double value, double fallback) {
        double resolved = nonNegative(name, value, fallback);
        if (resolved > 1) {
            throw new IllegalArgumentException(name + " must be within [0,1]");
        }
        return resolved;
    }
}
