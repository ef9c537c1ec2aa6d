package com.stresscast.scenario.model;

import java.math.BigDecimal;

/**
 * Financial picture of a simulated scenario. All amounts are USD.
 */
public record EconomicAnalysis(
        BigDecimal infrastructureInvestmentUsd,
        BigDecimal annualSavingsUsd,
        BigDecimal annualCostsPreventedUsd,
        BigDecimal roi5Year,
        int paybackPeriodMonths,
        BigDecimal netPresentValueUsd,
        BigDecimal opportunityCost6moDelayUsd,
        BigDecimal totalEconomicExposureUsd,
        BigDecimal costOfInaction5YearUsd
) {
}
