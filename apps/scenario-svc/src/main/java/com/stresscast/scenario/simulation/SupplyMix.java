package com.stresscast.scenario.simulation;

/**
 * Split of baseline supply into a fixed share, a renewable share driven by a growth
 * percentage, and a rainfall-sensitive share. Rainfall changes pass through only partially.
 */
public record SupplyMix(double fixedShare, double renewableShare, double rainfallShare, double rainfallPassThrough) {

    public SupplyMix {
        if (fixedShare < 0 || renewableShare < 0 || rainfallShare < 0) {
            throw new IllegalArgumentException("supply shares must not be negative");
        }
        if (rainfallPassThrough < 0 || rainfallPassThrough > 1) {
            throw new IllegalArgumentException("rainfallPassThrough must be within [0,1]");
        }
    }

    /**
     * Multiplier applied to baseline supply.
     */
    public double factor(double renewableGrowthPct, double rainfallChangePct) {
        double renewable = renewableShare * Math.max(0, 1 + renewableGrowthPct / 100);
        double rainfall = rainfallShare * rainfallFactor(rainfallChangePct);
        return fixedShare + renewable + rainfall;
    }

    public double rainfallFactor(double rainfallChangePct) {
        return Math.max(0, 1 + rainfallPassThrough * rainfallChangePct / 100);
    }
}
