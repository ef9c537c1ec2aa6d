package com.stresscast.scenario.simulation;

/**
 * Maps demand and supply to a stress ratio in [0,1]: the share of demand left unmet.
 * An optional storage buffer (0-100) dampens the ratio by up to 30%.
 */
public final class StressCalculator {

    static final double MAX_BUFFER_RELIEF = 0.3;

    private StressCalculator() {
    }

    public static double calculate(double demand, double supply) {
        return calculate(demand, supply, null);
    }

    public static double calculate(double demand, double supply, Double bufferPct) {
        if (Double.isNaN(demand) || Double.isNaN(supply) || demand <= 0) {
            return 0;
        }
        if (supply <= 0) {
            return 1;
        }
        double shortage = Math.max(0, demand - supply);
        double stress = shortage / Math.max(demand, 1);
        if (bufferPct != null && bufferPct > 0) {
            double coverage = Math.min(bufferPct / 100, 1);
            stress = stress * (1 - MAX_BUFFER_RELIEF * coverage);
        }
        return clamp(stress);
    }

    static double clamp(double value) {
        if (Double.isNaN(value) || value < 0) {
            return 0;
        }
        return Math.min(value, 1);
    }
}
