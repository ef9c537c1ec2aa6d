package com.stresscast.scenario.simulation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class StressCalculatorTest {

    @Test
    void shortageShareOfDemand() {
        assertThat(StressCalculator.calculate(100, 80)).isCloseTo(0.2, within(1e-9));
        assertThat(StressCalculator.calculate(1250, 1000)).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void surplusSupplyMeansNoStress() {
        assertThat(StressCalculator.calculate(100, 120)).isZero();
        assertThat(StressCalculator.calculate(100, 100)).isZero();
    }

    @Test
    void noDemandMeansNoStress() {
        assertThat(StressCalculator.calculate(0, 50)).isZero();
        assertThat(StressCalculator.calculate(-5, 10)).isZero();
        assertThat(StressCalculator.calculate(0, 0)).isZero();
    }

    @Test
    void noSupplyMeansFullStress() {
        assertThat(StressCalculator.calculate(100, 0)).isEqualTo(1.0);
        assertThat(StressCalculator.calculate(100, -20)).isEqualTo(1.0);
    }

    @Test
    void nanInputsYieldZero() {
        assertThat(StressCalculator.calculate(Double.NaN, 10)).isZero();
        assertThat(StressCalculator.calculate(10, Double.NaN)).isZero();
    }

    @Test
    void tinyDemandIsMeasuredAgainstOneUnit() {
        assertThat(StressCalculator.calculate(0.01, 0.009)).isCloseTo(0.001, within(1e-9));
    }

    @Test
    void bufferDampensStressByUpToThirtyPercent() {
        assertThat(StressCalculator.calculate(100, 80, null)).isCloseTo(0.2, within(1e-9));
        assertThat(StressCalculator.calculate(100, 80, 0.0)).isCloseTo(0.2, within(1e-9));
        assertThat(StressCalculator.calculate(100, 80, 50.0)).isCloseTo(0.17, within(1e-9));
        assertThat(StressCalculator.calculate(100, 80, 100.0)).isCloseTo(0.14, within(1e-9));
        assertThat(StressCalculator.calculate(100, 80, 250.0)).isCloseTo(0.14, within(1e-9));
    }

    @Test
    void resultAlwaysWithinUnitInterval() {
        double[] values = {-1e9, -1, 0, 1e-6, 0.5, 1, 10, 1e6, 1e12, Double.POSITIVE_INFINITY};
        for (double demand : values) {
            for (double supply : values) {
                assertThat(StressCalculator.calculate(demand, supply)).isBetween(0.0, 1.0);
                assertThat(StressCalculator.calculate(demand, supply, 60.0)).isBetween(0.0, 1.0);
            }
        }
    }
}
