package com.stresscast.scenario.model;

import java.util.List;

/**
 * What-if inputs for one simulation. Dates stay as the caller sent them (YYYY-MM-DD)
 * so that the validator can report unparseable values instead of failing on binding.
 */
public interface ScenarioParameters {

    Domain domain();

    String startDate();

    String endDate();

    /**
     * Percentage-style inputs with their admissible range, in the order they are checked.
     */
    List<BoundedValue> boundedValues();

    record BoundedValue(String label, double value, double min, double max, String unit) {
    }
}
