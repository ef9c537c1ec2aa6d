package com.stresscast.scenario.model;

import java.util.List;

public record SimulationOutcome(List<SimulationResult> dailyResults, SimulationSummary summary) {
}
