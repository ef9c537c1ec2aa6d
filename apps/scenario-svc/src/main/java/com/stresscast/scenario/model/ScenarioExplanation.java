package com.stresscast.scenario.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record ScenarioExplanation(
        String summary,
        List<String> keyInsights,
        List<String> risks,
        List<ActionItem> recommendations,
        double confidenceScore,
        Instant generatedAt,
        String provider
) {

    public record ActionItem(Priority priority, String title, String description, String timeline, BigDecimal estimatedCostUsd) {
    }

    public enum Priority {
        CRITICAL,
        HIGH,
        MEDIUM,
        LOW
    }
}
