package com.stresscast.scenario.model;

import java.time.LocalDate;

/**
 * @param reservoirLevelPct 0-100, {@code null} when the region has no reservoir reading
 */
public record WaterDailyRecord(
        LocalDate date,
        String regionId,
        double waterDemandM3,
        double waterSupplyM3,
        Double reservoirLevelPct
) implements DailyRecord {
}
