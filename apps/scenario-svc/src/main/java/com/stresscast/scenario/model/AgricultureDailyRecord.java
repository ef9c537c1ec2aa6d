package com.stresscast.scenario.model;

import java.time.LocalDate;

public record AgricultureDailyRecord(
        LocalDate date,
        String regionId,
        CropType cropType,
        double yieldKgPerHectare,
        double rainfallMm,
        double temperatureAvgC,
        double soilMoisturePct
) implements DailyRecord {
}
