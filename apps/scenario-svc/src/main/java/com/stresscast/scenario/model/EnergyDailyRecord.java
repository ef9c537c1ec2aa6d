package com.stresscast.scenario.model;

import java.time.LocalDate;

public record EnergyDailyRecord(LocalDate date, String regionId, double demandMwh) implements DailyRecord {
}
