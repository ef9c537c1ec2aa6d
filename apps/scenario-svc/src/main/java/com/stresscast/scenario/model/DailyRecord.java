package com.stresscast.scenario.model;

import java.time.LocalDate;

/**
 * One historical measurement row for a region and day.
 */
public interface DailyRecord {

    LocalDate date();

    String regionId();
}
