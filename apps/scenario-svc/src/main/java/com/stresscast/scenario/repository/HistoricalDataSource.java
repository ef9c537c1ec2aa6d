package com.stresscast.scenario.repository;

import com.stresscast.scenario.model.AgricultureDailyRecord;
import com.stresscast.scenario.model.CropType;
import com.stresscast.scenario.model.EnergyDailyRecord;
import com.stresscast.scenario.model.WaterDailyRecord;
import java.time.LocalDate;
import java.util.List;

/**
 * Read-only access to historical daily measurements. Ranges are inclusive on both ends and
 * rows come back ordered by date. Implementations throw {@link DataSourceException} when the
 * store cannot be queried; an empty list means there is no data in range.
 */
public interface HistoricalDataSource {

    List<EnergyDailyRecord> findEnergy(LocalDate from, LocalDate to);

    List<WaterDailyRecord> findWater(LocalDate from, LocalDate to);

    /**
     * @param crop {@link CropType#ALL} for every crop
     */
    List<AgricultureDailyRecord> findAgriculture(LocalDate from, LocalDate to, CropType crop);
}
