package com.stresscast.scenario.repository;

import com.stresscast.scenario.entity.AgricultureDailyEntity;
import com.stresscast.scenario.model.AgricultureDailyRecord;
import com.stresscast.scenario.model.CropType;
import com.stresscast.scenario.model.EnergyDailyRecord;
import com.stresscast.scenario.model.WaterDailyRecord;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(prefix = "stresscast", name = "store", havingValue = "jpa", matchIfMissing = true)
public class PostgreSQLHistoricalDataSource implements HistoricalDataSource {

    private static final Logger log = LoggerFactory.getLogger(PostgreSQLHistoricalDataSource.class);

    private final JpaEnergyDailyRepository energyRepository;
    private final JpaWaterDailyRepository waterRepository;
    private final JpaAgricultureDailyRepository agricultureRepository;

    public PostgreSQLHistoricalDataSource(JpaEnergyDailyRepository energyRepository,
                                          JpaWaterDailyRepository waterRepository,
                                          JpaAgricultureDailyRepository agricultureRepository) {
        this.energyRepository = energyRepository;
        this.waterRepository = waterRepository;
        this.agricultureRepository = agricultureRepository;
    }

    @Override
    public List<EnergyDailyRecord> findEnergy(LocalDate from, LocalDate to) {
        try {
            return energyRepository.findInRange(from, to).stream()
                    .map(entity -> new EnergyDailyRecord(entity.getDate(), entity.getRegionId(), entity.getDemandMwh()))
                    .toList();
        } catch (DataAccessException ex) {
            throw DataSourceException.fetchFailed("energy data", ex);
        }
    }

    @Override
    public List<WaterDailyRecord> findWater(LocalDate from, LocalDate to) {
        try {
            return waterRepository.findInRange(from, to).stream()
                    .map(entity -> new WaterDailyRecord(
                            entity.getDate(),
                            entity.getRegionId(),
                            entity.getWaterDemandM3(),
                            entity.getWaterSupplyM3(),
                            entity.getReservoirLevelPct()))
                    .toList();
        } catch (DataAccessException ex) {
            throw DataSourceException.fetchFailed("water data", ex);
        }
    }

    @Override
    public List<AgricultureDailyRecord> findAgriculture(LocalDate from, LocalDate to, CropType crop) {
        List<AgricultureDailyEntity> entities;
        try {
            entities = crop == null || crop == CropType.ALL
                    ? agricultureRepository.findInRange(from, to)
                    : agricultureRepository.findInRangeForCrop(from, to, crop.code());
        } catch (DataAccessException ex) {
            throw DataSourceException.fetchFailed("agriculture data", ex);
        }
        return entities.stream()
                .map(this::toRecord)
                .flatMap(Optional::stream)
                .toList();
    }

    private Optional<AgricultureDailyRecord> toRecord(AgricultureDailyEntity entity) {
        Optional<CropType> crop = CropType.fromCode(entity.getCropType()).filter(type -> type != CropType.ALL);
        if (crop.isEmpty()) {
            log.warn("Skipping agriculture row {} with unknown crop '{}'", entity.getId(), entity.getCropType());
            return Optional.empty();
        }
        return Optional.of(new AgricultureDailyRecord(
                entity.getDate(),
                entity.getRegionId(),
                crop.get(),
                entity.getYieldKgPerHectare(),
                entity.getRainfallMm(),
                entity.getTemperatureAvgC(),
                entity.getSoilMoisturePct()));
    }
}
