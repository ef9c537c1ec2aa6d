package com.stresscast.scenario.repository;

import com.stresscast.scenario.model.AgricultureDailyRecord;
import com.stresscast.scenario.model.CropType;
import com.stresscast.scenario.model.DailyRecord;
import com.stresscast.scenario.model.EnergyDailyRecord;
import com.stresscast.scenario.model.WaterDailyRecord;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(prefix = "stresscast", name = "store", havingValue = "memory")
public class InMemoryHistoricalDataSource implements HistoricalDataSource {

    private final List<EnergyDailyRecord> energy = new CopyOnWriteArrayList<>();
    private final List<WaterDailyRecord> water = new CopyOnWriteArrayList<>();
    private final List<AgricultureDailyRecord> agriculture = new CopyOnWriteArrayList<>();

    public void saveEnergy(Collection<EnergyDailyRecord> records) {
        energy.addAll(records);
    }

    public void saveWater(Collection<WaterDailyRecord> records) {
        water.addAll(records);
    }

    public void saveAgriculture(Collection<AgricultureDailyRecord> records) {
        agriculture.addAll(records);
    }

    public void clear() {
        energy.clear();
        water.clear();
        agriculture.clear();
    }

    @Override
    public List<EnergyDailyRecord> findEnergy(LocalDate from, LocalDate to) {
        return inRange(energy, from, to);
    }

    @Override
    public List<WaterDailyRecord> findWater(LocalDate from, LocalDate to) {
        return inRange(water, from, to);
    }

    @Override
    public List<AgricultureDailyRecord> findAgriculture(LocalDate from, LocalDate to, CropType crop) {
        return inRange(agriculture, from, to).stream()
                .filter(record -> crop == null || crop == CropType.ALL || record.cropType() == crop)
                .toList();
    }

    private static <R extends DailyRecord> List<R> inRange(List<R> source, LocalDate from, LocalDate to) {
        return source.stream()
                .filter(record -> !record.date().isBefore(from) && !record.date().isAfter(to))
                .sorted(Comparator.comparing(DailyRecord::date))
                .toList();
    }
}
