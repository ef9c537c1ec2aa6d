package com.stresscast.scenario.repository;

import com.stresscast.scenario.entity.WaterDailyEntity;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaWaterDailyRepository extends JpaRepository<WaterDailyEntity, UUID> {

    @Query("SELECT w FROM WaterDailyEntity w WHERE w.date >= :from AND w.date <= :to ORDER BY w.date ASC, w.regionId ASC")
    List<WaterDailyEntity> findInRange(@Param("from") LocalDate from, @Param("to") LocalDate to);
}
