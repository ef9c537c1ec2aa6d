package com.stresscast.scenario.repository;

import com.stresscast.scenario.entity.EnergyDailyEntity;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaEnergyDailyRepository extends JpaRepository<EnergyDailyEntity, UUID> {

    @Query("SELECT e FROM EnergyDailyEntity e WHERE e.date >= :from AND e.date <= :to ORDER BY e.date ASC, e.regionId ASC")
    List<EnergyDailyEntity> findInRange(@Param("from") LocalDate from, @Param("to") LocalDate to);
}
