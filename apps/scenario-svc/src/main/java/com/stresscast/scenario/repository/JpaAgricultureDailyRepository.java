package com.stresscast.scenario.repository;

import com.stresscast.scenario.entity.AgricultureDailyEntity;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaAgricultureDailyRepository extends JpaRepository<AgricultureDailyEntity, UUID> {

    @Query("SELECT a FROM AgricultureDailyEntity a WHERE a.date >= :from AND a.date <= :to ORDER BY a.date ASC, a.regionId ASC, a.cropType ASC")
    List<AgricultureDailyEntity> findInRange(@Param("from") LocalDate from, @Param("to") LocalDate to);

    @Query("SELECT a FROM AgricultureDailyEntity a WHERE a.date >= :from AND a.date <= :to AND a.cropType = :cropType ORDER BY a.date ASC, a.regionId ASC")
    List<AgricultureDailyEntity> findInRangeForCrop(@Param("from") LocalDate from,
                                                    @Param("to") LocalDate to,
                                                    @Param("cropType") String cropType);
}
