package com.stresscast.scenario.repository;

import com.stresscast.scenario.entity.SimulationRunEntity;
import java.time.Instant;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaSimulationRunRepository extends JpaRepository<SimulationRunEntity, UUID> {

    @Modifying
    @Query("DELETE FROM SimulationRunEntity r WHERE r.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("cutoff") Instant cutoff);
}
