package com.stresscast.scenario.repository;

import com.stresscast.scenario.entity.RegionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaRegionRepository extends JpaRepository<RegionEntity, String> {

    List<RegionEntity> findAllByOrderByIdAsc();
}
