package com.stresscast.scenario.repository;

import com.stresscast.scenario.entity.RegionEntity;
import com.stresscast.scenario.model.Region;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(prefix = "stresscast", name = "store", havingValue = "jpa", matchIfMissing = true)
public class PostgreSQLRegionDirectory implements RegionDirectory {

    private final JpaRegionRepository jpaRegionRepository;

    public PostgreSQLRegionDirectory(JpaRegionRepository jpaRegionRepository) {
        this.jpaRegionRepository = jpaRegionRepository;
    }

    @Override
    public List<Region> findAll() {
        try {
            return jpaRegionRepository.findAllByOrderByIdAsc().stream()
                    .map(this::toModel)
                    .toList();
        } catch (DataAccessException ex) {
            throw DataSourceException.fetchFailed("regions", ex);
        }
    }

    private Region toModel(RegionEntity entity) {
        long population = entity.getPopulation() != null ? entity.getPopulation() : 0L;
        return new Region(entity.getId(), entity.getName(), population);
    }
}
