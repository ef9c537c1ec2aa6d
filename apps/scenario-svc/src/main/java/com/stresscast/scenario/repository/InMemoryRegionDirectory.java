package com.stresscast.scenario.repository;

import com.stresscast.scenario.model.Region;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(prefix = "stresscast", name = "store", havingValue = "memory")
public class InMemoryRegionDirectory implements RegionDirectory {

    private final Map<String, Region> storage = new ConcurrentHashMap<>();

    public InMemoryRegionDirectory() {
        RegionCatalog.DEPARTMENTS.forEach(this::save);
    }

    public Region save(Region region) {
        storage.put(region.id(), region);
        return region;
    }

    @Override
    public List<Region> findAll() {
        return storage.values().stream()
                .sorted(Comparator.comparing(Region::id))
                .toList();
    }
}
