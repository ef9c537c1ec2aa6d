package com.stresscast.scenario.repository;

import com.stresscast.scenario.model.Region;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public interface RegionDirectory {

    List<Region> findAll();

    default Map<String, Region> byId() {
        return findAll().stream()
                .collect(Collectors.toMap(Region::id, Function.identity(), (first, second) -> first));
    }
}
