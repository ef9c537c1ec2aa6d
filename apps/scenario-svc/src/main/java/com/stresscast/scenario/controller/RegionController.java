package com.stresscast.scenario.controller;

import com.stresscast.scenario.controller.dto.RegionsListResponseDto;
import com.stresscast.scenario.repository.RegionDirectory;
import com.stresscast.scenario.web.RequestContextHolder;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/regions")
public class RegionController {

    private final RegionDirectory regionDirectory;

    public RegionController(RegionDirectory regionDirectory) {
        this.regionDirectory = regionDirectory;
    }

    @GetMapping
    public ResponseEntity<RegionsListResponseDto> list() {
        var regions = regionDirectory.findAll().stream()
                .map(region -> new RegionsListResponseDto.RegionDto(region.id(), region.name(), region.population()))
                .toList();
        return ResponseEntity.ok(new RegionsListResponseDto(regions, RequestContextHolder.traceId().orElse(null)));
    }
}
