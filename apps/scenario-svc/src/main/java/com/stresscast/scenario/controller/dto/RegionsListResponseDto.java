package com.stresscast.scenario.controller.dto;

import java.util.List;

public record RegionsListResponseDto(List<RegionDto> regions, String traceId) {

    public record RegionDto(String id, String name, long population) {
    }
}
