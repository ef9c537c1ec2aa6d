package com.stresscast.scenario.controller.dto;

import jakarta.validation.constraints.NotBlank;

public record ExplainRequestDto(@NotBlank String runId) {
}
