package com.stresscast.scenario.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;
import org.springframework.http.HttpStatus;

/**
 * Error body shared by every endpoint. {@code details} is omitted when there is nothing to add.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponseDto(int status, String code, String message, Map<String, Object> details, String traceId) {

    public static ErrorResponseDto of(HttpStatus status, String code, String message, Map<String, Object> details, String traceId) {
        return new ErrorResponseDto(status.value(), code, message, details == null ? Map.of() : Map.copyOf(details), traceId);
    }
}
