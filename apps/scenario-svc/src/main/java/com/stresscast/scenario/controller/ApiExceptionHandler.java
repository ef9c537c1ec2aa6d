package com.stresscast.scenario.controller;

import com.stresscast.scenario.controller.dto.ErrorResponseDto;
import com.stresscast.scenario.repository.DataSourceException;
import com.stresscast.scenario.service.InvalidScenarioException;
import com.stresscast.scenario.service.RunNotFoundException;
import com.stresscast.scenario.web.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidScenarioException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidScenario(InvalidScenarioException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_SCENARIO", ex.getMessage(),
                Map.of("domain", ex.getDomain().code()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidBody(MethodArgumentNotValidException ex) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed", Map.of("fields", fields));
    }

    @ExceptionHandler({ConstraintViolationException.class, HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(RunNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleRunNotFound(RunNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "RUN_NOT_FOUND", ex.getMessage(), Map.of("runId", String.valueOf(ex.getRunId())));
    }

    @ExceptionHandler(DataSourceException.class)
    public ResponseEntity<ErrorResponseDto> handleDataSource(DataSourceException ex) {
        log.warn("Historical data fetch failed: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "DATA_SOURCE_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error", ex);
        String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", Map.of("reason", reason));
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.status(status)
                .body(ErrorResponseDto.of(status, code, message, details, traceId));
    }
}
