package com.stresscast.scenario.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationResult(@JsonProperty("isValid") boolean valid, String error) {

    private static final ValidationResult OK = new ValidationResult(true, null);

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult invalid(String error) {
        return new ValidationResult(false, error);
    }
}
