package com.stresscast.scenario.simulation;

import com.stresscast.scenario.model.AgricultureScenario;
import com.stresscast.scenario.model.CropType;
import com.stresscast.scenario.model.ScenarioParameters;
import com.stresscast.scenario.model.ValidationResult;
import java.text.DecimalFormat;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import org.springframework.stereotype.Component;

/**
 * Checks scenario parameters before a simulation runs. Stops at the first problem found.
 */
@Component
public class ScenarioValidator {

    static final long MAX_SPAN_DAYS = 1825;

    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    public ValidationResult validate(ScenarioParameters params) {
        if (params == null) {
            return ValidationResult.invalid("Scenario parameters are required");
        }
        for (ScenarioParameters.BoundedValue bounded : params.boundedValues()) {
            if (!Double.isFinite(bounded.value())) {
                return ValidationResult.invalid(bounded.label() + " must be a finite number");
            }
            if (bounded.value() < bounded.min() || bounded.value() > bounded.max()) {
                return ValidationResult.invalid(String.format("%s must be between %s%s and %s%s",
                        bounded.label(),
                        format(bounded.min()), bounded.unit(),
                        format(bounded.max()), bounded.unit()));
            }
        }
        if (params instanceof AgricultureScenario agriculture && CropType.fromCode(agriculture.cropType()).isEmpty()) {
            return ValidationResult.invalid("Crop type must be one of: " + CropType.allowedCodes());
        }
        return validateDates(params.startDate(), params.endDate());
    }

    private ValidationResult validateDates(String start, String end) {
        LocalDate startDate = parseDate(start);
        if (startDate == null) {
            return ValidationResult.invalid("Start date must be a valid date in YYYY-MM-DD format");
        }
        LocalDate endDate = parseDate(end);
        if (endDate == null) {
            return ValidationResult.invalid("End date must be a valid date in YYYY-MM-DD format");
        }
        if (!endDate.isAfter(startDate)) {
            return ValidationResult.invalid("End date must be after start date");
        }
        if (ChronoUnit.DAYS.between(startDate, endDate) > MAX_SPAN_DAYS) {
            return ValidationResult.invalid("Date range cannot exceed 5 years (" + MAX_SPAN_DAYS + " days)");
        }
        return ValidationResult.ok();
    }

    /**
     * Strict {@code YYYY-MM-DD} parse, ignoring surrounding whitespace.
     *
     * @return {@code null} when the value is missing or not a calendar date
     */
    public static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim(), ISO_DATE);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static String format(double value) {
        return new DecimalFormat("0.##").format(value);
    }
}
