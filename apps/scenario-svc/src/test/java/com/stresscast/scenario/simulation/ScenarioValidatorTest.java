package com.stresscast.scenario.simulation;

import static org.assertj.core.api.Assertions.assertThat;

import com.stresscast.scenario.model.AgricultureScenario;
import com.stresscast.scenario.model.EnergyScenario;
import com.stresscast.scenario.model.ValidationResult;
import com.stresscast.scenario.model.WaterScenario;
import org.junit.jupiter.api.Test;

class ScenarioValidatorTest {

    private final ScenarioValidator validator = new ScenarioValidator();

    @Test
    void acceptsValidScenarios() {
        assertThat(validator.validate(new EnergyScenario(50, -20, "2024-01-01", "2024-03-31")).valid()).isTrue();
        assertThat(validator.validate(new WaterScenario(10, -30, 15, "2024-01-01", "2024-12-31")).valid()).isTrue();
        assertThat(validator.validate(new AgricultureScenario(-20, 2, 25, "coffee", "2024-01-01", "2024-06-30")).valid()).isTrue();
    }

    @Test
    void acceptsRangeBoundaries() {
        assertThat(validator.validate(new EnergyScenario(-100, 200, "2024-01-01", "2024-01-02")).valid()).isTrue();
        assertThat(validator.validate(new WaterScenario(-50, -100, 100, "2024-01-01", "2024-01-02")).valid()).isTrue();
        assertThat(validator.validate(new AgricultureScenario(200, 10, 0, "all", "2024-01-01", "2024-01-02")).valid()).isTrue();
    }

    @Test
    void rejectsMissingParameters() {
        ValidationResult result = validator.validate(null);
        assertThat(result.valid()).isFalse();
        assertThat(result.error()).isEqualTo("Scenario parameters are required");
    }

    @Test
    void reportsOutOfRangePercentages() {
        assertThat(validator.validate(new EnergyScenario(250, 0, "2024-01-01", "2024-01-31")).error())
                .isEqualTo("Solar growth must be between -100% and 200%");
        assertThat(validator.validate(new WaterScenario(-60, 0, 0, "2024-01-01", "2024-01-31")).error())
                .isEqualTo("Water demand growth must be between -50% and 200%");
        assertThat(validator.validate(new WaterScenario(0, 0, 120, "2024-01-01", "2024-01-31")).error())
                .isEqualTo("Conservation rate must be between 0% and 100%");
        assertThat(validator.validate(new AgricultureScenario(0, 12, 0, "corn", "2024-01-01", "2024-01-31")).error())
                .isEqualTo("Temperature change must be between -5°C and 10°C");
    }

    @Test
    void reportsFirstFailureOnly() {
        ValidationResult result = validator.validate(new EnergyScenario(250, 500, "bad", "worse"));
        assertThat(result.error()).isEqualTo("Solar growth must be between -100% and 200%");
    }

    @Test
    void rejectsNonFiniteValues() {
        assertThat(validator.validate(new EnergyScenario(Double.NaN, 0, "2024-01-01", "2024-01-31")).error())
                .isEqualTo("Solar growth must be a finite number");
        assertThat(validator.validate(new EnergyScenario(0, Double.POSITIVE_INFINITY, "2024-01-01", "2024-01-31")).error())
                .isEqualTo("Rainfall change must be a finite number");
    }

    @Test
    void rejectsUnknownCrop() {
        assertThat(validator.validate(new AgricultureScenario(0, 0, 0, "rice", "2024-01-01", "2024-01-31")).error())
                .isEqualTo("Crop type must be one of: all, coffee, sugar_cane, corn, beans");
    }

    @Test
    void rejectsMalformedDates() {
        assertThat(validator.validate(new EnergyScenario(0, 0, "2024-13-01", "2024-01-31")).error())
                .isEqualTo("Start date must be a valid date in YYYY-MM-DD format");
        assertThat(validator.validate(new EnergyScenario(0, 0, "01/01/2024", "2024-01-31")).error())
                .isEqualTo("Start date must be a valid date in YYYY-MM-DD format");
        assertThat(validator.validate(new EnergyScenario(0, 0, "2024-01-01", "2023-02-29")).error())
                .isEqualTo("End date must be a valid date in YYYY-MM-DD format");
        assertThat(validator.validate(new EnergyScenario(0, 0, "2024-01-01", null)).error())
                .isEqualTo("End date must be a valid date in YYYY-MM-DD format");
    }

    @Test
    void requiresEndAfterStart() {
        assertThat(validator.validate(new EnergyScenario(0, 0, "2024-01-31", "2024-01-31")).error())
                .isEqualTo("End date must be after start date");
        assertThat(validator.validate(new EnergyScenario(0, 0, "2024-02-01", "2024-01-31")).error())
                .isEqualTo("End date must be after start date");
    }

    @Test
    void limitsRangeToFiveYears() {
        assertThat(validator.validate(new EnergyScenario(0, 0, "2020-01-01", "2024-12-30")).valid()).isTrue();
        assertThat(validator.validate(new EnergyScenario(0, 0, "2020-01-01", "2024-12-31")).error())
                .isEqualTo("Date range cannot exceed 5 years (1825 days)");
    }
}
