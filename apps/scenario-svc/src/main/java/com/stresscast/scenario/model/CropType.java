package com.stresscast.scenario.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Crops tracked by the agriculture data set. {@link #ALL} is only a scenario filter.
 */
public enum CropType {
    ALL("all", 0, 0),
    COFFEE("coffee", 1000, 4.0),
    SUGAR_CANE("sugar_cane", 70000, 6.0),
    CORN("corn", 2750, 5.0),
    BEANS("beans", 1150, 3.5);

    private final String code;
    private final double baselineYieldKgPerHectare;
    private final double waterNeedMmPerDay;

    CropType(String code, double baselineYieldKgPerHectare, double waterNeedMmPerDay) {
        this.code = code;
        this.baselineYieldKgPerHectare = baselineYieldKgPerHectare;
        this.waterNeedMmPerDay = waterNeedMmPerDay;
    }

    public String code() {
        return code;
    }

    public double baselineYieldKgPerHectare() {
        return baselineYieldKgPerHectare;
    }

    public double waterNeedMmPerDay() {
        return waterNeedMmPerDay;
    }

    public static Optional<CropType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim();
        return Arrays.stream(values())
                .filter(crop -> crop.code.equalsIgnoreCase(normalized))
                .findFirst();
    }

    public static String allowedCodes() {
        return Arrays.stream(values()).map(CropType::code).collect(Collectors.joining(", "));
    }
}
