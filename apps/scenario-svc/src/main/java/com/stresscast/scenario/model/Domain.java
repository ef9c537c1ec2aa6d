package com.stresscast.scenario.model;

/**
 * Infrastructure domains the simulator can project.
 * The critical threshold is the stress above which a (region, day) counts as a
 * critical day in the summary; energy and water differ on purpose.
 */
public enum Domain {
    ENERGY("energy", 0.6, false),
    WATER("water", 0.7, true),
    AGRICULTURE("agriculture", 0.7, true);

    private final String code;
    private final double criticalThreshold;
    private final boolean tracksUnmetDemand;

    Domain(String code, double criticalThreshold, boolean tracksUnmetDemand) {
        this.code = code;
        this.criticalThreshold = criticalThreshold;
        this.tracksUnmetDemand = tracksUnmetDemand;
    }

    public String code() {
        return code;
    }

    public double criticalThreshold() {
        return criticalThreshold;
    }

    public boolean tracksUnmetDemand() {
        return tracksUnmetDemand;
    }

    public static Domain fromCode(String code) {
        if (code != null) {
            for (Domain domain : values()) {
                if (domain.code.equalsIgnoreCase(code.trim())) {
                    return domain;
                }
            }
        }
        throw new IllegalArgumentException("Unknown domain: " + code);
    }
}
