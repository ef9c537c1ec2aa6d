package com.stresscast.scenario.economics;

/**
 * A region's average stress over a run, joined with its population.
 */
public record RegionExposure(String regionId, String regionName, long population, double avgStress) {
}
