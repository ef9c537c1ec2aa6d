package com.stresscast.scenario.model;

public record Region(String id, String name, long population) {
}
