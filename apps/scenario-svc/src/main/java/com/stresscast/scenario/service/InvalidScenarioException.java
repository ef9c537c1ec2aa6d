package com.stresscast.scenario.service;

import com.stresscast.scenario.model.Domain;

/**
 * Scenario parameters rejected by the validator. The message is the validator's error text.
 */
public class InvalidScenarioException extends IllegalArgumentException {

    private final Domain domain;

    public InvalidScenarioException(Domain domain, String message) {
        super(message);
        this.domain = domain;
    }

    public Domain getDomain() {
        return domain;
    }
}
