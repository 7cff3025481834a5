package com.forecastmind.core.agents;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coherence tier of an agent: coordinators deliberate over many inputs, workers gather and react.
 */
public enum FrequencyTier {
    COORDINATOR("theta"),
    WORKER("gamma");

    private final String band;

    FrequencyTier(String band) {
        this.band = band;
    }

    @JsonValue
    public String band() {
        return band;
    }
}
