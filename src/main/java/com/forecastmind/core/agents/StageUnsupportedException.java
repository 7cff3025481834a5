package com.forecastmind.core.agents;

import com.forecastmind.core.model.ForecastStage;

/**
 * Thrown when an agent is invoked for a stage its card does not declare.
 */
public class StageUnsupportedException extends RuntimeException {
    public StageUnsupportedException(String agentId, ForecastStage stage) {
        super("Agent " + agentId + " does not support stage: " + stage);
    }
}
