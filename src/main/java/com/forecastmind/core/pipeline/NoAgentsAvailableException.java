package com.forecastmind.core.pipeline;

import com.forecastmind.core.model.ForecastStage;

/**
 * Thrown when agent selection for a stage produced an empty set.
 */
public class NoAgentsAvailableException extends RuntimeException {

    public NoAgentsAvailableException(ForecastStage stage) {
        super("No agents available for stage: " + stage);
    }

    public NoAgentsAvailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
