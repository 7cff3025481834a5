package com.forecastmind.core.pipeline;

import com.forecastmind.core.model.ForecastStage;

import java.util.List;

/**
 * Thrown when every agent invoked for a stage failed.
 */
public class AllAgentsFailedException extends RuntimeException {

    public AllAgentsFailedException(ForecastStage stage, List<String> errors) {
        super("All agents failed for stage " + stage + ": " + String.join("; ", errors));
    }

    public AllAgentsFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
