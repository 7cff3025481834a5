package com.forecastmind.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Result of executing one stage for one forecast.
 *
 * @param stage         the stage executed
 * @param status        SUCCESS when every selected agent contributed, PARTIAL when some did, FAILED when none did
 * @param output        merged stage output (empty on failure)
 * @param contributions contributions from the agents that succeeded
 * @param elapsedMs     stage wall-clock time
 * @param error         failure description (nullable)
 */
public record StageResult(
    ForecastStage stage,
    StageStatus status,
    Map<String, Object> output,
    List<AgentContribution> contributions,
    long elapsedMs,
    String error
) implements Serializable {

    public static StageResult failed(ForecastStage stage, long elapsedMs, String error) {
        return new StageResult(stage, StageStatus.FAILED, Map.of(), List.of(), elapsedMs, error);
    }

    public boolean isFailed() {
        return status == StageStatus.FAILED;
    }
}
