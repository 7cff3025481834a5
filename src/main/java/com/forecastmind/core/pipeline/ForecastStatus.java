package com.forecastmind.core.pipeline;

import com.forecastmind.core.model.ForecastContext;
import com.forecastmind.core.model.ForecastStage;
import com.forecastmind.core.model.TaskState;

import java.time.Instant;

/**
 * Point-in-time view of one forecast and its task.
 */
public record ForecastStatus(
    String forecastId,
    String taskId,
    String presetId,
    TaskState state,
    ForecastStage currentStage,
    int progress,
    String error,
    Instant createdAt,
    Instant completedAt,
    ForecastContext context
) {}
