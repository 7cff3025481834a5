package com.forecastmind.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a forecast runs, relayed verbatim to SSE and CLI subscribers.
 *
 * @param eventType  one of the constants below (e.g. "stage.started", "task.queued")
 * @param forecastId the forecast this event belongs to
 * @param taskId     the pipeline task (nullable for forecast-level events)
 * @param payload    event data
 * @param timestamp  when the event occurred
 */
public record ForecastEvent(
    String eventType,
    String forecastId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String STAGE_STARTED = "stage.started";
    public static final String STAGE_COMPLETED = "stage.completed";
    public static final String PROGRESS_UPDATED = "progress.updated";
    public static final String PIPELINE_COMPLETED = "pipeline.completed";
    public static final String PIPELINE_ERROR = "pipeline.error";

    public static final String TASK_QUEUED = "task.queued";
    public static final String TASK_STARTED = "task.started";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_FAILED = "task.failed";
    public static final String TASK_CANCELLED = "task.cancelled";

    public static ForecastEvent of(String eventType, String forecastId, String taskId, Map<String, Object> payload) {
        return new ForecastEvent(eventType, forecastId, taskId, payload, Instant.now());
    }

    public boolean isTerminal() {
        return PIPELINE_COMPLETED.equals(eventType) || PIPELINE_ERROR.equals(eventType)
                || TASK_CANCELLED.equals(eventType);
    }
}
