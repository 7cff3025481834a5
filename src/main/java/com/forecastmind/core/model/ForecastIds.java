package com.forecastmind.core.model;

import java.util.UUID;

/**
 * Generates short prefixed identifiers for forecasts and tasks.
 */
public final class ForecastIds {

    private ForecastIds() {}

    public static String newForecastId() {
        return "fc-" + shortUuid();
    }

    public static String newTaskId() {
        return "task-" + shortUuid();
    }

    private static String shortUuid() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
