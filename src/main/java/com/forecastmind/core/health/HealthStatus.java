package com.forecastmind.core.health;

import java.util.Map;

/**
 * Health of one runtime component.
 *
 * @param details component-specific figures such as queue depth or agent count
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> details
) {
    public enum Status { UP, DEGRADED, DOWN }

    public boolean isUp() {
        return status == Status.UP;
    }
}
