package com.forecastmind.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A recorded lifecycle transition of a task.
 */
public record StateTransition(
    TaskState from,
    TaskState to,
    Instant at,
    String reason
) implements Serializable {}
