package com.forecastmind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One agent's result for one stage execution.
 *
 * @param agentId    the contributing agent
 * @param agentName  display name from the agent card
 * @param output     parsed structured output, kept exactly as the agent returned it
 * @param confidence extracted confidence score in [0, 1]
 * @param latencyMs  wall-clock time from call start to parse completion
 * @param timestamp  when the contribution was produced
 * @param sources    evidence sources discovered by search-augmented calls (empty otherwise)
 */
public record AgentContribution(
    String agentId,
    String agentName,
    Map<String, Object> output,
    double confidence,
    long latencyMs,
    Instant timestamp,
    List<String> sources
) implements Serializable {

    public AgentContribution {
        output = output != null ? output : Map.of();
        sources = sources != null ? List.copyOf(sources) : List.of();
    }
}
