package com.forecastmind.core.agents;

import com.forecastmind.core.model.AgentContribution;

/**
 * Outcome of one agent invocation. Exactly one of {@code contribution} and {@code error} is set.
 */
public record InvocationResult(
    String agentId,
    AgentContribution contribution,
    boolean success,
    String error,
    long latencyMs
) {

    public static InvocationResult success(AgentContribution contribution) {
        return new InvocationResult(contribution.agentId(), contribution, true, null, contribution.latencyMs());
    }

    public static InvocationResult failure(String agentId, String error, long latencyMs) {
        return new InvocationResult(agentId, null, false, error, latencyMs);
    }
}
