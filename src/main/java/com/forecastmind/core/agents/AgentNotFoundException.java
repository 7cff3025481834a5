package com.forecastmind.core.agents;

/**
 * Thrown when an agent id is not registered.
 */
public class AgentNotFoundException extends RuntimeException {
    public AgentNotFoundException(String agentId) {
        super("Agent not found: " + agentId);
    }
}
