package com.forecastmind.core.model;

import java.io.Serializable;

/**
 * Per-agent settings inside a {@link StageConfig}.
 *
 * @param agentId              agent to invoke
 * @param enabled              disabled entries are ignored during selection
 * @param weight               relative weight (informational; merges weight by confidence)
 * @param systemPromptOverride replaces the agent's system prompt template (nullable)
 * @param userPromptOverride   replaces the agent's user prompt template (nullable)
 * @param temperature          sampling temperature (nullable, falls back to the service default)
 * @param maxTokens            output token ceiling (nullable, falls back to the agent card)
 */
public record AgentConfig(
    String agentId,
    boolean enabled,
    double weight,
    String systemPromptOverride,
    String userPromptOverride,
    Double temperature,
    Integer maxTokens
) implements Serializable {

    public static AgentConfig defaults(String agentId, int maxTokens) {
        return new AgentConfig(agentId, true, 1.0, null, null, 0.7, maxTokens);
    }
}
