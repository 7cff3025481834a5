package com.forecastmind.core.agents;

import com.forecastmind.core.model.AgentConfig;

/**
 * Per-call overrides for one agent invocation. Null fields fall back to the agent card
 * and the reasoning service defaults.
 */
public record InvocationOptions(
    Double temperature,
    Integer maxTokens,
    String systemPromptOverride,
    String userPromptOverride
) {

    public static final InvocationOptions DEFAULTS = new InvocationOptions(null, null, null, null);

    public static InvocationOptions from(AgentConfig config) {
        if (config == null) {
            return DEFAULTS;
        }
        return new InvocationOptions(config.temperature(), config.maxTokens(),
                config.systemPromptOverride(), config.userPromptOverride());
    }
}
