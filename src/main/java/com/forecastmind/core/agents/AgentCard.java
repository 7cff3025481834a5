package com.forecastmind.core.agents;

import com.forecastmind.core.model.ForecastStage;

import java.io.Serializable;
import java.util.List;
import java.util.Set;

/**
 * Static capability descriptor of an agent. Immutable; registered once at startup.
 *
 * @param id               unique agent id (e.g. "base-rate-calculator")
 * @param name             display name
 * @param version          card version
 * @param description      what the agent does
 * @param capabilities     supported stages, actions and I/O type tags
 * @param coherenceProfile semantic domain and frequency tier used by the router
 * @param constraints      token, timeout and rate limits
 */
public record AgentCard(
    String id,
    String name,
    String version,
    String description,
    Capabilities capabilities,
    CoherenceProfile coherenceProfile,
    Constraints constraints
) implements Serializable {

    public static final String WEB_SEARCH_ACTION = "web_search";

    public record Capabilities(
        Set<ForecastStage> supportedStages,
        List<String> actions,
        List<String> inputTypes,
        List<String> outputTypes
    ) implements Serializable {

        public Capabilities {
            supportedStages = Set.copyOf(supportedStages);
            actions = List.copyOf(actions);
            inputTypes = List.copyOf(inputTypes);
            outputTypes = List.copyOf(outputTypes);
        }
    }

    public record CoherenceProfile(String semanticDomain, FrequencyTier frequencyTier) implements Serializable {}

    /**
     * @param rateLimit free-form limit such as "10/minute"; enforcement belongs to the reasoning service
     */
    public record Constraints(
        int maxTokensInput,
        int maxTokensOutput,
        long timeoutMs,
        String rateLimit
    ) implements Serializable {}

    public boolean supports(ForecastStage stage) {
        return capabilities.supportedStages().contains(stage);
    }

    public boolean usesWebSearch() {
        return capabilities.actions().contains(WEB_SEARCH_ACTION);
    }
}
