package com.forecastmind.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Declarative settings for one stage. An empty agent list defers selection to the coherence
 * router; a list whose entries are all disabled leaves the stage without agents.
 */
public record StageConfig(
    boolean enabled,
    boolean parallel,
    List<AgentConfig> agents
) implements Serializable {

    public StageConfig {
        agents = agents != null ? List.copyOf(agents) : List.of();
    }

    public static StageConfig disabled() {
        return new StageConfig(false, false, List.of());
    }

    public List<String> enabledAgentIds() {
        return agents.stream().filter(AgentConfig::enabled).map(AgentConfig::agentId).toList();
    }

    public AgentConfig agentConfig(String agentId) {
        return agents.stream().filter(a -> a.agentId().equals(agentId)).findFirst().orElse(null);
    }
}
