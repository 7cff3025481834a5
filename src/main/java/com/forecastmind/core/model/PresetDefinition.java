package com.forecastmind.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * A named pipeline configuration: which agents run in which stage.
 *
 * @param id                   preset key ("quick", "balanced", "deep")
 * @param name                 display name
 * @param description          one-line summary
 * @param priority             queue priority; higher dequeues first
 * @param estimatedTimeSeconds rough wall-clock estimate
 * @param recommended          whether this is the recommended default
 * @param stages               agent ids per stage; an empty list disables the stage
 */
public record PresetDefinition(
    String id,
    String name,
    String description,
    int priority,
    int estimatedTimeSeconds,
    boolean recommended,
    Map<ForecastStage, List<String>> stages
) implements Serializable {

    public int agentCount() {
        return (int) stages.values().stream().flatMap(List::stream).distinct().count();
    }
}
