package com.forecastmind.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Resolved stage configuration for one task.
 */
public record PipelineConfig(
    String presetId,
    Map<ForecastStage, StageConfig> stages
) implements Serializable {

    public PipelineConfig {
        var copy = new EnumMap<ForecastStage, StageConfig>(ForecastStage.class);
        if (stages != null) {
            copy.putAll(stages);
        }
        stages = Collections.unmodifiableMap(copy);
    }

    /** Config for the given stage; stages without an entry are disabled. */
    public StageConfig stage(ForecastStage stage) {
        return stages.getOrDefault(stage, StageConfig.disabled());
    }
}
