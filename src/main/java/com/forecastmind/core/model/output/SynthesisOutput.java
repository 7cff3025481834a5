package com.forecastmind.core.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SynthesisOutput(
    Double finalProbability,
    List<Double> confidenceInterval,
    String recommendation,
    List<String> keyDrivers
) {

    public SynthesisOutput {
        keyDrivers = StageOutputReader.withoutNulls(keyDrivers);
    }
}
