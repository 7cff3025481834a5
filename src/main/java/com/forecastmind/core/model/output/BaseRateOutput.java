package com.forecastmind.core.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * @param probability        the base rate (required for the output to be applied)
 * @param confidenceInterval {@code [low, high]}; defaults to ±0.1 when absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BaseRateOutput(
    Double probability,
    List<Double> confidenceInterval,
    Integer sampleSize,
    String reasoning,
    Double confidence
) {}
