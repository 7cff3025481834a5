package com.forecastmind.core.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AdversarialReviewOutput(
    List<String> concerns,
    List<String> biases,
    Double confidenceAdjustment
) {

    public AdversarialReviewOutput {
        concerns = StageOutputReader.withoutNulls(concerns);
        biases = StageOutputReader.withoutNulls(biases);
    }
}
