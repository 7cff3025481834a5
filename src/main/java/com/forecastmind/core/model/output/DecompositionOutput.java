package com.forecastmind.core.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.forecastmind.core.model.SubQuestion;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DecompositionOutput(
    List<SubQuestion> subQuestions,
    Double structuralEstimate,
    String reconciliation
) {

    public DecompositionOutput {
        subQuestions = StageOutputReader.withoutNulls(subQuestions);
    }
}
