package com.forecastmind.core.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.forecastmind.core.model.ReferenceClassMatch;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReferenceClassOutput(List<ReferenceClassMatch> matches) {

    public ReferenceClassOutput {
        matches = StageOutputReader.withoutNulls(matches);
    }
}
