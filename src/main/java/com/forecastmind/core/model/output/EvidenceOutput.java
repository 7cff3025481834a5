package com.forecastmind.core.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.forecastmind.core.model.EvidenceItem;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EvidenceOutput(
    List<EvidenceItem> evidenceItems,
    List<String> sources,
    String summary
) {

    public EvidenceOutput {
        evidenceItems = StageOutputReader.withoutNulls(evidenceItems);
        sources = StageOutputReader.withoutNulls(sources);
    }
}
