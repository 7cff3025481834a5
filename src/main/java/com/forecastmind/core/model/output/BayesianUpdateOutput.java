package com.forecastmind.core.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Either a chain of {@code updates} or a single update given by the top-level fields.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BayesianUpdateOutput(
    List<Step> updates,
    Double posterior,
    Double likelihoodRatio,
    Double prior,
    String evidenceDescription,
    String reasoning
) {

    public BayesianUpdateOutput {
        updates = StageOutputReader.withoutNulls(updates);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Step(
        String evidenceDescription,
        Double likelihoodRatio,
        Double prior,
        Double posterior,
        String reasoning
    ) {}

    /** The update chain, falling back to the single top-level update when no chain is given. */
    public List<Step> steps() {
        if (!updates.isEmpty()) {
            return updates;
        }
        if (likelihoodRatio != null && posterior != null) {
            return List.of(new Step(evidenceDescription, likelihoodRatio, prior, posterior, reasoning));
        }
        return List.of();
    }
}
