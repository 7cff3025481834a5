package com.forecastmind.core.model;

import java.io.Serializable;

/**
 * One step of the update chain. The likelihood ratio has already been clamped.
 */
public record BayesianUpdate(
    String evidenceDescription,
    double likelihoodRatio,
    double prior,
    double posterior,
    String reasoning
) implements Serializable {}
