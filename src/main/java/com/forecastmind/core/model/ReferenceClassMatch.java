package com.forecastmind.core.model;

import java.io.Serializable;

/**
 * A historical situation judged similar to the forecast question.
 */
public record ReferenceClassMatch(
    String description,
    Integer historicalSampleSize,
    Double relevanceScore,
    String category,
    Double winRate
) implements Serializable {}
