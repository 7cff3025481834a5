package com.forecastmind.core.model;

import java.io.Serializable;

/**
 * A single piece of evidence bearing on the outcome.
 *
 * @param description what was found
 * @param direction   which side it favors ("home", "away", "neutral")
 * @param impact      qualitative or numeric weight as reported by the agent
 * @param source      where it came from, if known
 */
public record EvidenceItem(
    String description,
    String direction,
    String impact,
    String source
) implements Serializable {}
