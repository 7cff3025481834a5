package com.forecastmind.core.model;

import java.io.Serializable;

/**
 * One independent sub-question produced by structural decomposition.
 */
public record SubQuestion(
    String question,
    Double probability,
    Double confidence,
    String reasoning
) implements Serializable {}
