package com.forecastmind.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Closed probability interval {@code [lower, upper]}.
 */
public record ConfidenceInterval(double lower, double upper) implements Serializable {

    /** Symmetric interval of the given half-width around a point estimate. */
    public static ConfidenceInterval around(double point, double halfWidth) {
        return new ConfidenceInterval(point - halfWidth, point + halfWidth);
    }

    /**
     * Reads a two-element {@code [lower, upper]} list, falling back to a ±halfWidth band
     * around {@code point} when the list is missing or malformed.
     */
    public static ConfidenceInterval fromListOrAround(List<Double> bounds, double point, double halfWidth) {
        if (bounds != null && bounds.size() == 2 && bounds.get(0) != null && bounds.get(1) != null) {
            return new ConfidenceInterval(bounds.get(0), bounds.get(1));
        }
        return around(point, halfWidth);
    }

    public List<Double> asList() {
        return List.of(lower, upper);
    }
}
