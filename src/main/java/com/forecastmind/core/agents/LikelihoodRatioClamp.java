package com.forecastmind.core.agents;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounds likelihood ratios to {@code [min, max]} before they move a probability.
 * <p>
 * With the default band of [0.5, 2.0] no single piece of evidence can more than double
 * or halve the odds. Clamping is idempotent and leaves in-band values untouched.
 */
public class LikelihoodRatioClamp {

    private static final Logger log = LoggerFactory.getLogger(LikelihoodRatioClamp.class);

    public static final double DEFAULT_MIN = 0.5;
    public static final double DEFAULT_MAX = 2.0;

    private final double min;
    private final double max;

    public LikelihoodRatioClamp() {
        this(DEFAULT_MIN, DEFAULT_MAX);
    }

    public LikelihoodRatioClamp(double min, double max) {
        if (!(min > 0) || min > max) {
            throw new IllegalArgumentException("Invalid likelihood ratio band [" + min + ", " + max + "]");
        }
        this.min = min;
        this.max = max;
    }

    public double clamp(double ratio) {
        if (Double.isNaN(ratio)) {
            return 1.0;
        }
        double clamped = Math.max(min, Math.min(max, ratio));
        if (clamped != ratio) {
            log.debug("Likelihood ratio {} clamped to {} (band [{}, {}])", ratio, clamped, min, max);
        }
        return clamped;
    }

    public boolean isWithinBand(double ratio) {
        return ratio >= min && ratio <= max;
    }

    /** Applies a likelihood ratio to a prior probability through odds. */
    public static double applyToProbability(double prior, double ratio) {
        double p = Math.max(0.0, Math.min(1.0, prior));
        if (p == 0.0 || p == 1.0) {
            return p;
        }
        double posteriorOdds = (p / (1 - p)) * ratio;
        return posteriorOdds / (1 + posteriorOdds);
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }
}
