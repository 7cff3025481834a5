package com.forecastmind.core.calibration;

/**
 * Resolved-prediction statistics for one 10% probability band.
 *
 * @param bucketId       label such as "60-70%"
 * @param minProbability inclusive lower bound
 * @param maxProbability exclusive upper bound (inclusive for the top bucket)
 * @param predictions    resolved predictions in this bucket
 * @param outcomes       how many of those occurred
 */
public record CalibrationBucket(
    String bucketId,
    double minProbability,
    double maxProbability,
    int predictions,
    int outcomes
) {

    /** Observed frequency, or null with no resolved predictions. */
    public Double accuracy() {
        return predictions > 0 ? (double) outcomes / predictions : null;
    }

    public double midpoint() {
        return (minProbability + maxProbability) / 2;
    }

    CalibrationBucket withOutcome(boolean occurred) {
        return new CalibrationBucket(bucketId, minProbability, maxProbability,
                predictions + 1, occurred ? outcomes + 1 : outcomes);
    }
}
