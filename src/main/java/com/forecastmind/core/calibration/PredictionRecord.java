package com.forecastmind.core.calibration;

import java.time.Instant;

/**
 * A logged prediction awaiting, or carrying, its outcome.
 *
 * @param outcome null while pending
 */
public record PredictionRecord(
    String forecastId,
    String gameId,
    double predictedProbability,
    String bucket,
    Instant timestamp,
    Boolean outcome
) {

    public boolean isResolved() {
        return outcome != null;
    }

    PredictionRecord resolve(boolean occurred) {
        return new PredictionRecord(forecastId, gameId, predictedProbability, bucket, timestamp, occurred);
    }
}
