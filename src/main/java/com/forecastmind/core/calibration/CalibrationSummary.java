package com.forecastmind.core.calibration;

import java.util.List;

/**
 * @param brierScore       mean squared error of resolved predictions (null if none resolved)
 * @param calibrationError mean |accuracy - midpoint| over buckets with enough data (null if none)
 */
public record CalibrationSummary(
    int totalPredictions,
    int resolvedPredictions,
    int pendingPredictions,
    Double brierScore,
    Double calibrationError,
    List<CalibrationBucket> buckets
) {}
