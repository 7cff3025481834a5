package com.forecastmind.core.calibration;

/**
 * Historical accuracy hint handed to the synthesis prompt.
 */
public record CalibrationAnchor(
    String probabilityBucket,
    Double historicalAccuracy,
    int sampleSize,
    String message
) {}
