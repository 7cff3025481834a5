package com.forecastmind.core.model;

/**
 * Outcome of one stage execution.
 */
public enum StageStatus {
    SUCCESS,
    PARTIAL,
    FAILED
}
