package com.forecastmind.core.pipeline;

/**
 * What a cancel request did.
 */
public enum CancelOutcome {
    /** Removed from the queue before it started; now CANCELLED. */
    CANCELLED,
    /** Running; flagged and will stop at the next stage boundary. */
    CANCELLING,
    /** Already completed, failed or cancelled. */
    ALREADY_TERMINAL,
    NOT_FOUND
}
