package com.forecastmind.core.pipeline;

/**
 * Aborts a pipeline run. Raised for critical-stage failures and wraps anything
 * else escaping stage execution.
 */
public class PipelineFailureException extends RuntimeException {

    public PipelineFailureException(String message) {
        super(message);
    }

    public PipelineFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
