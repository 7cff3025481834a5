package com.forecastmind.core.llm;

/**
 * Thrown when no JSON object can be recovered from a model response.
 */
public class UnparsableResponseException extends RuntimeException {
    public UnparsableResponseException(String message) {
        super(message);
    }

    public UnparsableResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
