package com.forecastmind.core.llm;

/**
 * Thrown when the model returns null or blank content.
 */
public class EmptyCompletionException extends RuntimeException {
    public EmptyCompletionException(String message) {
        super(message);
    }
}
