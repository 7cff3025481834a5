package com.forecastmind.core.llm;

/**
 * Thrown when a search-augmented completion is requested but web search is switched off.
 */
public class SearchUnavailableException extends RuntimeException {

    public SearchUnavailableException(String message) {
        super(message);
    }

    public SearchUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
