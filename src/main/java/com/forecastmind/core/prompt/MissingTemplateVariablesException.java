package com.forecastmind.core.prompt;

import java.util.List;

/**
 * Thrown when a prompt template is rendered without all of its required variables.
 */
public class MissingTemplateVariablesException extends RuntimeException {

    private final List<String> missing;

    public MissingTemplateVariablesException(List<String> missing) {
        super("Missing required template variables: " + String.join(", ", missing));
        this.missing = List.copyOf(missing);
    }

    public List<String> missing() {
        return missing;
    }
}
