package com.forecastmind.core.prompt;

import java.util.List;

/**
 * System and user prompt templates for one agent.
 *
 * @param templateId         stable identifier
 * @param systemPrompt       system prompt template
 * @param userPromptTemplate user prompt template
 * @param requiredVariables  variables that must resolve before rendering
 */
public record PromptTemplate(
    String templateId,
    String systemPrompt,
    String userPromptTemplate,
    List<String> requiredVariables
) {

    public PromptTemplate {
        requiredVariables = requiredVariables != null ? List.copyOf(requiredVariables) : List.of();
    }
}
