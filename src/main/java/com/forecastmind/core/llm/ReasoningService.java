package com.forecastmind.core.llm;

import java.util.List;
import java.util.Map;

/**
 * Narrow synchronous interface to the reasoning model.
 * <p>
 * Retry and deadline enforcement belong to the implementation, not to the pipeline.
 */
public interface ReasoningService {

    /**
     * Plain completion.
     *
     * @throws EmptyCompletionException if the model returns no content
     */
    Completion complete(String systemPrompt, String userPrompt, ReasoningOptions options);

    /**
     * Completion that must be a JSON object.
     *
     * @throws UnparsableResponseException if no JSON object can be recovered from the text
     */
    JsonCompletion completeJson(String systemPrompt, String userPrompt, ReasoningOptions options);

    /**
     * Search-augmented completion driven by a single free-text instruction.
     */
    SearchCompletion completeWithSearch(String instruction, ReasoningOptions options);

    /** Whether a model is configured to serve requests. */
    boolean isAvailable();

    /**
     * @param temperature    sampling temperature (nullable for the model default)
     * @param maxTokens      output token ceiling (nullable for the model default)
     * @param jsonResponse   ask the model for a JSON object
     */
    record ReasoningOptions(Double temperature, Integer maxTokens, boolean jsonResponse) {

        public static ReasoningOptions json(Double temperature, Integer maxTokens) {
            return new ReasoningOptions(temperature, maxTokens, true);
        }
    }

    record Usage(long promptTokens, long completionTokens, long totalTokens) {
        public static final Usage NONE = new Usage(0, 0, 0);
    }

    record Completion(String text, Usage usage) {}

    record JsonCompletion(Map<String, Object> parsed, Completion raw) {}

    record SearchCompletion(String text, List<String> sources, Usage usage) {}
}
