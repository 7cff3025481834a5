package com.forecastmind.core.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi.ChatCompletionRequest.WebSearchOptions;
import org.springframework.ai.openai.api.OpenAiApi.ChatCompletionRequest.WebSearchOptions.SearchContextSize;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * {@link ReasoningService} backed by Spring AI's {@link ChatClient}.
 * <p>
 * Sampling options are applied per call. JSON responses go through {@link JsonResponseParser}.
 * Search-augmented calls switch to the configured search model with OpenAI web search options;
 * their sources are the URL citations the provider attaches to the answer, never URLs scraped
 * from the answer text.
 */
@Service
public class ChatClientReasoningService implements ReasoningService {

    private static final Logger log = LoggerFactory.getLogger(ChatClientReasoningService.class);

    /** Assistant message metadata key under which the OpenAI model reports URL citations. */
    static final String ANNOTATIONS_KEY = "annotations";

    /** Placeholder bound when no key is configured, so the OpenAI auto-configuration still starts. */
    static final String UNSET_API_KEY = "unset";

    static final String JSON_INSTRUCTION =
            "Respond with a single JSON object only. Do not wrap it in prose.";

    static final String SEARCH_SYSTEM_PROMPT = """
            You are a research assistant with web search. Search for recent, relevant reporting,
            base every claim on what you found, and finish with the JSON object requested.""";

    private final ChatClient chatClient;
    private final JsonResponseParser parser;
    private final ReasoningProperties properties;
    private final ObjectMapper mapper;
    private final String apiKey;

    @Autowired
    public ChatClientReasoningService(ChatClient.Builder builder,
                                      ObjectMapper objectMapper,
                                      ReasoningProperties properties,
                                      @Value("${spring.ai.openai.api-key:}") String apiKey) {
        this(builder.build(), new JsonResponseParser(objectMapper), properties, objectMapper, apiKey);
    }

    ChatClientReasoningService(ChatClient chatClient, JsonResponseParser parser,
                               ReasoningProperties properties, String apiKey) {
        this(chatClient, parser, properties, new ObjectMapper(), apiKey);
    }

    ChatClientReasoningService(ChatClient chatClient, JsonResponseParser parser,
                               ReasoningProperties properties, ObjectMapper mapper, String apiKey) {
        this.chatClient = chatClient;
        this.parser = parser;
        this.properties = properties;
        this.mapper = mapper;
        this.apiKey = apiKey;
        log.info("Reasoning service initialized (model: {}, web search: {})",
                properties.getModel().isBlank() ? "<provider default>" : properties.getModel(),
                properties.isWebSearchEnabled() ? properties.getSearchModel() : "off");
    }

    @Override
    public Completion complete(String systemPrompt, String userPrompt, ReasoningOptions options) {
        ChatResponse response = call(systemPrompt, userPrompt, toChatOptions(options));
        return new Completion(textOf(response), usageOf(response));
    }

    @Override
    public JsonCompletion completeJson(String systemPrompt, String userPrompt, ReasoningOptions options) {
        String system = systemPrompt.contains("JSON") ? systemPrompt : systemPrompt + "\n\n" + JSON_INSTRUCTION;
        Completion completion = complete(system, userPrompt, options);
        JsonResponseParser.Parsed parsed = parser.parse(completion.text());
        if (parsed.strategy() != JsonResponseParser.Strategy.DIRECT) {
            log.info("JSON recovered via {} fallback", parsed.strategy());
        }
        return new JsonCompletion(parsed.value(), completion);
    }

    @Override
    public SearchCompletion completeWithSearch(String instruction, ReasoningOptions options) {
        if (!properties.isWebSearchEnabled()) {
            throw new SearchUnavailableException("Web search is disabled (forecast.llm.web-search-enabled=false)");
        }
        ChatResponse response = call(SEARCH_SYSTEM_PROMPT, instruction, toSearchOptions(options));
        List<String> sources = citedSources(response, properties.getMaxSources());
        log.debug("Search completion cited {} source(s)", sources.size());
        return new SearchCompletion(textOf(response), sources, usageOf(response));
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank() && !UNSET_API_KEY.equals(apiKey);
    }

    /**
     * Distinct citation URLs attached to the answer, in order, up to {@code limit}. An answer
     * without citations has no sources.
     */
    List<String> citedSources(ChatResponse response, int limit) {
        Map<String, Object> metadata = response.getResult().getOutput().getMetadata();
        Object annotations = metadata != null ? metadata.get(ANNOTATIONS_KEY) : null;
        if (annotations == null) {
            return List.of();
        }
        JsonNode tree = mapper.valueToTree(annotations);
        Set<String> urls = new LinkedHashSet<>();
        for (String url : tree.findValuesAsText("url")) {
            if (urls.size() >= limit) {
                break;
            }
            if (url != null && !url.isBlank()) {
                urls.add(url);
            }
        }
        return List.copyOf(urls);
    }

    private ChatResponse call(String systemPrompt, String userPrompt, ChatOptions chatOptions) {
        long start = System.currentTimeMillis();
        ChatResponse response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .options(chatOptions)
                .call()
                .chatResponse();
        String text = textOf(response);
        log.debug("Completion from {} returned {} chars in {}ms", chatOptions.getModel(),
                text != null ? text.length() : 0, System.currentTimeMillis() - start);
        if (text == null || text.isBlank()) {
            throw new EmptyCompletionException("Model returned empty content");
        }
        return response;
    }

    /** Search models take no sampling parameters, so only the token ceiling carries over. */
    private ChatOptions toSearchOptions(ReasoningOptions options) {
        SearchContextSize contextSize;
        try {
            contextSize = SearchContextSize.valueOf(properties.getSearchContextSize().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new SearchUnavailableException(
                    "Unknown search context size: " + properties.getSearchContextSize(), e);
        }
        OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder()
                .model(properties.getSearchModel())
                .webSearchOptions(new WebSearchOptions(contextSize, null));
        if (options != null && options.maxTokens() != null) {
            builder.maxTokens(options.maxTokens());
        }
        return builder.build();
    }

    private ChatOptions toChatOptions(ReasoningOptions options) {
        ChatOptions.Builder builder = ChatOptions.builder();
        if (!properties.getModel().isBlank()) {
            builder.model(properties.getModel());
        }
        builder.temperature(options != null && options.temperature() != null
                ? options.temperature() : properties.getDefaultTemperature());
        if (options != null && options.maxTokens() != null) {
            builder.maxTokens(options.maxTokens());
        }
        return builder.build();
    }

    private static String textOf(ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return null;
        }
        return response.getResult().getOutput().getText();
    }

    private static Usage usageOf(ChatResponse response) {
        ChatResponseMetadata metadata = response.getMetadata();
        if (metadata == null || metadata.getUsage() == null) {
            return Usage.NONE;
        }
        var usage = metadata.getUsage();
        return new Usage(
                usage.getPromptTokens() != null ? usage.getPromptTokens() : 0,
                usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0,
                usage.getTotalTokens() != null ? usage.getTotalTokens() : 0);
    }
}
