package com.forecastmind.core.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.util.List;

/**
 * Removes sampling parameters from OpenAI chat requests that carry {@code web_search_options}.
 * <p>
 * Spring AI merges the default temperature into every request, but the search-preview models
 * reject sampling parameters with a 400.
 */
@Configuration
@ConditionalOnProperty(name = "forecast.llm.web-search-enabled", havingValue = "true", matchIfMissing = true)
public class OpenAiSearchRequestCustomizer {

    private static final Logger log = LoggerFactory.getLogger(OpenAiSearchRequestCustomizer.class);

    static final String WEB_SEARCH_OPTIONS = "web_search_options";
    static final List<String> UNSUPPORTED_WITH_SEARCH =
            List.of("temperature", "top_p", "presence_penalty", "frequency_penalty", "n");

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Bean
    RestClientCustomizer openAiSearchSamplingRemover() {
        log.info("Registering OpenAI web search request customizer");
        return builder -> builder.requestInterceptor((request, body, execution) -> {
            MediaType contentType = request.getHeaders().getContentType();
            if (contentType == null || !contentType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
                return execution.execute(request, body);
            }
            return execution.execute(request, stripSamplingParameters(objectMapper, body));
        });
    }

    /** Returns {@code body} unchanged unless it is a JSON object requesting web search. */
    static byte[] stripSamplingParameters(ObjectMapper mapper, byte[] body) {
        if (body == null || body.length == 0) {
            return body;
        }
        try {
            JsonNode root = mapper.readTree(body);
            if (!(root instanceof ObjectNode obj) || !obj.has(WEB_SEARCH_OPTIONS)) {
                return body;
            }
            obj.remove(UNSUPPORTED_WITH_SEARCH);
            return mapper.writeValueAsBytes(obj);
        } catch (IOException e) {
            log.debug("Could not inspect request body for search parameters: {}", e.getMessage());
            return body;
        }
    }
}
