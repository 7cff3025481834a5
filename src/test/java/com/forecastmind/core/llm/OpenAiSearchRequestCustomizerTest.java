package com.forecastmind.core.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiSearchRequestCustomizerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("search requests lose their sampling parameters")
    void stripsSampling() throws Exception {
        byte[] body = bytes("""
                {"model": "gpt-4o-mini-search-preview", "temperature": 0.7, "top_p": 1.0,
                 "web_search_options": {"search_context_size": "medium"}, "max_tokens": 900}""");

        JsonNode cleaned = mapper.readTree(OpenAiSearchRequestCustomizer.stripSamplingParameters(mapper, body));

        assertFalse(cleaned.has("temperature"));
        assertFalse(cleaned.has("top_p"));
        assertEquals("medium", cleaned.path("web_search_options").path("search_context_size").asText());
        assertEquals(900, cleaned.path("max_tokens").asInt());
    }

    @Test
    @DisplayName("ordinary chat requests pass through untouched")
    void leavesOtherRequests() {
        byte[] body = bytes("{\"model\": \"gpt-4o-mini\", \"temperature\": 0.3}");

        assertSame(body, OpenAiSearchRequestCustomizer.stripSamplingParameters(mapper, body));
    }

    @Test
    @DisplayName("bodies that are not JSON objects pass through")
    void nonJson() {
        byte[] garbage = bytes("not json {");
        byte[] array = bytes("[1, 2]");

        assertSame(garbage, OpenAiSearchRequestCustomizer.stripSamplingParameters(mapper, garbage));
        assertSame(array, OpenAiSearchRequestCustomizer.stripSamplingParameters(mapper, array));
        assertNull(OpenAiSearchRequestCustomizer.stripSamplingParameters(mapper, null));
    }
}
