package com.forecastmind.core.llm;

import com.forecastmind.core.llm.ReasoningService.JsonCompletion;
import com.forecastmind.core.llm.ReasoningService.ReasoningOptions;
import com.forecastmind.core.llm.ReasoningService.SearchCompletion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi.ChatCompletionRequest.WebSearchOptions.SearchContextSize;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ChatClientReasoningService}.
 * <p>
 * Mocks the {@link ChatClient} fluent chain so no model is called.
 */
class ChatClientReasoningServiceTest {

    private ChatClientRequestSpec requestSpec;
    private CallResponseSpec callResponse;
    private ReasoningProperties properties;
    private ChatClientReasoningService service;

    @BeforeEach
    void setUp() {
        ChatClient chatClient = mock(ChatClient.class);
        requestSpec = mock(ChatClientRequestSpec.class);
        callResponse = mock(CallResponseSpec.class);

        when(chatClient.prompt()).thenReturn(requestSpec);
        when(requestSpec.system(anyString())).thenReturn(requestSpec);
        when(requestSpec.user(anyString())).thenReturn(requestSpec);
        when(requestSpec.options(any())).thenReturn(requestSpec);
        when(requestSpec.call()).thenReturn(callResponse);

        properties = new ReasoningProperties();
        properties.setMaxSources(3);
        service = new ChatClientReasoningService(chatClient, new JsonResponseParser(), properties, "sk-test");
    }

    private void reply(String text) {
        when(callResponse.chatResponse()).thenReturn(
                new ChatResponse(List.of(new Generation(new AssistantMessage(text)))));
    }

    @Nested
    @DisplayName("completeJson")
    class CompleteJson {

        @Test
        @DisplayName("appends a JSON instruction when the system prompt lacks one")
        void appendsInstruction() {
            reply("{\"probability\": 0.6}");

            JsonCompletion completion = service.completeJson("You are a statistician.", "Estimate.",
                    ReasoningOptions.json(0.3, 500));

            assertEquals(0.6, completion.parsed().get("probability"));
            verify(requestSpec).system("You are a statistician.\n\n" + ChatClientReasoningService.JSON_INSTRUCTION);
        }

        @Test
        @DisplayName("passes per-call temperature and token ceiling")
        void passesOptions() {
            reply("{}");

            service.completeJson("Output JSON.", "Go.", ReasoningOptions.json(0.2, 700));

            ArgumentCaptor<ChatOptions> captor = ArgumentCaptor.forClass(ChatOptions.class);
            verify(requestSpec).options(captor.capture());
            assertEquals(0.2, captor.getValue().getTemperature());
            assertEquals(700, captor.getValue().getMaxTokens());
        }

        @Test
        @DisplayName("uses the configured default temperature when the call sets none")
        void defaultTemperature() {
            reply("{}");
            properties.setDefaultTemperature(0.9);

            service.completeJson("Output JSON.", "Go.", ReasoningOptions.json(null, null));

            ArgumentCaptor<ChatOptions> captor = ArgumentCaptor.forClass(ChatOptions.class);
            verify(requestSpec).options(captor.capture());
            assertEquals(0.9, captor.getValue().getTemperature());
            assertNull(captor.getValue().getMaxTokens());
        }

        @Test
        @DisplayName("empty model output is an error")
        void emptyOutput() {
            reply("   ");

            assertThrows(EmptyCompletionException.class,
                    () -> service.completeJson("Output JSON.", "Go.", ReasoningOptions.json(null, null)));
        }

        @Test
        @DisplayName("prose without an object is unparsable")
        void unparsable() {
            reply("I think the home side wins.");

            assertThrows(UnparsableResponseException.class,
                    () -> service.completeJson("Output JSON.", "Go.", ReasoningOptions.json(null, null)));
        }
    }

    @Nested
    @DisplayName("completeWithSearch")
    class CompleteWithSearch {

        private void replyWithCitations(String text, List<String> urls) {
            List<Map<String, Object>> annotations = urls.stream()
                    .<Map<String, Object>>map(url -> Map.of("type", "url_citation",
                            "url_citation", Map.of("url", url, "title", "Report")))
                    .toList();
            when(callResponse.chatResponse()).thenReturn(new ChatResponse(List.of(new Generation(
                    new AssistantMessage(text, Map.of(ChatClientReasoningService.ANNOTATIONS_KEY, annotations))))));
        }

        @Test
        @DisplayName("asks the search model for web search without sampling parameters")
        void searchOptions() {
            reply("{\"summary\": \"quiet week\"}");
            properties.setSearchContextSize("high");

            service.completeWithSearch("Find injury news", ReasoningOptions.json(0.4, 900));

            ArgumentCaptor<ChatOptions> captor = ArgumentCaptor.forClass(ChatOptions.class);
            verify(requestSpec).options(captor.capture());
            OpenAiChatOptions options = assertInstanceOf(OpenAiChatOptions.class, captor.getValue());
            assertEquals("gpt-4o-mini-search-preview", options.getModel());
            assertEquals(SearchContextSize.HIGH, options.getWebSearchOptions().searchContextSize());
            assertEquals(900, options.getMaxTokens());
            assertNull(options.getTemperature());
            verify(requestSpec).system(ChatClientReasoningService.SEARCH_SYSTEM_PROMPT);
        }

        @Test
        @DisplayName("sources are the distinct citation URLs up to the configured limit")
        void citedSources() {
            replyWithCitations("{\"summary\": \"see reports\"}", List.of("https://a.example/one",
                    "https://b.example/two", "https://a.example/one", "https://c.example/three",
                    "https://d.example/four"));

            SearchCompletion completion = service.completeWithSearch("Find injury news", ReasoningOptions.json(null, null));

            assertEquals(List.of("https://a.example/one", "https://b.example/two", "https://c.example/three"),
                    completion.sources());
        }

        @Test
        @DisplayName("URLs written in the answer text are not reported as sources")
        void uncitedUrlsIgnored() {
            reply("According to https://made-up.example/story the guard is out. {\"summary\": \"guard out\"}");

            SearchCompletion completion = service.completeWithSearch("Find injury news", ReasoningOptions.json(null, null));

            assertTrue(completion.sources().isEmpty());
            assertTrue(completion.text().contains("guard out"));
        }

        @Test
        @DisplayName("is refused when web search is switched off")
        void disabled() {
            properties.setWebSearchEnabled(false);

            assertThrows(SearchUnavailableException.class,
                    () -> service.completeWithSearch("Find injury news", ReasoningOptions.json(null, null)));
            verify(requestSpec, never()).call();
        }

        @Test
        @DisplayName("an unknown context size is a configuration error")
        void badContextSize() {
            properties.setSearchContextSize("enormous");

            assertThrows(SearchUnavailableException.class,
                    () -> service.completeWithSearch("Find injury news", ReasoningOptions.json(null, null)));
        }
    }

    @Test
    @DisplayName("available only with a real API key")
    void availability() {
        assertTrue(service.isAvailable());
        ChatClient client = mock(ChatClient.class);
        assertFalse(new ChatClientReasoningService(client, new JsonResponseParser(), properties, "").isAvailable());
        assertFalse(new ChatClientReasoningService(client, new JsonResponseParser(), properties,
                ChatClientReasoningService.UNSET_API_KEY).isAvailable());
    }
}
