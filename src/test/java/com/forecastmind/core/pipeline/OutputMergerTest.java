package com.forecastmind.core.pipeline;

import com.forecastmind.core.model.AgentContribution;
import com.forecastmind.core.model.ForecastStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.*;

class OutputMergerTest {

    private final OutputMerger merger = new OutputMerger();

    private static AgentContribution contribution(String agentId, double confidence, Map<String, Object> output,
                                                  List<String> sources) {
        return new AgentContribution(agentId, agentId, output, confidence, 10, Instant.now(), sources);
    }

    private static AgentContribution contribution(String agentId, double confidence, Map<String, Object> output) {
        return contribution(agentId, confidence, output, List.of());
    }

    @Test
    @DisplayName("a single contribution passes through unchanged")
    void singlePassthrough() {
        Map<String, Object> output = Map.of("probability", 0.6, "extra", "kept");

        assertSame(output, merger.merge(ForecastStage.BASE_RATE, List.of(contribution("a", 0.8, output))));
    }

    @Test
    @DisplayName("no contributions merge to an empty output")
    void empty() {
        assertTrue(merger.merge(ForecastStage.SYNTHESIS, List.of()).isEmpty());
    }

    @Nested
    @DisplayName("numeric stages")
    class Numeric {

        @Test
        @DisplayName("confidence-weighted average of shared numeric fields")
        void weightedAverage() {
            Map<String, Object> merged = merger.merge(ForecastStage.BASE_RATE, List.of(
                    contribution("a", 0.8, Map.of("probability", 0.6, "confidence", 0.8, "reasoning", "history")),
                    contribution("b", 0.2, Map.of("probability", 0.4, "confidence", 0.2))));

            assertThat((Double) merged.get("probability"), closeTo(0.56, 1e-9));
            assertEquals("history", merged.get("reasoning"));
        }

        @Test
        @DisplayName("fields missing from any output keep the first value")
        void partialFields() {
            Map<String, Object> merged = merger.merge(ForecastStage.BAYESIAN_UPDATE, List.of(
                    contribution("a", 0.5, Map.of("posterior", 0.7, "sampleSize", 30)),
                    contribution("b", 0.5, Map.of("posterior", 0.5))));

            assertThat((Double) merged.get("posterior"), closeTo(0.6, 1e-9));
            assertEquals(30, merged.get("sampleSize"));
        }

        @Test
        @DisplayName("zero total confidence falls back to equal weights")
        void zeroConfidence() {
            Map<String, Object> merged = merger.merge(ForecastStage.BASE_RATE, List.of(
                    contribution("a", 0.0, Map.of("probability", 0.3)),
                    contribution("b", 0.0, Map.of("probability", 0.5))));

            assertThat((Double) merged.get("probability"), closeTo(0.4, 1e-9));
        }
    }

    @Test
    @DisplayName("evidence concatenates items and unions sources, including search citations")
    void evidence() {
        Map<String, Object> merged = merger.merge(ForecastStage.EVIDENCE_GATHERING, List.of(
                contribution("a", 0.6, Map.of("evidenceItems", List.of(Map.of("description", "star out")),
                        "sources", List.of("https://a"), "summary", "Injury news"), List.of("https://b")),
                contribution("b", 0.9, Map.of("evidenceItems", List.of(Map.of("description", "home streak")),
                        "sources", List.of("https://a", "https://c")))));

        assertEquals(2, ((List<?>) merged.get("evidenceItems")).size());
        assertEquals(List.of("https://a", "https://b", "https://c"), merged.get("sources"));
        assertEquals("Injury news", merged.get("summary"));
    }

    @Test
    @DisplayName("adversarial review concatenates concerns and biases, keeping the first adjustment")
    void adversarial() {
        Map<String, Object> merged = merger.merge(ForecastStage.ADVERSARIAL_REVIEW, List.of(
                contribution("a", 0.6, Map.of("concerns", List.of("back-to-back games"), "confidenceAdjustment", -0.05)),
                contribution("b", 0.7, Map.of("concerns", List.of("small sample"), "biases", List.of("recency")))));

        assertEquals(List.of("back-to-back games", "small sample"), merged.get("concerns"));
        assertEquals(List.of("recency"), merged.get("biases"));
        assertEquals(-0.05, merged.get("confidenceAdjustment"));
    }

    @Test
    @DisplayName("other stages keep the most confident output, first wins ties")
    void mostConfident() {
        AgentContribution first = contribution("a", 0.7, Map.of("finalProbability", 0.61));
        AgentContribution second = contribution("b", 0.7, Map.of("finalProbability", 0.55));
        AgentContribution third = contribution("c", 0.4, Map.of("finalProbability", 0.9));

        assertEquals(Map.of("finalProbability", 0.61),
                merger.merge(ForecastStage.SYNTHESIS, List.of(first, second, third)));
    }
}
