package com.forecastmind.core.pipeline;

import com.forecastmind.core.agents.AgentInvoker;
import com.forecastmind.core.agents.CoherenceRouter;
import com.forecastmind.core.agents.InvocationResult;
import com.forecastmind.core.model.AgentConfig;
import com.forecastmind.core.model.AgentContribution;
import com.forecastmind.core.model.ForecastContext;
import com.forecastmind.core.model.ForecastStage;
import com.forecastmind.core.model.Matchup;
import com.forecastmind.core.model.StageConfig;
import com.forecastmind.core.model.StageResult;
import com.forecastmind.core.model.StageStatus;
import com.forecastmind.core.store.InMemoryContextStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class StageExecutorTest {

    private AgentInvoker invoker;
    private CoherenceRouter router;
    private ForecastContextManager contextManager;
    private StageExecutor executor;
    private ForecastContext context;

    @BeforeEach
    void setUp() {
        invoker = mock(AgentInvoker.class);
        router = mock(CoherenceRouter.class);
        contextManager = new ForecastContextManager(new InMemoryContextStore());
        executor = new StageExecutor(invoker, router, new OutputMerger(), contextManager, null, 2);
        context = contextManager.createContext("fc-1", new Matchup("g-1", "Lakers", "Celtics", null));
    }

    private static StageConfig config(boolean parallel, String... agentIds) {
        return new StageConfig(true, parallel,
                Arrays.stream(agentIds).map(id -> AgentConfig.defaults(id, 2000)).toList());
    }

    private void succeeds(String agentId, ForecastStage stage, Map<String, Object> output, double confidence) {
        when(invoker.invoke(eq(agentId), eq(stage), any(), any())).thenReturn(InvocationResult.success(
                new AgentContribution(agentId, agentId, output, confidence, 20, Instant.now(), List.of())));
    }

    private void fails(String agentId, ForecastStage stage, String error) {
        when(invoker.invoke(eq(agentId), eq(stage), any(), any()))
                .thenReturn(InvocationResult.failure(agentId, error, 5));
    }

    @Test
    @DisplayName("two base-rate contributions merge by confidence into the context")
    void mergesBaseRate() {
        succeeds("a", ForecastStage.BASE_RATE, Map.of("probability", 0.6, "confidence", 0.8), 0.8);
        succeeds("b", ForecastStage.BASE_RATE, Map.of("probability", 0.4, "confidence", 0.2), 0.2);

        StageResult result = executor.execute("fc-1", ForecastStage.BASE_RATE, config(false, "a", "b"));

        assertEquals(StageStatus.SUCCESS, result.status());
        assertThat((Double) result.output().get("probability"), closeTo(0.56, 1e-9));
        assertThat(context.baseRate(), closeTo(0.56, 1e-9));
        assertEquals(2, context.contributions(ForecastStage.BASE_RATE).size());
        assertTrue(context.processingTimes().containsKey(ForecastStage.BASE_RATE));
    }

    @Test
    @DisplayName("a single contribution is applied verbatim")
    void singleContribution() {
        Map<String, Object> output = Map.of("finalProbability", 0.63, "recommendation", "home",
                "keyDrivers", List.of("rest advantage"));
        succeeds("synth", ForecastStage.SYNTHESIS, output, 0.7);

        StageResult result = executor.execute("fc-1", ForecastStage.SYNTHESIS, config(false, "synth"));

        assertEquals(output, result.output());
        assertEquals(0.63, context.finalProbability());
        assertEquals("home", context.recommendation());
    }

    @Test
    @DisplayName("some failures make the stage partial")
    void partial() {
        when(invoker.invokeParallel(anyList(), eq(ForecastStage.ADVERSARIAL_REVIEW), any(), any()))
                .thenReturn(List.of(
                        InvocationResult.success(new AgentContribution("a", "a",
                                Map.of("concerns", List.of("fatigue")), 0.6, 20, Instant.now(), List.of())),
                        InvocationResult.failure("b", "timeout", 5)));

        StageResult result = executor.execute("fc-1", ForecastStage.ADVERSARIAL_REVIEW, config(true, "a", "b"));

        assertEquals(StageStatus.PARTIAL, result.status());
        assertEquals("b: timeout", result.error());
        assertEquals(List.of("fatigue"), context.concerns());
        verify(invoker).invokeParallel(eq(List.of("a", "b")), eq(ForecastStage.ADVERSARIAL_REVIEW), any(), any());
    }

    @Test
    @DisplayName("all failures fail the stage and leave the context untouched")
    void allFailed() {
        fails("a", ForecastStage.BASE_RATE, "rate limited");

        StageResult result = executor.execute("fc-1", ForecastStage.BASE_RATE, config(false, "a"));

        assertTrue(result.isFailed());
        assertTrue(result.error().startsWith("All agents failed for stage base_rate"));
        assertNull(context.baseRate());
        assertTrue(context.contributions(ForecastStage.BASE_RATE).isEmpty());
    }

    @Test
    @DisplayName("without configured agents the router picks them")
    void routerFallback() {
        when(router.selectAgents(eq(ForecastStage.EVIDENCE_GATHERING), any(), eq(2))).thenReturn(List.of("r"));
        succeeds("r", ForecastStage.EVIDENCE_GATHERING, Map.of("evidenceItems", List.of(), "summary", "quiet week"), 0.5);

        StageResult result = executor.execute("fc-1", ForecastStage.EVIDENCE_GATHERING,
                new StageConfig(true, true, List.of()));

        assertEquals(StageStatus.SUCCESS, result.status());
        assertEquals("quiet week", context.evidenceSummary());
    }

    @Test
    @DisplayName("no agents at all fails the stage")
    void noAgents() {
        when(router.selectAgents(any(), any(), anyInt())).thenReturn(List.of());

        StageResult result = executor.execute("fc-1", ForecastStage.SYNTHESIS, new StageConfig(true, false, List.of()));

        assertTrue(result.isFailed());
        assertEquals("No agents available for stage: synthesis", result.error());
        verifyNoInteractions(invoker);
    }

    @Test
    @DisplayName("configured agents that are all disabled fail the stage without asking the router")
    void allConfiguredAgentsDisabled() {
        var disabled = new AgentConfig("base-rate-calculator", false, 1.0, null, null, 0.7, 2000);

        StageResult result = executor.execute("fc-1", ForecastStage.BASE_RATE,
                new StageConfig(true, false, List.of(disabled)));

        assertTrue(result.isFailed());
        assertEquals("No agents available for stage: base_rate", result.error());
        assertNull(context.baseRate());
        verifyNoInteractions(router, invoker);
    }

    @Test
    @DisplayName("disabled entries are skipped while enabled ones run")
    void disabledEntriesSkipped() {
        succeeds("b", ForecastStage.BASE_RATE, Map.of("probability", 0.58), 0.6);

        StageResult result = executor.execute("fc-1", ForecastStage.BASE_RATE, new StageConfig(true, false, List.of(
                new AgentConfig("a", false, 1.0, null, null, 0.7, 2000),
                AgentConfig.defaults("b", 2000))));

        assertEquals(StageStatus.SUCCESS, result.status());
        assertThat(context.baseRate(), closeTo(0.58, 1e-9));
        verify(invoker, never()).invoke(eq("a"), any(), any(), any());
        verifyNoInteractions(router);
    }

    @Test
    @DisplayName("output that does not fit the stage schema fails the stage")
    void malformedOutput() {
        succeeds("a", ForecastStage.BASE_RATE, Map.of("probability", "about sixty"), 0.7);

        StageResult result = executor.execute("fc-1", ForecastStage.BASE_RATE, config(false, "a"));

        assertTrue(result.isFailed());
        assertTrue(result.error().startsWith("Malformed base_rate output"));
        assertNull(context.baseRate());
    }
}
