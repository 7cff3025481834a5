package com.forecastmind.dispatch.cli;

import com.forecastmind.core.agents.AgentCatalog;
import com.forecastmind.core.agents.AgentRegistry;
import com.forecastmind.core.events.EventBus;
import com.forecastmind.core.events.ForecastEvent;
import com.forecastmind.core.health.HealthCheckService;
import com.forecastmind.core.health.HealthStatus;
import com.forecastmind.core.model.ConfidenceInterval;
import com.forecastmind.core.model.ForecastContext;
import com.forecastmind.core.model.ForecastStage;
import com.forecastmind.core.model.Matchup;
import com.forecastmind.core.model.TaskState;
import com.forecastmind.core.model.UnknownPresetException;
import com.forecastmind.core.pipeline.CancelOutcome;
import com.forecastmind.core.pipeline.ForecastStatus;
import com.forecastmind.core.pipeline.PipelineOrchestrator;
import com.forecastmind.core.pipeline.PresetCatalog;
import com.forecastmind.core.pipeline.StartedForecast;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the Forecastmind CLI command structure.
 * These tests exercise picocli directly without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private final EventBus eventBus = new EventBus();
    private final PipelineOrchestrator orchestrator = mock(PipelineOrchestrator.class);
    private final HealthCheckService healthCheckService = mock(HealthCheckService.class);

    private CommandLine.IFactory createFactory() {
        AgentRegistry registry = new AgentRegistry(AgentCatalog.DEFAULT_AGENTS);
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ForecastCommand.class) {
                    return (K) new ForecastCommand(orchestrator, eventBus);
                }
                if (cls == AgentsCommand.class) {
                    return (K) new AgentsCommand(registry);
                }
                if (cls == PresetsCommand.class) {
                    return (K) new PresetsCommand(new PresetCatalog(registry));
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new ForecastmindCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    /** Makes start() publish the given terminal event synchronously. */
    private void startPublishes(String eventType, Map<String, Object> payload) {
        when(orchestrator.start(anyString(), any(Matchup.class), any())).thenAnswer(invocation -> {
            String forecastId = invocation.getArgument(0);
            eventBus.publish(ForecastEvent.of(ForecastEvent.STAGE_STARTED, forecastId, "task-1",
                    Map.of("stageName", "Base Rate", "agents", List.of("base-rate-calculator"))));
            eventBus.publish(ForecastEvent.of(eventType, forecastId, "task-1", payload));
            return new StartedForecast(forecastId, "task-1");
        });
    }

    private static ForecastStatus completedStatus(String forecastId) {
        var context = new ForecastContext(forecastId, new Matchup("nba-401", "Lakers", "Celtics", null));
        context.setBaseRate(0.6, ConfidenceInterval.around(0.6, 0.1), 120);
        context.finalizeForecast(0.642, new ConfidenceInterval(0.56, 0.72), "home", List.of("Home court edge"));
        return new ForecastStatus(forecastId, "task-1", "quick", TaskState.COMPLETED, ForecastStage.SYNTHESIS,
                100, null, Instant.now(), Instant.now(), context);
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            for (String sub : List.of("forecast", "agents", "presets", "health", "serve", "help")) {
                assertTrue(output.contains(sub), "Help should list '" + sub + "' subcommand");
            }
            assertTrue(output.contains("Multi-stage probabilistic forecasting pipeline"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Forecastmind 0.1.0"));
        }

        @Test
        @DisplayName("no arguments prints banner and usage")
        void noArguments() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("FORECASTMIND"));
            assertTrue(result.output().contains("Usage"));
        }
    }

    // =====================================================================
    //  forecast command
    // =====================================================================

    @Nested
    @DisplayName("forecast command")
    class ForecastCommandTests {

        @Test
        @DisplayName("streams events and prints the summary on completion")
        void completes() {
            startPublishes(ForecastEvent.PIPELINE_COMPLETED, Map.of("finalProbability", 0.642));
            when(orchestrator.getStatus(anyString()))
                    .thenAnswer(invocation -> Optional.of(completedStatus(invocation.getArgument(0))));

            CliResult result = execute("forecast", "nba-401", "Lakers", "Celtics", "--preset", "quick");

            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("[STAGE]"));
            assertTrue(output.contains("p=64.2%"));
            assertTrue(output.contains("Celtics @ Lakers"));
            assertTrue(output.contains("[56.0%, 72.0%]"));
            assertTrue(output.contains("Home court edge"));
            verify(orchestrator).start(anyString(), eq(new Matchup("nba-401", "Lakers", "Celtics", null)), eq("quick"));
        }

        @Test
        @DisplayName("--quiet suppresses the event stream")
        void quiet() {
            startPublishes(ForecastEvent.PIPELINE_COMPLETED, Map.of("finalProbability", 0.642));
            when(orchestrator.getStatus(anyString()))
                    .thenAnswer(invocation -> Optional.of(completedStatus(invocation.getArgument(0))));

            CliResult result = execute("forecast", "nba-401", "Lakers", "Celtics", "-q");

            assertEquals(0, result.exitCode());
            assertFalse(result.output().contains("[STAGE]"));
        }

        @Test
        @DisplayName("a pipeline error exits with 1")
        void pipelineError() {
            startPublishes(ForecastEvent.PIPELINE_ERROR,
                    Map.of("error", "Critical stage synthesis failed: timeout", "code", "PIPELINE_ERROR"));

            CliResult result = execute("forecast", "nba-401", "Lakers", "Celtics");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Critical stage synthesis failed"));
        }

        @Test
        @DisplayName("an unknown preset exits with 2")
        void unknownPreset() {
            when(orchestrator.start(anyString(), any(Matchup.class), eq("turbo")))
                    .thenThrow(new UnknownPresetException("turbo"));

            CliResult result = execute("forecast", "nba-401", "Lakers", "Celtics", "-p", "turbo");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Unknown preset: turbo"));
        }

        @Test
        @DisplayName("an invalid --game-time exits with 2 before starting")
        void badGameTime() {
            CliResult result = execute("forecast", "nba-401", "Lakers", "Celtics", "--game-time", "tonight");

            assertEquals(2, result.exitCode());
            verify(orchestrator, never()).start(anyString(), any(Matchup.class), any());
        }

        @Test
        @DisplayName("a timeout cancels the forecast and exits with 3")
        void timeout() {
            when(orchestrator.start(anyString(), any(Matchup.class), any()))
                    .thenAnswer(invocation -> new StartedForecast(invocation.getArgument(0), "task-1"));
            when(orchestrator.cancel(anyString())).thenReturn(CancelOutcome.CANCELLED);

            CliResult result = execute("forecast", "nba-401", "Lakers", "Celtics", "--timeout", "PT0.2S");

            assertEquals(3, result.exitCode());
            assertTrue(result.output().contains("Timed out"));
            verify(orchestrator).cancel(anyString());
        }

        @Test
        @DisplayName("missing positional arguments is a usage error")
        void missingArguments() {
            CliResult result = execute("forecast", "nba-401");
            assertNotEquals(0, result.exitCode());
        }
    }

    // =====================================================================
    //  agents / presets / health
    // =====================================================================

    @Nested
    @DisplayName("catalog commands")
    class CatalogTests {

        @Test
        @DisplayName("agents lists every registered agent")
        void agents() {
            CliResult result = execute("agents");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("10 agents"));
            assertTrue(result.output().contains("synthesis-coordinator"));
        }

        @Test
        @DisplayName("agents --stage filters by stage")
        void agentsByStage() {
            CliResult result = execute("agents", "--stage", "adversarial_review");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("2 agents"));
            assertTrue(result.output().contains("bias-detector"));
            assertFalse(result.output().contains("bayesian-updater"));
        }

        @Test
        @DisplayName("agents with an unknown stage exits with 2")
        void agentsUnknownStage() {
            CliResult result = execute("agents", "-s", "input_required");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Unknown stage: input_required"));
        }

        @Test
        @DisplayName("presets lists quick, balanced and deep")
        void presets() {
            CliResult result = execute("presets");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("quick"));
            assertTrue(result.output().contains("balanced"));
            assertTrue(result.output().contains("(recommended)"));
            assertTrue(result.output().contains("deep"));
        }
    }

    @Nested
    @DisplayName("health command")
    class HealthTests {

        @Test
        @DisplayName("all components up exits with 0")
        void allUp() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("agent-registry", HealthStatus.Status.UP, "10 agent(s) registered", Map.of()),
                    new HealthStatus("reasoning", HealthStatus.Status.UP, "Model client configured", Map.of())));

            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("all systems operational"));
        }

        @Test
        @DisplayName("a down component exits with 1")
        void componentDown() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("reasoning", HealthStatus.Status.DOWN,
                            "No API key configured for the model client", Map.of())));

            CliResult result = execute("health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("reasoning: No API key configured"));
        }
    }

    @Test
    @DisplayName("ConsoleOutput formats percentages and durations")
    void formatting() {
        assertEquals("64.2%", ConsoleOutput.percent(0.642));
        assertEquals("n/a", ConsoleOutput.percent(null));
        assertEquals("850ms", ConsoleOutput.formatDuration(850));
        assertEquals("42s", ConsoleOutput.formatDuration(42_000));
        assertEquals("2m 5s", ConsoleOutput.formatDuration(125_000));
    }
}
