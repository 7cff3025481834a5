package com.forecastmind.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("ForecastStage")
    class Stages {

        @Test
        @DisplayName("the sequence has eight stages from reference class to calibration")
        void ordered() {
            List<ForecastStage> stages = ForecastStage.ordered();
            assertEquals(8, stages.size());
            assertEquals(ForecastStage.REFERENCE_CLASS, stages.get(0));
            assertEquals(ForecastStage.CALIBRATION, stages.get(7));
            assertEquals(6, ForecastStage.SYNTHESIS.position());
        }

        @Test
        @DisplayName("fromWire accepts wire and enum names, case-insensitively")
        void fromWire() {
            assertEquals(ForecastStage.BASE_RATE, ForecastStage.fromWire("base_rate"));
            assertEquals(ForecastStage.BASE_RATE, ForecastStage.fromWire("BASE_RATE"));
            assertEquals(ForecastStage.EVIDENCE_GATHERING, ForecastStage.fromWire("Evidence_Gathering"));
            assertThrows(IllegalArgumentException.class, () -> ForecastStage.fromWire("input_required"));
            assertThrows(IllegalArgumentException.class, () -> ForecastStage.fromWire(null));
        }

        @Test
        @DisplayName("toString is the wire name")
        void wireName() {
            assertEquals("bayesian_update", ForecastStage.BAYESIAN_UPDATE.toString());
        }
    }

    @Nested
    @DisplayName("TaskState")
    class States {

        @Test
        @DisplayName("terminal states have no successors")
        void terminal() {
            for (TaskState state : List.of(TaskState.COMPLETED, TaskState.FAILED, TaskState.CANCELLED)) {
                assertTrue(state.isTerminal());
                assertTrue(state.successors().isEmpty());
            }
        }

        @Test
        @DisplayName("work cannot start before queueing or restart after finishing")
        void edges() {
            assertTrue(TaskState.SUBMITTED.canTransitionTo(TaskState.QUEUED));
            assertFalse(TaskState.SUBMITTED.canTransitionTo(TaskState.WORKING));
            assertTrue(TaskState.QUEUED.canTransitionTo(TaskState.CANCELLED));
            assertFalse(TaskState.WORKING.canTransitionTo(TaskState.QUEUED));
            assertFalse(TaskState.COMPLETED.canTransitionTo(TaskState.WORKING));
        }
    }

    @Nested
    @DisplayName("PipelineTask")
    class Tasks {

        private PipelineTask newTask() {
            var context = new ForecastContext("fc-1", new Matchup("g-1", "Lakers", "Celtics", null));
            return new PipelineTask("task-1", new PipelineConfig("quick", Map.of()), context, 2);
        }

        @Test
        @DisplayName("records each transition with its reason")
        void history() {
            PipelineTask task = newTask();
            task.transitionTo(TaskState.QUEUED, "Enqueued");
            task.transitionTo(TaskState.WORKING, "Dispatched");
            task.transitionTo(TaskState.FAILED, "Critical stage base_rate failed: timeout");

            List<StateTransition> history = task.history();
            assertEquals(3, history.size());
            assertEquals(TaskState.SUBMITTED, history.get(0).from());
            assertEquals(TaskState.FAILED, history.get(2).to());
            assertEquals("Critical stage base_rate failed: timeout", task.error());
            assertNotNull(task.completedAt());
        }

        @Test
        @DisplayName("rejects an illegal transition and keeps its state")
        void illegal() {
            PipelineTask task = newTask();

            var e = assertThrows(IllegalTaskTransitionException.class,
                    () -> task.transitionTo(TaskState.COMPLETED, null));
            assertEquals(TaskState.SUBMITTED, e.from());
            assertEquals(TaskState.COMPLETED, e.to());
            assertEquals(TaskState.SUBMITTED, task.state());
            assertTrue(task.history().isEmpty());
        }

        @Test
        @DisplayName("requestCancel only flips the flag once")
        void cancelFlag() {
            PipelineTask task = newTask();

            assertTrue(task.requestCancel());
            assertFalse(task.requestCancel());
            assertTrue(task.isCancelRequested());
        }

        @Test
        @DisplayName("takes forecast and game ids from its context")
        void ids() {
            PipelineTask task = newTask();
            assertEquals("fc-1", task.forecastId());
            assertEquals("g-1", task.gameId());
        }
    }

    @Nested
    @DisplayName("ForecastContext")
    class Contexts {

        @Test
        @DisplayName("bestEstimate prefers final, then posterior, then base rate")
        void bestEstimate() {
            var context = new ForecastContext("fc-1", new Matchup("g-1", "Lakers", "Celtics", null));
            assertEquals(0.5, context.bestEstimate());

            context.setBaseRate(0.58, ConfidenceInterval.around(0.58, 0.1), 120);
            assertEquals(0.58, context.bestEstimate());

            context.addBayesianUpdate(new BayesianUpdate("Star guard out", 0.8, 0.58, 0.525, null));
            assertEquals(0.525, context.bestEstimate());

            context.finalizeForecast(0.54, ConfidenceInterval.around(0.54, 0.08), "home", List.of());
            assertEquals(0.54, context.bestEstimate());
        }

        @Test
        @DisplayName("a missing interval falls back to a band around the point")
        void intervalFallback() {
            ConfidenceInterval interval = ConfidenceInterval.fromListOrAround(List.of(0.5), 0.6, 0.1);
            assertEquals(0.5, interval.lower(), 1e-9);
            assertEquals(0.7, interval.upper(), 1e-9);
        }
    }

    @Test
    @DisplayName("PipelineConfig treats unlisted stages as disabled")
    void unlistedStageDisabled() {
        var config = new PipelineConfig("custom", Map.of(ForecastStage.BASE_RATE,
                new StageConfig(true, false, List.of(AgentConfig.defaults("base-rate-calculator", 1500)))));

        assertTrue(config.stage(ForecastStage.BASE_RATE).enabled());
        assertFalse(config.stage(ForecastStage.SYNTHESIS).enabled());
        assertEquals(List.of("base-rate-calculator"), config.stage(ForecastStage.BASE_RATE).enabledAgentIds());
    }
}
