package com.forecastmind.core.store;

import com.forecastmind.core.model.ForecastContext;
import com.forecastmind.core.model.Matchup;
import com.forecastmind.core.model.PipelineConfig;
import com.forecastmind.core.model.PipelineTask;
import com.forecastmind.core.model.TaskState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryContextStoreTest {

    private InMemoryContextStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryContextStore();
    }

    private PipelineTask saveTask(String taskId, String forecastId, String gameId) {
        var context = new ForecastContext(forecastId, new Matchup(gameId, "Home", "Away", null));
        store.saveContext(context);
        var task = new PipelineTask(taskId, new PipelineConfig("quick", Map.of()), context, 1);
        store.saveTask(task);
        return task;
    }

    private static void finish(PipelineTask task, TaskState terminal) {
        task.transitionTo(TaskState.QUEUED, null);
        task.transitionTo(TaskState.WORKING, null);
        task.transitionTo(terminal, null);
    }

    @Nested
    @DisplayName("indexes")
    class Indexes {

        @Test
        @DisplayName("tasks are found by id, forecast and game")
        void lookups() {
            PipelineTask first = saveTask("task-1", "fc-1", "g-1");
            PipelineTask second = saveTask("task-2", "fc-2", "g-1");
            saveTask("task-3", "fc-3", "g-2");

            assertSame(first, store.getTask("task-1").orElseThrow());
            assertSame(second, store.getTaskByForecast("fc-2").orElseThrow());
            assertEquals(List.of(first, second), store.getTasksByGame("g-1"));
            assertEquals(3, store.getAllTasks().size());
            assertTrue(store.getTasksByGame("g-none").isEmpty());
        }

        @Test
        @DisplayName("deleteTask clears every index")
        void deleteTask() {
            saveTask("task-1", "fc-1", "g-1");

            store.deleteTask("task-1");
            store.deleteTask("task-unknown");

            assertTrue(store.getTask("task-1").isEmpty());
            assertTrue(store.getTaskByForecast("fc-1").isEmpty());
            assertTrue(store.getTasksByGame("g-1").isEmpty());
            assertTrue(store.getContext("fc-1").isPresent());
        }
    }

    @Test
    @DisplayName("activeContexts excludes forecasts whose task has finished")
    void activeContexts() {
        saveTask("task-1", "fc-1", "g-1");
        finish(saveTask("task-2", "fc-2", "g-1"), TaskState.COMPLETED);

        List<ForecastContext> active = store.activeContexts();

        assertEquals(1, active.size());
        assertEquals("fc-1", active.get(0).forecastId());
    }

    @Nested
    @DisplayName("cleanupTerminal")
    class Cleanup {

        @Test
        @DisplayName("removes finished tasks and contexts older than the retention")
        void removesExpired() throws InterruptedException {
            PipelineTask running = saveTask("task-1", "fc-1", "g-1");
            finish(saveTask("task-2", "fc-2", "g-1"), TaskState.COMPLETED);
            finish(saveTask("task-3", "fc-3", "g-1"), TaskState.CANCELLED);
            Thread.sleep(10);

            int removed = store.cleanupTerminal(Duration.ZERO);

            assertEquals(2, removed);
            assertEquals(List.of(running), store.getAllTasks());
            assertTrue(store.getContext("fc-2").isEmpty());
            assertTrue(store.getContext("fc-3").isEmpty());
            assertTrue(store.getContext("fc-1").isPresent());
        }

        @Test
        @DisplayName("keeps finished tasks inside the retention window")
        void keepsRecent() {
            finish(saveTask("task-1", "fc-1", "g-1"), TaskState.FAILED);

            assertEquals(0, store.cleanupTerminal(Duration.ofHours(24)));
            assertTrue(store.getTask("task-1").isPresent());
        }
    }
}
