package com.forecastmind.core.store;

import com.forecastmind.core.model.ForecastContext;
import com.forecastmind.core.model.PipelineTask;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Keyed storage for forecast contexts and pipeline tasks.
 * <p>
 * Holds no business logic. Implementations must be safe for concurrent access by key.
 */
public interface ContextStore {

    Optional<ForecastContext> getContext(String forecastId);

    void saveContext(ForecastContext context);

    void deleteContext(String forecastId);

    Optional<PipelineTask> getTask(String taskId);

    /** The task that owns {@code forecastId}, if any. */
    Optional<PipelineTask> getTaskByForecast(String forecastId);

    void saveTask(PipelineTask task);

    void deleteTask(String taskId);

    List<PipelineTask> getTasksByGame(String gameId);

    List<PipelineTask> getAllTasks();

    /** Contexts whose owning task has not reached a terminal state. */
    List<ForecastContext> activeContexts();

    /**
     * Removes terminal tasks, and their contexts, that finished more than {@code retention} ago.
     *
     * @return number of tasks removed
     */
    int cleanupTerminal(Duration retention);
}
