package com.forecastmind.core.store;

import com.forecastmind.core.model.ForecastContext;
import com.forecastmind.core.model.PipelineTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Volatile {@link ContextStore}. Everything is lost on restart.
 */
@Component
public class InMemoryContextStore implements ContextStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryContextStore.class);

    private final Map<String, ForecastContext> contexts = new ConcurrentHashMap<>();
    private final Map<String, PipelineTask> tasks = new ConcurrentHashMap<>();
    private final Map<String, String> taskIdByForecast = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> taskIdsByGame = new ConcurrentHashMap<>();

    @Override
    public Optional<ForecastContext> getContext(String forecastId) {
        return Optional.ofNullable(contexts.get(forecastId));
    }

    @Override
    public void saveContext(ForecastContext context) {
        contexts.put(context.forecastId(), context);
    }

    @Override
    public void deleteContext(String forecastId) {
        contexts.remove(forecastId);
    }

    @Override
    public Optional<PipelineTask> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public Optional<PipelineTask> getTaskByForecast(String forecastId) {
        String taskId = taskIdByForecast.get(forecastId);
        return taskId != null ? getTask(taskId) : Optional.empty();
    }

    @Override
    public void saveTask(PipelineTask task) {
        tasks.put(task.id(), task);
        taskIdByForecast.put(task.forecastId(), task.id());
        taskIdsByGame.computeIfAbsent(task.gameId(), k -> ConcurrentHashMap.newKeySet()).add(task.id());
    }

    @Override
    public void deleteTask(String taskId) {
        PipelineTask removed = tasks.remove(taskId);
        if (removed == null) {
            return;
        }
        taskIdByForecast.remove(removed.forecastId(), taskId);
        taskIdsByGame.computeIfPresent(removed.gameId(), (k, ids) -> {
            ids.remove(taskId);
            return ids.isEmpty() ? null : ids;
        });
    }

    @Override
    public List<PipelineTask> getTasksByGame(String gameId) {
        Set<String> ids = taskIdsByGame.getOrDefault(gameId, Set.of());
        return ids.stream()
                .map(tasks::get)
                .filter(t -> t != null)
                .sorted(Comparator.comparing(PipelineTask::createdAt))
                .toList();
    }

    @Override
    public List<PipelineTask> getAllTasks() {
        return tasks.values().stream()
                .sorted(Comparator.comparing(PipelineTask::createdAt))
                .toList();
    }

    @Override
    public List<ForecastContext> activeContexts() {
        var active = new ArrayList<ForecastContext>();
        for (PipelineTask task : tasks.values()) {
            if (!task.state().isTerminal()) {
                ForecastContext context = contexts.get(task.forecastId());
                if (context != null) {
                    active.add(context);
                }
            }
        }
        return active;
    }

    @Override
    public int cleanupTerminal(Duration retention) {
        Instant cutoff = Instant.now().minus(retention);
        int removed = 0;
        for (PipelineTask task : List.copyOf(tasks.values())) {
            if (!task.state().isTerminal()) {
                continue;
            }
            Instant finishedAt = task.completedAt() != null ? task.completedAt() : task.updatedAt();
            if (finishedAt.isBefore(cutoff)) {
                deleteTask(task.id());
                deleteContext(task.forecastId());
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Cleaned up {} terminal forecast(s) older than {}", removed, retention);
        }
        return removed;
    }
}
