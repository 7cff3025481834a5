package com.forecastmind.core.pipeline;

import com.forecastmind.core.events.EventBus;
import com.forecastmind.core.events.ForecastEvent;
import com.forecastmind.core.metrics.ForecastMetrics;
import com.forecastmind.core.model.ForecastContext;
import com.forecastmind.core.model.ForecastIds;
import com.forecastmind.core.model.Matchup;
import com.forecastmind.core.model.PipelineConfig;
import com.forecastmind.core.model.PipelineTask;
import com.forecastmind.core.model.TaskState;
import com.forecastmind.core.store.ContextStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Priority-ordered holding area for pipeline tasks, and the owner of their lifecycle.
 * <p>
 * Higher priority dequeues first; equal priorities dequeue in arrival order. Every state
 * change goes through this class so the matching {@code task.*} event is always published.
 */
@Service
public class TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    private final ContextStore store;
    private final ForecastContextManager contextManager;
    private final EventBus eventBus;
    private final ForecastMetrics metrics;

    private final List<PipelineTask> queue = new ArrayList<>();

    @Autowired
    public TaskQueue(ContextStore store, ForecastContextManager contextManager,
                     EventBus eventBus, ForecastMetrics metrics) {
        this.store = store;
        this.contextManager = contextManager;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    TaskQueue(ContextStore store, ForecastContextManager contextManager, EventBus eventBus) {
        this(store, contextManager, eventBus, null);
    }

    /** Creates a task together with its context, in SUBMITTED state. */
    public PipelineTask createTask(String forecastId, Matchup matchup, PipelineConfig config, int priority) {
        ForecastContext context = contextManager.createContext(forecastId, matchup);
        var task = new PipelineTask(ForecastIds.newTaskId(), config, context, priority);
        store.saveTask(task);
        log.debug("Created task {} for forecast {}", task.id(), forecastId);
        return task;
    }

    /**
     * Queues a SUBMITTED task. Returns false, leaving the task alone, when it was cancelled
     * between creation and queueing.
     */
    public boolean enqueue(PipelineTask task) {
        int depth;
        // same monitor as the SUBMITTED check in cancel()
        synchronized (task) {
            if (task.state().isTerminal()) {
                log.info("Task {} is already {}; not queueing it", task.id(), task.state());
                return false;
            }
            synchronized (queue) {
                task.transitionTo(TaskState.QUEUED, "Enqueued");
                int index = 0;
                // insert after every task of equal or higher priority
                while (index < queue.size() && queue.get(index).priority() >= task.priority()) {
                    index++;
                }
                queue.add(index, task);
                depth = queue.size();
            }
        }
        store.saveTask(task);
        recordDepth(depth);
        log.info("Task {} queued (priority {}, position {})", task.id(), task.priority(), positionOf(task.id()));
        publish(ForecastEvent.TASK_QUEUED, task, Map.of("priority", task.priority(), "queueDepth", depth));
        return true;
    }

    public Optional<PipelineTask> dequeue() {
        PipelineTask next;
        int depth;
        synchronized (queue) {
            if (queue.isEmpty()) {
                return Optional.empty();
            }
            next = queue.remove(0);
            depth = queue.size();
        }
        recordDepth(depth);
        return Optional.of(next);
    }

    public void markWorking(PipelineTask task) {
        task.transitionTo(TaskState.WORKING, "Dispatched");
        store.saveTask(task);
        publish(ForecastEvent.TASK_STARTED, task, Map.of());
    }

    public void markCompleted(PipelineTask task) {
        task.transitionTo(TaskState.COMPLETED, "Pipeline finished");
        store.saveTask(task);
        log.info("Task {} completed", task.id());
        publish(ForecastEvent.TASK_COMPLETED, task, Map.of());
    }

    public void markFailed(PipelineTask task, String error) {
        task.transitionTo(TaskState.FAILED, error);
        store.saveTask(task);
        log.error("Task {} failed: {}", task.id(), error);
        publish(ForecastEvent.TASK_FAILED, task, Map.of("error", error != null ? error : "unknown"));
    }

    public void markCancelled(PipelineTask task, String reason) {
        task.transitionTo(TaskState.CANCELLED, reason);
        store.saveTask(task);
        log.info("Task {} cancelled: {}", task.id(), reason);
        publish(ForecastEvent.TASK_CANCELLED, task, Map.of("reason", reason));
    }

    /**
     * Cancels a task. A queued task is removed and cancelled at once; a running task is
     * flagged and stops at its next stage boundary.
     */
    public CancelOutcome cancel(String taskId) {
        PipelineTask task = store.getTask(taskId).orElse(null);
        if (task == null) {
            return CancelOutcome.NOT_FOUND;
        }
        synchronized (task) {
            if (task.state().isTerminal()) {
                return CancelOutcome.ALREADY_TERMINAL;
            }
            if (task.state() == TaskState.SUBMITTED) {
                markCancelled(task, "Cancelled before queueing");
                return CancelOutcome.CANCELLED;
            }
            boolean removed;
            synchronized (queue) {
                removed = queue.remove(task);
            }
            if (removed) {
                recordDepth(size());
                markCancelled(task, "Cancelled while queued");
                return CancelOutcome.CANCELLED;
            }
        }
        task.requestCancel();
        log.info("Task {} flagged for cancellation", taskId);
        return CancelOutcome.CANCELLING;
    }

    public int size() {
        synchronized (queue) {
            return queue.size();
        }
    }

    /** 1-based queue position, or 0 if the task is not queued. */
    public int positionOf(String taskId) {
        synchronized (queue) {
            for (int i = 0; i < queue.size(); i++) {
                if (queue.get(i).id().equals(taskId)) {
                    return i + 1;
                }
            }
        }
        return 0;
    }

    public List<PipelineTask> queuedTasks() {
        synchronized (queue) {
            return List.copyOf(queue);
        }
    }

    private void publish(String type, PipelineTask task, Map<String, Object> extra) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("state", task.state().name());
        payload.put("gameId", task.gameId());
        payload.putAll(extra);
        eventBus.publish(ForecastEvent.of(type, task.forecastId(), task.id(), payload));
    }

    private void recordDepth(int depth) {
        if (metrics != null) {
            metrics.recordQueueDepth(depth);
        }
    }
}
