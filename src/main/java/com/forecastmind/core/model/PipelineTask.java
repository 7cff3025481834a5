package com.forecastmind.core.model;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One pipeline run for one forecast. Owns its {@link ForecastContext}.
 * <p>
 * {@link #transitionTo} is the only way to change the lifecycle state; it rejects any edge
 * not declared by {@link TaskState#successors()}.
 */
public class PipelineTask {

    private final String id;
    private final String forecastId;
    private final String gameId;
    private final PipelineConfig config;
    private final ForecastContext context;
    private final int priority;
    private final Instant createdAt;

    private final List<StateTransition> history = new CopyOnWriteArrayList<>();
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    private volatile TaskState state = TaskState.SUBMITTED;
    private volatile ForecastStage currentStage;
    private volatile String error;
    private volatile Instant updatedAt;
    private volatile Instant completedAt;

    public PipelineTask(String id, PipelineConfig config, ForecastContext context, int priority) {
        this.id = id;
        this.forecastId = context.forecastId();
        this.gameId = context.gameId();
        this.config = config;
        this.context = context;
        this.priority = priority;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    /**
     * Moves the task to {@code next}, recording the transition.
     *
     * @param next   target state
     * @param reason free-text reason stored in the history (nullable)
     * @throws IllegalTaskTransitionException if the edge is not legal from the current state
     */
    public synchronized void transitionTo(TaskState next, String reason) {
        TaskState previous = this.state;
        if (!previous.canTransitionTo(next)) {
            throw new IllegalTaskTransitionException(id, previous, next);
        }
        Instant now = Instant.now();
        this.state = next;
        this.updatedAt = now;
        if (next == TaskState.COMPLETED || next == TaskState.FAILED) {
            this.completedAt = now;
        }
        if (next == TaskState.FAILED && reason != null) {
            this.error = reason;
        }
        history.add(new StateTransition(previous, next, now, reason));
    }

    public void setCurrentStage(ForecastStage stage) {
        this.currentStage = stage;
        this.updatedAt = Instant.now();
    }

    /** Flags the task for cooperative cancellation; returns false if it was already flagged. */
    public boolean requestCancel() {
        return cancelRequested.compareAndSet(false, true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public String id() {
        return id;
    }

    public String forecastId() {
        return forecastId;
    }

    public String gameId() {
        return gameId;
    }

    public PipelineConfig config() {
        return config;
    }

    public ForecastContext context() {
        return context;
    }

    public int priority() {
        return priority;
    }

    public TaskState state() {
        return state;
    }

    public ForecastStage currentStage() {
        return currentStage;
    }

    public String error() {
        return error;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public List<StateTransition> history() {
        return List.copyOf(history);
    }

    @Override
    public String toString() {
        return "PipelineTask[" + id + ", forecast=" + forecastId + ", state=" + state + "]";
    }
}
