package com.forecastmind.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a {@link PipelineTask}.
 * <p>
 * Legal transitions form a DAG: SUBMITTED → QUEUED → WORKING → {COMPLETED, FAILED, CANCELLED}.
 * SUBMITTED and QUEUED may also move straight to CANCELLED or FAILED. Terminal states have no exits.
 */
public enum TaskState {
    SUBMITTED,
    QUEUED,
    WORKING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public Set<TaskState> successors() {
        return switch (this) {
            case SUBMITTED -> EnumSet.of(QUEUED, CANCELLED, FAILED);
            case QUEUED -> EnumSet.of(WORKING, CANCELLED, FAILED);
            case WORKING -> EnumSet.of(COMPLETED, FAILED, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(TaskState.class);
        };
    }

    public boolean canTransitionTo(TaskState next) {
        return successors().contains(next);
    }
}
