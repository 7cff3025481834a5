package com.forecastmind.core.model;

/**
 * Thrown when a task is asked to move along an edge its lifecycle does not allow.
 */
public class IllegalTaskTransitionException extends RuntimeException {

    private final TaskState from;
    private final TaskState to;

    public IllegalTaskTransitionException(String taskId, TaskState from, TaskState to) {
        super("Task " + taskId + " cannot transition from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public TaskState from() {
        return from;
    }

    public TaskState to() {
        return to;
    }
}
