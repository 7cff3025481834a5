package com.forecastmind.core.pipeline;

/**
 * @param queued   tasks waiting for a worker
 * @param running  tasks currently being driven
 * @param capacity maximum concurrently running tasks
 */
public record PipelineStats(int queued, int running, int capacity) {}
