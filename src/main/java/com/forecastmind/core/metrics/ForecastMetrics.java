package com.forecastmind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for forecast pipeline execution.
 */
@Service
public class ForecastMetrics {

    private final MeterRegistry registry;

    public ForecastMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPipelineResult(String status, long ms) {
        Timer.builder("forecast.pipeline.duration")
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
        Counter.builder("forecast.pipelines.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordStageResult(String stage, String status, long ms) {
        Timer.builder("forecast.stage.duration")
                .tag("stage", stage)
                .register(registry)
                .record(Duration.ofMillis(ms));
        Counter.builder("forecast.stage.results")
                .tag("stage", stage)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Records one agent invocation.
     *
     * @param agentId   the agent invoked
     * @param success   whether a contribution was produced
     * @param latencyMs call latency including parsing
     */
    public void recordAgentInvocation(String agentId, boolean success, long latencyMs) {
        Counter.builder("forecast.agent.invocations")
                .description("Agent invocations by outcome")
                .tag("agent", agentId)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
        Timer.builder("forecast.agent.latency")
                .tag("agent", agentId)
                .register(registry)
                .record(Duration.ofMillis(latencyMs));
    }

    public void recordQueueDepth(int depth) {
        DistributionSummary.builder("forecast.queue.depth")
                .description("Tasks waiting in the pipeline queue")
                .register(registry)
                .record(depth);
    }

    public void incrementClampedLikelihoodRatios() {
        Counter.builder("forecast.likelihood_ratio.clamped")
                .description("Likelihood ratios saturated at the configured band")
                .register(registry)
                .increment();
    }
}
