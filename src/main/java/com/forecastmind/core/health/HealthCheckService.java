package com.forecastmind.core.health;

import com.forecastmind.core.agents.AgentRegistry;
import com.forecastmind.core.llm.ReasoningService;
import com.forecastmind.core.pipeline.PipelineOrchestrator;
import com.forecastmind.core.pipeline.PipelineStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final AgentRegistry registry;
    private final ReasoningService reasoning;
    private final PipelineOrchestrator orchestrator;

    public HealthCheckService(
            @Autowired(required = false) AgentRegistry registry,
            @Autowired(required = false) ReasoningService reasoning,
            @Autowired(required = false) PipelineOrchestrator orchestrator) {
        this.registry = registry;
        this.reasoning = reasoning;
        this.orchestrator = orchestrator;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkRegistry());
        results.add(checkReasoning());
        results.add(checkWorkerPool());
        return results;
    }

    /** Worst status across all components. */
    public HealthStatus.Status overall(List<HealthStatus> statuses) {
        HealthStatus.Status worst = HealthStatus.Status.UP;
        for (HealthStatus status : statuses) {
            if (status.status() == HealthStatus.Status.DOWN) {
                return HealthStatus.Status.DOWN;
            }
            if (status.status() == HealthStatus.Status.DEGRADED) {
                worst = HealthStatus.Status.DEGRADED;
            }
        }
        return worst;
    }

    private HealthStatus checkRegistry() {
        if (registry == null || registry.size() == 0) {
            return new HealthStatus("agent-registry", HealthStatus.Status.DOWN,
                    "No agents registered", Map.of());
        }
        return new HealthStatus("agent-registry", HealthStatus.Status.UP,
                registry.size() + " agent(s) registered", Map.of("agents", String.valueOf(registry.size())));
    }

    private HealthStatus checkReasoning() {
        if (reasoning == null) {
            return new HealthStatus("reasoning", HealthStatus.Status.DOWN,
                    "No reasoning service configured", Map.of());
        }
        try {
            if (reasoning.isAvailable()) {
                return new HealthStatus("reasoning", HealthStatus.Status.UP,
                        "Model client configured", Map.of());
            }
            return new HealthStatus("reasoning", HealthStatus.Status.DOWN,
                    "No API key configured for the model client", Map.of());
        } catch (RuntimeException e) {
            log.warn("Reasoning health check failed: {}", e.getMessage());
            return new HealthStatus("reasoning", HealthStatus.Status.DOWN,
                    "Reasoning service error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkWorkerPool() {
        if (orchestrator == null) {
            return new HealthStatus("worker-pool", HealthStatus.Status.DOWN,
                    "Orchestrator not available", Map.of());
        }
        PipelineStats stats = orchestrator.stats();
        var metadata = Map.of(
                "queued", String.valueOf(stats.queued()),
                "running", String.valueOf(stats.running()),
                "capacity", String.valueOf(stats.capacity()));
        // a backlog deeper than the pool means callers are waiting a full pipeline or more
        if (stats.running() >= stats.capacity() && stats.queued() > stats.capacity()) {
            return new HealthStatus("worker-pool", HealthStatus.Status.DEGRADED,
                    "Saturated: " + stats.queued() + " task(s) waiting", metadata);
        }
        return new HealthStatus("worker-pool", HealthStatus.Status.UP,
                stats.running() + "/" + stats.capacity() + " worker(s) busy", metadata);
    }
}
