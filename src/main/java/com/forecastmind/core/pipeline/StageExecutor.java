package com.forecastmind.core.pipeline;

import com.forecastmind.core.agents.AgentInvoker;
import com.forecastmind.core.agents.CoherenceRouter;
import com.forecastmind.core.agents.InvocationOptions;
import com.forecastmind.core.agents.InvocationResult;
import com.forecastmind.core.logging.MdcContext;
import com.forecastmind.core.metrics.ForecastMetrics;
import com.forecastmind.core.model.AgentContribution;
import com.forecastmind.core.model.ForecastContext;
import com.forecastmind.core.model.ForecastStage;
import com.forecastmind.core.model.StageConfig;
import com.forecastmind.core.model.StageResult;
import com.forecastmind.core.model.StageStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs one stage: picks agents, invokes them, merges their outputs and applies the
 * result to the forecast context.
 * <p>
 * Stage failures are returned as FAILED {@link StageResult}s, never thrown; whether a
 * failed stage aborts the pipeline is the orchestrator's call.
 */
@Service
public class StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    private final AgentInvoker invoker;
    private final CoherenceRouter router;
    private final OutputMerger merger;
    private final ForecastContextManager contextManager;
    private final ForecastMetrics metrics;
    private final int routerFanOut;

    @Autowired
    public StageExecutor(AgentInvoker invoker, CoherenceRouter router, OutputMerger merger,
                         ForecastContextManager contextManager, ForecastMetrics metrics,
                         PipelineProperties properties) {
        this(invoker, router, merger, contextManager, metrics, properties.getRouterFanOut());
    }

    StageExecutor(AgentInvoker invoker, CoherenceRouter router, OutputMerger merger,
                  ForecastContextManager contextManager, ForecastMetrics metrics, int routerFanOut) {
        this.invoker = invoker;
        this.router = router;
        this.merger = merger;
        this.contextManager = contextManager;
        this.metrics = metrics;
        this.routerFanOut = routerFanOut;
    }

    public StageResult execute(String forecastId, ForecastStage stage, StageConfig stageConfig) {
        long start = System.currentTimeMillis();
        MdcContext.setStage(forecastId, stage.wireName());
        ForecastContext context = contextManager.requireContext(forecastId);

        List<String> agentIds = resolveAgents(stage, stageConfig, context);
        if (agentIds.isEmpty()) {
            return finish(forecastId, StageResult.failed(stage, elapsedSince(start),
                    new NoAgentsAvailableException(stage).getMessage()));
        }
        log.info("Executing stage {} with {} agent(s): {}", stage, agentIds.size(), agentIds);

        List<InvocationResult> results;
        if (stageConfig.parallel() && agentIds.size() > 1) {
            results = invoker.invokeParallel(agentIds, stage, context,
                    id -> InvocationOptions.from(stageConfig.agentConfig(id)));
        } else {
            results = new ArrayList<>(agentIds.size());
            for (String agentId : agentIds) {
                results.add(invoker.invoke(agentId, stage, context,
                        InvocationOptions.from(stageConfig.agentConfig(agentId))));
            }
        }

        List<AgentContribution> contributions = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (InvocationResult result : results) {
            if (result.success()) {
                contributions.add(result.contribution());
            } else {
                errors.add(result.agentId() + ": " + result.error());
            }
        }

        if (contributions.isEmpty()) {
            return finish(forecastId, StageResult.failed(stage, elapsedSince(start),
                    new AllAgentsFailedException(stage, errors).getMessage()));
        }

        Map<String, Object> output = merger.merge(stage, contributions);
        contextManager.recordContributions(forecastId, stage, contributions);
        try {
            contextManager.applyStageOutput(forecastId, stage, output);
        } catch (IllegalArgumentException e) {
            log.warn("Stage {} output does not match its schema: {}", stage, e.getMessage());
            return finish(forecastId, new StageResult(stage, StageStatus.FAILED, output, contributions,
                    elapsedSince(start), "Malformed " + stage + " output: " + e.getMessage()));
        }

        StageStatus status = errors.isEmpty() ? StageStatus.SUCCESS : StageStatus.PARTIAL;
        if (status == StageStatus.PARTIAL) {
            log.warn("Stage {} partially succeeded ({}/{}): {}", stage, contributions.size(),
                    agentIds.size(), errors);
        }
        return finish(forecastId, new StageResult(stage, status, output, contributions,
                elapsedSince(start), errors.isEmpty() ? null : String.join("; ", errors)));
    }

    /**
     * Enabled agents from the config; the router only picks when the config names no agents.
     * A config whose agents are all disabled resolves to an empty list.
     */
    List<String> resolveAgents(ForecastStage stage, StageConfig stageConfig, ForecastContext context) {
        if (stageConfig.agents().isEmpty()) {
            return router.selectAgents(stage, context, routerFanOut);
        }
        List<String> configured = stageConfig.enabledAgentIds();
        if (configured.isEmpty()) {
            log.warn("Every configured agent for stage {} is disabled", stage);
        }
        return configured;
    }

    private StageResult finish(String forecastId, StageResult result) {
        contextManager.recordProcessingTime(forecastId, result.stage(), result.elapsedMs());
        if (metrics != null) {
            metrics.recordStageResult(result.stage().wireName(), result.status().name().toLowerCase(),
                    result.elapsedMs());
        }
        if (result.isFailed()) {
            log.warn("Stage {} failed after {}ms: {}", result.stage(), result.elapsedMs(), result.error());
        } else {
            log.info("Stage {} finished {} in {}ms", result.stage(), result.status(), result.elapsedMs());
        }
        return result;
    }

    private static long elapsedSince(long start) {
        return System.currentTimeMillis() - start;
    }
}
