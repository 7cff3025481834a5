package com.forecastmind.core.pipeline;

import com.forecastmind.core.calibration.CalibrationService;
import com.forecastmind.core.events.EventBus;
import com.forecastmind.core.events.ForecastEvent;
import com.forecastmind.core.logging.MdcContext;
import com.forecastmind.core.metrics.ForecastMetrics;
import com.forecastmind.core.model.ForecastContext;
import com.forecastmind.core.model.ForecastIds;
import com.forecastmind.core.model.ForecastStage;
import com.forecastmind.core.model.Matchup;
import com.forecastmind.core.model.PipelineConfig;
import com.forecastmind.core.model.PipelineTask;
import com.forecastmind.core.model.StageConfig;
import com.forecastmind.core.model.StageResult;
import com.forecastmind.core.model.TaskState;
import com.forecastmind.core.store.ContextStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives pipeline tasks through the stage sequence on a bounded worker pool.
 * <p>
 * {@link #start} returns as soon as the task is queued. Up to {@code max-concurrent-pipelines}
 * tasks run at once; the rest wait in the {@link TaskQueue} in priority order. Within a task,
 * stages run strictly in order and cancellation is checked between stages.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    public static final String PIPELINE_ERROR_CODE = "PIPELINE_ERROR";

    private final TaskQueue queue;
    private final StageExecutor stageExecutor;
    private final ForecastContextManager contextManager;
    private final ContextStore store;
    private final PresetCatalog presets;
    private final EventBus eventBus;
    private final CalibrationService calibration;
    private final ForecastMetrics metrics;
    private final ExecutorService workers;
    private final int maxConcurrent;
    private final Set<ForecastStage> criticalStages;
    private final String defaultPreset;

    private final AtomicInteger running = new AtomicInteger();
    private final Object drainLock = new Object();

    @Autowired
    public PipelineOrchestrator(TaskQueue queue, StageExecutor stageExecutor,
                                ForecastContextManager contextManager, ContextStore store,
                                PresetCatalog presets, EventBus eventBus, CalibrationService calibration,
                                ForecastMetrics metrics, PipelineProperties properties,
                                @Qualifier("pipelineExecutor") ExecutorService workers) {
        this(queue, stageExecutor, contextManager, store, presets, eventBus, calibration, metrics, workers,
                properties.getMaxConcurrentPipelines(), properties.getCriticalStages(),
                properties.getDefaultPreset());
    }

    PipelineOrchestrator(TaskQueue queue, StageExecutor stageExecutor,
                         ForecastContextManager contextManager, ContextStore store,
                         PresetCatalog presets, EventBus eventBus, CalibrationService calibration,
                         ForecastMetrics metrics, ExecutorService workers, int maxConcurrent,
                         List<ForecastStage> criticalStages, String defaultPreset) {
        this.queue = queue;
        this.stageExecutor = stageExecutor;
        this.contextManager = contextManager;
        this.store = store;
        this.presets = presets;
        this.eventBus = eventBus;
        this.calibration = calibration;
        this.metrics = metrics;
        this.workers = workers;
        this.maxConcurrent = Math.max(1, maxConcurrent);
        this.criticalStages = criticalStages.isEmpty()
                ? EnumSet.noneOf(ForecastStage.class) : EnumSet.copyOf(criticalStages);
        this.defaultPreset = defaultPreset;
    }

    public StartedForecast start(Matchup matchup, String presetId) {
        return start(ForecastIds.newForecastId(), matchup, presetId);
    }

    /**
     * Creates and queues a forecast under a caller-chosen id, so the caller can subscribe
     * to its events before anything runs.
     *
     * @throws com.forecastmind.core.model.UnknownPresetException if the preset is not defined
     */
    public StartedForecast start(String forecastId, Matchup matchup, String presetId) {
        String preset = presetId != null && !presetId.isBlank() ? presetId : defaultPreset;
        PipelineConfig config = presets.buildPipelineConfig(preset);
        PipelineTask task = queue.createTask(forecastId, matchup, config, presets.priorityOf(preset));
        log.info("Forecast {} requested: {} @ {} (preset {}, task {})", forecastId,
                matchup.awayTeam(), matchup.homeTeam(), preset, task.id());
        if (queue.enqueue(task)) {
            drain();
        }
        return new StartedForecast(forecastId, task.id());
    }

    /** Hands queued tasks to free workers until the pool is full or the queue is empty. */
    void drain() {
        synchronized (drainLock) {
            while (running.get() < maxConcurrent) {
                Optional<PipelineTask> next = queue.dequeue();
                if (next.isEmpty()) {
                    return;
                }
                PipelineTask task = next.get();
                running.incrementAndGet();
                try {
                    workers.execute(() -> {
                        try {
                            run(task);
                        } finally {
                            running.decrementAndGet();
                            drain();
                        }
                    });
                } catch (RejectedExecutionException e) {
                    running.decrementAndGet();
                    log.error("Worker pool rejected task {}: {}", task.id(), e.getMessage());
                    fail(task, null, "Worker pool unavailable: " + e.getMessage());
                    return;
                }
            }
        }
    }

    void run(PipelineTask task) {
        String forecastId = task.forecastId();
        MdcContext.setForecast(forecastId, task.id());
        long start = System.currentTimeMillis();
        try {
            if (task.isCancelRequested()) {
                queue.markCancelled(task, "Cancelled before dispatch");
                recordPipeline("cancelled", start);
                return;
            }
            queue.markWorking(task);

            for (ForecastStage stage : ForecastStage.ordered()) {
                if (task.isCancelRequested()) {
                    log.info("Forecast {} cancelled before stage {}", forecastId, stage);
                    queue.markCancelled(task, "Cancelled before " + stage);
                    recordPipeline("cancelled", start);
                    return;
                }
                StageConfig stageConfig = task.config().stage(stage);
                if (!stageConfig.enabled()) {
                    log.debug("Skipping disabled stage {}", stage);
                    continue;
                }
                runStage(task, stage, stageConfig);
            }

            ForecastContext context = contextManager.requireContext(forecastId);
            if (context.finalProbability() != null) {
                complete(task, context);
                recordPipeline("completed", start);
            } else {
                log.warn("Forecast {} ran every stage without a final probability; task left {}",
                        forecastId, task.state());
            }
        } catch (PipelineFailureException e) {
            fail(task, task.currentStage(), e.getMessage());
            recordPipeline("failed", start);
        } catch (RuntimeException e) {
            log.error("Unexpected error driving forecast {}", forecastId, e);
            fail(task, task.currentStage(), "Unexpected error: " + e.getMessage());
            recordPipeline("failed", start);
        } finally {
            MdcContext.clear();
        }
    }

    private void runStage(PipelineTask task, ForecastStage stage, StageConfig stageConfig) {
        String forecastId = task.forecastId();
        var started = new LinkedHashMap<String, Object>();
        started.put("stage", stage.wireName());
        started.put("stageName", stage.displayName());
        started.put("agents", stageConfig.enabledAgentIds());
        eventBus.publish(ForecastEvent.of(ForecastEvent.STAGE_STARTED, forecastId, task.id(), started));

        task.setCurrentStage(stage);
        contextManager.setCurrentStage(forecastId, stage);
        StageResult result = stageExecutor.execute(forecastId, stage, stageConfig);
        MdcContext.setForecast(forecastId, task.id());

        var completed = new LinkedHashMap<String, Object>();
        completed.put("stage", stage.wireName());
        completed.put("status", result.status().name().toLowerCase());
        completed.put("output", result.output());
        completed.put("agentCount", result.contributions().size());
        completed.put("processingTimeMs", result.elapsedMs());
        if (result.error() != null) {
            completed.put("error", result.error());
        }
        eventBus.publish(ForecastEvent.of(ForecastEvent.STAGE_COMPLETED, forecastId, task.id(), completed));
        eventBus.publish(ForecastEvent.of(ForecastEvent.PROGRESS_UPDATED, forecastId, task.id(),
                Map.of("stage", stage.wireName(), "progress", contextManager.getProgress(forecastId))));

        if (result.isFailed()) {
            if (criticalStages.contains(stage)) {
                throw new PipelineFailureException("Critical stage " + stage + " failed: " + result.error());
            }
            log.warn("Non-critical stage {} failed, continuing: {}", stage, result.error());
        }
    }

    private void complete(PipelineTask task, ForecastContext context) {
        queue.markCompleted(task);
        var payload = new LinkedHashMap<String, Object>();
        payload.put("finalProbability", context.finalProbability());
        payload.put("confidenceInterval", context.finalConfidenceInterval() != null
                ? context.finalConfidenceInterval().asList() : List.of());
        payload.put("recommendation", context.recommendation());
        payload.put("keyDrivers", context.keyDrivers());
        payload.put("processingTimes", stageTimes(context));
        eventBus.publish(ForecastEvent.of(ForecastEvent.PIPELINE_COMPLETED, task.forecastId(), task.id(), payload));
        if (calibration != null) {
            calibration.recordPrediction(task.forecastId(), task.gameId(), context.finalProbability());
        }
        log.info("Forecast {} complete: p={} ({})", task.forecastId(), context.finalProbability(),
                context.recommendation());
    }

    private void fail(PipelineTask task, ForecastStage stage, String error) {
        if (!task.state().isTerminal()) {
            queue.markFailed(task, error);
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("error", error);
        payload.put("code", PIPELINE_ERROR_CODE);
        if (stage != null) {
            payload.put("stage", stage.wireName());
        }
        eventBus.publish(ForecastEvent.of(ForecastEvent.PIPELINE_ERROR, task.forecastId(), task.id(), payload));
    }

    /**
     * Cancels a forecast: removes it from the queue if it has not started, otherwise flags
     * it to stop at the next stage boundary.
     */
    public CancelOutcome cancel(String forecastId) {
        return store.getTaskByForecast(forecastId)
                .map(task -> queue.cancel(task.id()))
                .orElse(CancelOutcome.NOT_FOUND);
    }

    public Optional<ForecastStatus> getStatus(String forecastId) {
        return store.getTaskByForecast(forecastId).map(this::statusOf);
    }

    public List<ForecastStatus> listStatuses() {
        return store.getAllTasks().stream().map(this::statusOf).toList();
    }

    private ForecastStatus statusOf(PipelineTask task) {
        int progress = task.state() == TaskState.COMPLETED ? 100 : contextManager.getProgress(task.forecastId());
        return new ForecastStatus(task.forecastId(), task.id(), task.config().presetId(), task.state(),
                task.currentStage(), progress, task.error(), task.createdAt(), task.completedAt(),
                task.context());
    }

    public PipelineStats stats() {
        return new PipelineStats(queue.size(), running.get(), maxConcurrent);
    }

    @PreDestroy
    public void shutdown() {
        List<PipelineTask> pending = queue.queuedTasks();
        for (PipelineTask task : pending) {
            queue.cancel(task.id());
        }
        for (PipelineTask task : store.getAllTasks()) {
            if (task.state() == TaskState.WORKING) {
                task.requestCancel();
            }
        }
        log.info("Orchestrator shutting down ({} queued task(s) cancelled, {} running)", pending.size(),
                running.get());
    }

    private static Map<String, Long> stageTimes(ForecastContext context) {
        var times = new LinkedHashMap<String, Long>();
        for (ForecastStage stage : ForecastStage.ordered()) {
            Long ms = context.processingTimes().get(stage);
            if (ms != null) {
                times.put(stage.wireName(), ms);
            }
        }
        return times;
    }

    private void recordPipeline(String status, long start) {
        if (metrics != null) {
            metrics.recordPipelineResult(status, System.currentTimeMillis() - start);
        }
    }
}
