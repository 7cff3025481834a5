package com.forecastmind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.forecastmind.core.model.BayesianUpdate;
import com.forecastmind.core.model.EvidenceItem;
import com.forecastmind.core.model.ForecastContext;
import com.forecastmind.core.model.ForecastStage;
import com.forecastmind.core.model.ReferenceClassMatch;
import com.forecastmind.core.model.SubQuestion;
import com.forecastmind.core.pipeline.ForecastStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON response for forecast endpoints.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ForecastResponse(
    @JsonProperty("forecast_id") String forecastId,
    @JsonProperty("task_id") String taskId,
    String preset,
    String state,
    @JsonProperty("current_stage") String currentStage,
    int progress,
    String error,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("completed_at") String completedAt,
    @JsonProperty("game_id") String gameId,
    @JsonProperty("home_team") String homeTeam,
    @JsonProperty("away_team") String awayTeam,
    @JsonProperty("reference_classes") List<ReferenceClassMatch> referenceClasses,
    @JsonProperty("base_rate") Double baseRate,
    @JsonProperty("sub_questions") List<SubQuestion> subQuestions,
    @JsonProperty("structural_estimate") Double structuralEstimate,
    List<EvidenceItem> evidence,
    @JsonProperty("bayesian_updates") List<BayesianUpdate> bayesianUpdates,
    @JsonProperty("posterior_probability") Double posteriorProbability,
    List<String> concerns,
    @JsonProperty("bias_flags") List<String> biasFlags,
    @JsonProperty("final_probability") Double finalProbability,
    @JsonProperty("confidence_interval") List<Double> confidenceInterval,
    String recommendation,
    @JsonProperty("key_drivers") List<String> keyDrivers,
    List<StageSummary> stages
) {

    public record StageSummary(
        String stage,
        List<String> agents,
        @JsonProperty("processing_time_ms") Long processingTimeMs
    ) {}

    public static ForecastResponse from(ForecastStatus status) {
        ForecastContext ctx = status.context();
        var stages = new ArrayList<StageSummary>();
        for (ForecastStage stage : ForecastStage.ordered()) {
            var contributions = ctx.contributions(stage);
            Long ms = ctx.processingTimes().get(stage);
            if (!contributions.isEmpty() || ms != null) {
                stages.add(new StageSummary(stage.wireName(),
                        contributions.stream().map(c -> c.agentId()).toList(), ms));
            }
        }
        return new ForecastResponse(
                status.forecastId(),
                status.taskId(),
                status.presetId(),
                status.state().name(),
                status.currentStage() != null ? status.currentStage().wireName() : null,
                status.progress(),
                status.error(),
                status.createdAt().toString(),
                status.completedAt() != null ? status.completedAt().toString() : null,
                ctx.gameId(),
                ctx.matchup().homeTeam(),
                ctx.matchup().awayTeam(),
                ctx.referenceClasses(),
                ctx.baseRate(),
                ctx.subQuestions(),
                ctx.structuralEstimate(),
                ctx.evidence(),
                ctx.bayesianUpdates(),
                ctx.posteriorProbability(),
                ctx.concerns(),
                ctx.biasFlags(),
                ctx.finalProbability(),
                ctx.finalConfidenceInterval() != null ? ctx.finalConfidenceInterval().asList() : null,
                ctx.recommendation(),
                ctx.keyDrivers(),
                stages);
    }
}
