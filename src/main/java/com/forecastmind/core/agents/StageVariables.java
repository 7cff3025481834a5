package com.forecastmind.core.agents;

import com.forecastmind.core.calibration.CalibrationService;
import com.forecastmind.core.model.AgentContribution;
import com.forecastmind.core.model.BayesianUpdate;
import com.forecastmind.core.model.ForecastContext;
import com.forecastmind.core.model.ForecastStage;
import com.forecastmind.core.model.Matchup;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the template variables each stage's prompts can reference.
 * <p>
 * Every stage sees the matchup, the stage name and all previous raw outputs keyed by
 * stage wire name. Stage-specific variables are read from the typed context, falling
 * back to the first contribution's raw field when the context has not absorbed it.
 */
@Component
public class StageVariables {

    static final double DEFAULT_PROBABILITY = 0.5;
    static final String NO_REASONING = "No prior reasoning available.";

    private final CalibrationService calibration;

    @Autowired
    public StageVariables(@Autowired(required = false) CalibrationService calibration) {
        this.calibration = calibration;
    }

    public StageVariables() {
        this(null);
    }

    public Map<String, Object> build(ForecastStage stage, ForecastContext context) {
        Matchup matchup = context.matchup();
        var vars = new LinkedHashMap<String, Object>();
        vars.put("gameId", matchup.gameId());
        vars.put("homeTeam", matchup.homeTeam());
        vars.put("awayTeam", matchup.awayTeam());
        vars.put("gameTime", matchup.gameTime() != null ? matchup.gameTime().toString() : "TBD");
        vars.put("stage", stage.wireName());
        vars.put("previousOutputs", previousOutputs(context));

        switch (stage) {
            case REFERENCE_CLASS -> { }
            case BASE_RATE -> {
                vars.put("teamForProbability", matchup.homeTeam());
                vars.put("referenceClasses", referenceClasses(context));
            }
            case STRUCTURAL_DECOMPOSITION -> {
                vars.put("baseRate", baseRate(context));
                vars.put("referenceClasses", referenceClasses(context));
            }
            case EVIDENCE_GATHERING -> {
                vars.put("baseRate", baseRate(context));
                vars.put("searchQueries", List.of(
                        matchup.homeTeam() + " " + matchup.awayTeam() + " injury report",
                        matchup.homeTeam() + " " + matchup.awayTeam() + " preview"));
            }
            case BAYESIAN_UPDATE -> {
                vars.put("prior", baseRate(context));
                vars.put("evidence", context.evidence());
            }
            case ADVERSARIAL_REVIEW -> {
                vars.put("currentProbability", posterior(context));
                vars.put("reasoningSoFar", reasoningSoFar(context));
                vars.put("evidenceUsed", context.evidence());
            }
            case SYNTHESIS -> {
                vars.put("baseRate", baseRate(context));
                vars.put("posteriorProbability", posterior(context));
                vars.put("concerns", context.concerns());
                vars.put("biasFlags", context.biasFlags());
                vars.put("allEvidence", context.evidence());
                vars.put("subQuestions", context.subQuestions());
                vars.put("structuralEstimate", context.structuralEstimate());
                vars.put("reconciliation", context.reconciliation());
                if (calibration != null) {
                    vars.put("calibrationAnchor", calibration.anchor(posterior(context)).message());
                }
            }
            case CALIBRATION -> vars.put("predictedProbability", context.bestEstimate());
        }
        return vars;
    }

    private static Map<String, Object> previousOutputs(ForecastContext context) {
        var outputs = new LinkedHashMap<String, Object>();
        context.previousOutputs().forEach((stage, list) -> outputs.put(stage.wireName(), list));
        return outputs;
    }

    private static Object referenceClasses(ForecastContext context) {
        if (!context.referenceClasses().isEmpty()) {
            return context.referenceClasses();
        }
        Object raw = firstField(context, ForecastStage.REFERENCE_CLASS, "matches");
        return raw != null ? raw : List.of();
    }

    private static double baseRate(ForecastContext context) {
        if (context.baseRate() != null) {
            return context.baseRate();
        }
        Object raw = firstField(context, ForecastStage.BASE_RATE, "probability");
        return raw instanceof Number n ? n.doubleValue() : DEFAULT_PROBABILITY;
    }

    private static double posterior(ForecastContext context) {
        return context.posteriorProbability() != null ? context.posteriorProbability() : baseRate(context);
    }

    static String reasoningSoFar(ForecastContext context) {
        List<String> lines = new ArrayList<>();
        Object baseReasoning = firstField(context, ForecastStage.BASE_RATE, "reasoning");
        if (baseReasoning instanceof String s && !s.isBlank()) {
            lines.add("Base rate: " + s);
        }
        for (BayesianUpdate update : context.bayesianUpdates()) {
            lines.add(String.format("Update (LR %.2f): %.3f -> %.3f. %s",
                    update.likelihoodRatio(), update.prior(), update.posterior(),
                    update.evidenceDescription() != null ? update.evidenceDescription() : ""));
        }
        return lines.isEmpty() ? NO_REASONING : String.join("\n", lines).trim();
    }

    private static Object firstField(ForecastContext context, ForecastStage stage, String field) {
        List<AgentContribution> contributions = context.contributions(stage);
        return contributions.isEmpty() ? null : contributions.get(0).output().get(field);
    }
}
