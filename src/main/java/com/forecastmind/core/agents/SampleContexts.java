package com.forecastmind.core.agents;

import com.forecastmind.core.model.BayesianUpdate;
import com.forecastmind.core.model.ConfidenceInterval;
import com.forecastmind.core.model.EvidenceItem;
import com.forecastmind.core.model.ForecastContext;
import com.forecastmind.core.model.ForecastStage;
import com.forecastmind.core.model.Matchup;
import com.forecastmind.core.model.ReferenceClassMatch;
import com.forecastmind.core.model.SubQuestion;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Builds a context for trying a single agent outside a pipeline run.
 * <p>
 * The context carries plausible outputs of every stage that runs before the requested one,
 * so an agent sees the same variables it would mid-pipeline.
 */
public final class SampleContexts {

    public static final String SAMPLE_FORECAST_ID = "agent-test";
    public static final String DEFAULT_HOME_TEAM = "Georgia Bulldogs";
    public static final String DEFAULT_AWAY_TEAM = "Alabama Crimson Tide";

    private SampleContexts() {}

    /**
     * @param homeTeam nullable, defaults to {@link #DEFAULT_HOME_TEAM}
     * @param awayTeam nullable, defaults to {@link #DEFAULT_AWAY_TEAM}
     */
    public static ForecastContext forStage(ForecastStage stage, String homeTeam, String awayTeam) {
        Matchup matchup = new Matchup("sample-game",
                blankToDefault(homeTeam, DEFAULT_HOME_TEAM),
                blankToDefault(awayTeam, DEFAULT_AWAY_TEAM),
                Instant.now().plus(7, ChronoUnit.DAYS).truncatedTo(ChronoUnit.SECONDS));
        ForecastContext context = new ForecastContext(SAMPLE_FORECAST_ID, matchup);
        context.setCurrentStage(stage);

        if (after(stage, ForecastStage.REFERENCE_CLASS)) {
            context.addReferenceClasses(List.of(
                    new ReferenceClassMatch("Home favorites in conference rivalry games", 48, 0.85,
                            "rivalry", 0.58),
                    new ReferenceClassMatch("Top-10 matchups with a rest advantage", 17, 0.6,
                            "rest", 0.53)));
        }
        if (after(stage, ForecastStage.BASE_RATE)) {
            context.setBaseRate(0.55, new ConfidenceInterval(0.42, 0.68), 65);
        }
        if (after(stage, ForecastStage.STRUCTURAL_DECOMPOSITION)) {
            context.setDecomposition(List.of(
                    new SubQuestion("Does the home offense outscore the visiting defense?", 0.57, 0.6,
                            "Home offense ranks higher in yards per play"),
                    new SubQuestion("Does the home team win the turnover battle?", 0.52, 0.4,
                            "Turnover margins are close")),
                    0.56, "Decomposition agrees with the base rate within two points");
        }
        if (after(stage, ForecastStage.EVIDENCE_GATHERING)) {
            context.addEvidence(List.of(
                    new EvidenceItem("Home starting quarterback cleared after a minor ankle injury",
                            "home", "medium", "injury report"),
                    new EvidenceItem("Visiting team lost two defensive starters to suspension",
                            "home", "high", "team announcement"),
                    new EvidenceItem("Rain forecast at kickoff", "neutral", "low", "weather service")),
                    "Recent news mildly favors the home side");
        }
        if (after(stage, ForecastStage.BAYESIAN_UPDATE)) {
            context.addBayesianUpdate(new BayesianUpdate("Defensive suspensions", 1.13, 0.55, 0.58,
                    "Depth at linebacker is thin"));
        }
        if (after(stage, ForecastStage.ADVERSARIAL_REVIEW)) {
            context.addAdversarialReview(
                    List.of("Small sample for the rest-advantage reference class",
                            "Suspension news may already be priced in"),
                    List.of("Recency bias"), -0.02);
        }
        if (after(stage, ForecastStage.SYNTHESIS)) {
            context.finalizeForecast(0.56, new ConfidenceInterval(0.45, 0.67), "home",
                    List.of("Home field", "Visiting defensive depth"));
        }
        return context;
    }

    private static boolean after(ForecastStage requested, ForecastStage earlier) {
        return requested.position() > earlier.position();
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
