package com.forecastmind.core.pipeline;

import com.forecastmind.core.agents.LikelihoodRatioClamp;
import com.forecastmind.core.metrics.ForecastMetrics;
import com.forecastmind.core.model.AgentContribution;
import com.forecastmind.core.model.BayesianUpdate;
import com.forecastmind.core.model.ConfidenceInterval;
import com.forecastmind.core.model.ForecastContext;
import com.forecastmind.core.model.ForecastStage;
import com.forecastmind.core.model.Matchup;
import com.forecastmind.core.model.output.AdversarialReviewOutput;
import com.forecastmind.core.model.output.BaseRateOutput;
import com.forecastmind.core.model.output.BayesianUpdateOutput;
import com.forecastmind.core.model.output.DecompositionOutput;
import com.forecastmind.core.model.output.EvidenceOutput;
import com.forecastmind.core.model.output.ReferenceClassOutput;
import com.forecastmind.core.model.output.StageOutputReader;
import com.forecastmind.core.model.output.SynthesisOutput;
import com.forecastmind.core.store.ContextStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The single write path into forecast contexts.
 * <p>
 * Every mutation loads the context from the {@link ContextStore}, applies it, and saves it
 * back, so a durable store only has to implement the store contract. Stage outputs are read
 * through their canonical schema before they touch the context.
 */
@Service
public class ForecastContextManager {

    private static final Logger log = LoggerFactory.getLogger(ForecastContextManager.class);

    static final double DEFAULT_INTERVAL_HALF_WIDTH = 0.1;
    static final double DEFAULT_PRIOR = 0.5;
    static final String DEFAULT_RECOMMENDATION = "neutral";

    private final ContextStore store;
    private final StageOutputReader reader;
    private final LikelihoodRatioClamp clamp;
    private final ForecastMetrics metrics;

    @Autowired
    public ForecastContextManager(ContextStore store, StageOutputReader reader,
                                  LikelihoodRatioClamp clamp, ForecastMetrics metrics) {
        this.store = store;
        this.reader = reader;
        this.clamp = clamp;
        this.metrics = metrics;
    }

    ForecastContextManager(ContextStore store) {
        this(store, new StageOutputReader(), new LikelihoodRatioClamp(), null);
    }

    public ForecastContext createContext(String forecastId, Matchup matchup) {
        var context = new ForecastContext(forecastId, matchup);
        store.saveContext(context);
        return context;
    }

    public Optional<ForecastContext> getContext(String forecastId) {
        return store.getContext(forecastId);
    }

    public ForecastContext requireContext(String forecastId) {
        return store.getContext(forecastId)
                .orElseThrow(() -> new PipelineFailureException("Context not found: " + forecastId));
    }

    public void setCurrentStage(String forecastId, ForecastStage stage) {
        ForecastContext context = requireContext(forecastId);
        context.setCurrentStage(stage);
        store.saveContext(context);
    }

    public void recordContributions(String forecastId, ForecastStage stage, List<AgentContribution> contributions) {
        ForecastContext context = requireContext(forecastId);
        for (AgentContribution contribution : contributions) {
            context.addContribution(stage, contribution);
        }
        store.saveContext(context);
    }

    public void recordProcessingTime(String forecastId, ForecastStage stage, long elapsedMs) {
        ForecastContext context = requireContext(forecastId);
        context.recordProcessingTime(stage, elapsedMs);
        store.saveContext(context);
    }

    /**
     * Maps a merged stage output onto the context fields that stage owns.
     *
     * @throws IllegalArgumentException if the output does not fit the stage's schema
     */
    public void applyStageOutput(String forecastId, ForecastStage stage, Map<String, Object> output) {
        ForecastContext context = requireContext(forecastId);
        switch (stage) {
            case REFERENCE_CLASS -> applyReferenceClass(context, reader.read(output, ReferenceClassOutput.class));
            case BASE_RATE -> applyBaseRate(context, reader.read(output, BaseRateOutput.class));
            case STRUCTURAL_DECOMPOSITION -> applyDecomposition(context, reader.read(output, DecompositionOutput.class));
            case EVIDENCE_GATHERING -> applyEvidence(context, reader.read(output, EvidenceOutput.class));
            case BAYESIAN_UPDATE -> applyBayesianUpdate(context, reader.read(output, BayesianUpdateOutput.class));
            case ADVERSARIAL_REVIEW -> applyAdversarialReview(context, reader.read(output, AdversarialReviewOutput.class));
            case SYNTHESIS -> applySynthesis(context, reader.read(output, SynthesisOutput.class));
            case CALIBRATION -> log.debug("Calibration output is logged, not applied to the context");
        }
        store.saveContext(context);
    }

    private void applyReferenceClass(ForecastContext context, ReferenceClassOutput output) {
        context.addReferenceClasses(output.matches());
        log.debug("Added {} reference class(es)", output.matches().size());
    }

    private void applyBaseRate(ForecastContext context, BaseRateOutput output) {
        if (output.probability() == null) {
            log.warn("Base rate output has no probability; context unchanged");
            return;
        }
        double p = output.probability();
        context.setBaseRate(p,
                ConfidenceInterval.fromListOrAround(output.confidenceInterval(), p, DEFAULT_INTERVAL_HALF_WIDTH),
                output.sampleSize() != null ? output.sampleSize() : 0);
        log.info("Base rate set to {}", p);
    }

    private void applyDecomposition(ForecastContext context, DecompositionOutput output) {
        context.setDecomposition(output.subQuestions(), output.structuralEstimate(), output.reconciliation());
    }

    private void applyEvidence(ForecastContext context, EvidenceOutput output) {
        context.addEvidence(output.evidenceItems(), output.summary());
        log.debug("Added {} evidence item(s)", output.evidenceItems().size());
    }

    /**
     * Replays the update chain. Each likelihood ratio is clamped first; a step whose ratio
     * changed gets its posterior recomputed from its prior.
     */
    private void applyBayesianUpdate(ForecastContext context, BayesianUpdateOutput output) {
        double running = context.baseRate() != null ? context.baseRate() : DEFAULT_PRIOR;
        List<BayesianUpdateOutput.Step> steps = output.steps();
        if (steps.isEmpty() && output.posterior() != null) {
            steps = List.of(new BayesianUpdateOutput.Step(output.evidenceDescription(), null,
                    output.prior(), output.posterior(), output.reasoning()));
        }
        if (steps.isEmpty()) {
            log.warn("Bayesian update output has neither updates nor a posterior; context unchanged");
            return;
        }

        for (BayesianUpdateOutput.Step step : steps) {
            double prior = step.prior() != null ? step.prior() : running;
            Double ratio = step.likelihoodRatio() != null
                    ? step.likelihoodRatio()
                    : impliedRatio(prior, step.posterior());
            if (ratio == null) {
                log.warn("Skipping update '{}' with neither a likelihood ratio nor a posterior",
                        step.evidenceDescription());
                continue;
            }
            double clamped = clamp.clamp(ratio);
            boolean changed = clamped != ratio;
            if (changed && metrics != null) {
                metrics.incrementClampedLikelihoodRatios();
            }
            double posterior = changed || step.posterior() == null
                    ? LikelihoodRatioClamp.applyToProbability(prior, clamped)
                    : step.posterior();
            context.addBayesianUpdate(new BayesianUpdate(step.evidenceDescription(), clamped, prior,
                    posterior, step.reasoning()));
            running = posterior;
        }
        log.info("Posterior updated to {}", context.posteriorProbability());
    }

    static Double impliedRatio(double prior, Double posterior) {
        if (posterior == null) {
            return null;
        }
        if (prior <= 0 || prior >= 1 || posterior <= 0 || posterior >= 1) {
            return 1.0;
        }
        return (posterior / (1 - posterior)) / (prior / (1 - prior));
    }

    private void applyAdversarialReview(ForecastContext context, AdversarialReviewOutput output) {
        context.addAdversarialReview(output.concerns(), output.biases(), output.confidenceAdjustment());
    }

    private void applySynthesis(ForecastContext context, SynthesisOutput output) {
        if (output.finalProbability() == null) {
            log.warn("Synthesis output has no final probability; forecast left unfinalized");
            return;
        }
        double p = Math.max(0.0, Math.min(1.0, output.finalProbability()));
        String recommendation = output.recommendation() != null && !output.recommendation().isBlank()
                ? output.recommendation() : DEFAULT_RECOMMENDATION;
        context.finalizeForecast(p,
                ConfidenceInterval.fromListOrAround(output.confidenceInterval(), p, DEFAULT_INTERVAL_HALF_WIDTH),
                recommendation, output.keyDrivers());
        log.info("Final probability {} ({})", p, recommendation);
    }

    /**
     * Percent complete: the current stage's position, plus half a stage once it has
     * contributions, over the total number of stages.
     */
    public int getProgress(String forecastId) {
        return store.getContext(forecastId).map(ForecastContextManager::progressOf).orElse(0);
    }

    static int progressOf(ForecastContext context) {
        ForecastStage stage = context.currentStage();
        double index = stage.position();
        if (!context.contributions(stage).isEmpty()) {
            index += 0.5;
        }
        return (int) Math.round(index / ForecastStage.ordered().size() * 100);
    }
}
