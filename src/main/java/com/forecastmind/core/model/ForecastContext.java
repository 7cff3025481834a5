package com.forecastmind.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The accumulating record of one forecast.
 * <p>
 * Exactly one context exists per forecast id. List accumulators only grow; the scalar
 * "latest value" fields (base rate, posterior, final probability) are overwritten by the
 * stage that owns them. Mutators are called by {@code ForecastContextManager} only; the
 * orchestrator thread driving the forecast is the single writer while other threads read.
 */
public class ForecastContext {

    private final String forecastId;
    private final Matchup matchup;
    private final Instant createdAt;

    private volatile ForecastStage currentStage = ForecastStage.REFERENCE_CLASS;
    private volatile Instant updatedAt;

    private final List<ReferenceClassMatch> referenceClasses = new CopyOnWriteArrayList<>();

    private volatile Double baseRate;
    private volatile ConfidenceInterval baseRateConfidence;
    private volatile int sampleSize;

    private final List<SubQuestion> subQuestions = new CopyOnWriteArrayList<>();
    private volatile Double structuralEstimate;
    private volatile String reconciliation;

    private final List<EvidenceItem> evidence = new CopyOnWriteArrayList<>();
    private volatile String evidenceSummary;

    private final List<BayesianUpdate> bayesianUpdates = new CopyOnWriteArrayList<>();
    private volatile Double posteriorProbability;

    private final List<String> concerns = new CopyOnWriteArrayList<>();
    private final List<String> biasFlags = new CopyOnWriteArrayList<>();
    private volatile Double confidenceAdjustment;

    private volatile Double finalProbability;
    private volatile ConfidenceInterval finalConfidenceInterval;
    private volatile String recommendation;
    private final List<String> keyDrivers = new CopyOnWriteArrayList<>();

    private final Map<ForecastStage, List<AgentContribution>> contributions = new ConcurrentHashMap<>();
    private final Map<ForecastStage, Long> processingTimes = new ConcurrentHashMap<>();

    public ForecastContext(String forecastId, Matchup matchup) {
        this.forecastId = forecastId;
        this.matchup = matchup;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    // ── identity ─────────────────────────────────────────────────────

    public String forecastId() {
        return forecastId;
    }

    public Matchup matchup() {
        return matchup;
    }

    public String gameId() {
        return matchup.gameId();
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public ForecastStage currentStage() {
        return currentStage;
    }

    // ── accumulators ─────────────────────────────────────────────────

    public List<ReferenceClassMatch> referenceClasses() {
        return List.copyOf(referenceClasses);
    }

    public Double baseRate() {
        return baseRate;
    }

    public ConfidenceInterval baseRateConfidence() {
        return baseRateConfidence;
    }

    public int sampleSize() {
        return sampleSize;
    }

    public List<SubQuestion> subQuestions() {
        return List.copyOf(subQuestions);
    }

    public Double structuralEstimate() {
        return structuralEstimate;
    }

    public String reconciliation() {
        return reconciliation;
    }

    public List<EvidenceItem> evidence() {
        return List.copyOf(evidence);
    }

    public String evidenceSummary() {
        return evidenceSummary;
    }

    public List<BayesianUpdate> bayesianUpdates() {
        return List.copyOf(bayesianUpdates);
    }

    public Double posteriorProbability() {
        return posteriorProbability;
    }

    public List<String> concerns() {
        return List.copyOf(concerns);
    }

    public List<String> biasFlags() {
        return List.copyOf(biasFlags);
    }

    public Double confidenceAdjustment() {
        return confidenceAdjustment;
    }

    public Double finalProbability() {
        return finalProbability;
    }

    public ConfidenceInterval finalConfidenceInterval() {
        return finalConfidenceInterval;
    }

    public String recommendation() {
        return recommendation;
    }

    public List<String> keyDrivers() {
        return List.copyOf(keyDrivers);
    }

    public List<AgentContribution> contributions(ForecastStage stage) {
        List<AgentContribution> list = contributions.get(stage);
        return list != null ? List.copyOf(list) : List.of();
    }

    /** Contributions of every stage that has any, in pipeline order. */
    public Map<ForecastStage, List<AgentContribution>> allContributions() {
        var result = new LinkedHashMap<ForecastStage, List<AgentContribution>>();
        for (ForecastStage stage : ForecastStage.ordered()) {
            List<AgentContribution> list = contributions.get(stage);
            if (list != null && !list.isEmpty()) {
                result.put(stage, List.copyOf(list));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    public Map<ForecastStage, Long> processingTimes() {
        return Map.copyOf(processingTimes);
    }

    /** Best available point estimate: final, then posterior, then base rate, then 0.5. */
    public double bestEstimate() {
        if (finalProbability != null) return finalProbability;
        if (posteriorProbability != null) return posteriorProbability;
        if (baseRate != null) return baseRate;
        return 0.5;
    }

    // ── mutators ─────────────────────────────────────────────────────

    public void setCurrentStage(ForecastStage stage) {
        this.currentStage = stage;
        touch();
    }

    public void addReferenceClasses(List<ReferenceClassMatch> matches) {
        addAllNonNull(referenceClasses, matches);
        touch();
    }

    public void setBaseRate(double value, ConfidenceInterval interval, int sampleSize) {
        this.baseRate = value;
        this.baseRateConfidence = interval;
        this.sampleSize = sampleSize;
        touch();
    }

    public void setDecomposition(List<SubQuestion> questions, Double estimate, String reconciliation) {
        addAllNonNull(subQuestions, questions);
        this.structuralEstimate = estimate;
        this.reconciliation = reconciliation;
        touch();
    }

    public void addEvidence(List<EvidenceItem> items, String summary) {
        addAllNonNull(evidence, items);
        if (summary != null && !summary.isBlank()) {
            this.evidenceSummary = summary;
        }
        touch();
    }

    public void addBayesianUpdate(BayesianUpdate update) {
        bayesianUpdates.add(update);
        this.posteriorProbability = update.posterior();
        touch();
    }

    public void addAdversarialReview(List<String> newConcerns, List<String> newBiases, Double adjustment) {
        addAllNonNull(concerns, newConcerns);
        addAllNonNull(biasFlags, newBiases);
        if (adjustment != null) {
            this.confidenceAdjustment = adjustment;
        }
        touch();
    }

    public void finalizeForecast(double probability, ConfidenceInterval interval,
                                 String recommendation, List<String> drivers) {
        this.finalProbability = probability;
        this.finalConfidenceInterval = interval;
        this.recommendation = recommendation;
        keyDrivers.clear();
        addAllNonNull(keyDrivers, drivers);
        touch();
    }

    public void addContribution(ForecastStage stage, AgentContribution contribution) {
        contributions.computeIfAbsent(stage, k -> new CopyOnWriteArrayList<>()).add(contribution);
        touch();
    }

    public void recordProcessingTime(ForecastStage stage, long elapsedMs) {
        processingTimes.put(stage, elapsedMs);
        touch();
    }

    /** Raw outputs per stage, in pipeline order, for prompt building and keyword scoring. */
    public Map<ForecastStage, List<Map<String, Object>>> previousOutputs() {
        var outputs = new LinkedHashMap<ForecastStage, List<Map<String, Object>>>();
        allContributions().forEach((stage, list) -> {
            var raw = new ArrayList<Map<String, Object>>(list.size());
            for (AgentContribution c : list) {
                raw.add(c.output());
            }
            outputs.put(stage, raw);
        });
        return outputs;
    }

    // List.copyOf in the getters rejects null elements
    private static <T> void addAllNonNull(List<T> target, List<? extends T> source) {
        if (source == null) {
            return;
        }
        for (T item : source) {
            if (item != null) {
                target.add(item);
            }
        }
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }
}
