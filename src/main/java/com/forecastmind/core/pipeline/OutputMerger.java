package com.forecastmind.core.pipeline;

import com.forecastmind.core.model.AgentContribution;
import com.forecastmind.core.model.ForecastStage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines several agents' outputs for one stage into a single stage output.
 * <p>
 * A single contribution passes through unchanged. With several, the rule depends on the
 * stage family: evidence is concatenated, adversarial findings are concatenated, numeric
 * stages take a confidence-weighted average, and everything else keeps the most confident
 * output whole.
 */
@Component
public class OutputMerger {

    static final Set<ForecastStage> NUMERIC_STAGES =
            EnumSet.of(ForecastStage.BASE_RATE, ForecastStage.BAYESIAN_UPDATE);

    public Map<String, Object> merge(ForecastStage stage, List<AgentContribution> contributions) {
        if (contributions.isEmpty()) {
            return Map.of();
        }
        if (contributions.size() == 1) {
            return contributions.get(0).output();
        }
        if (stage == ForecastStage.EVIDENCE_GATHERING) {
            return mergeEvidence(contributions);
        }
        if (stage == ForecastStage.ADVERSARIAL_REVIEW) {
            return mergeAdversarial(contributions);
        }
        if (NUMERIC_STAGES.contains(stage)) {
            return mergeNumeric(contributions);
        }
        return mostConfident(contributions).output();
    }

    Map<String, Object> mergeEvidence(List<AgentContribution> contributions) {
        var items = new ArrayList<Object>();
        Set<String> sources = new LinkedHashSet<>();
        String summary = null;
        for (AgentContribution contribution : contributions) {
            Map<String, Object> output = contribution.output();
            items.addAll(listOf(output.get("evidenceItems")));
            for (Object source : listOf(output.get("sources"))) {
                if (source != null) {
                    sources.add(source.toString());
                }
            }
            sources.addAll(contribution.sources());
            if (summary == null && output.get("summary") instanceof String s && !s.isBlank()) {
                summary = s;
            }
        }
        var merged = new LinkedHashMap<String, Object>();
        merged.put("evidenceItems", items);
        merged.put("sources", new ArrayList<>(sources));
        merged.put("summary", summary);
        return merged;
    }

    Map<String, Object> mergeAdversarial(List<AgentContribution> contributions) {
        var concerns = new ArrayList<Object>();
        var biases = new ArrayList<Object>();
        Object adjustment = null;
        for (AgentContribution contribution : contributions) {
            Map<String, Object> output = contribution.output();
            concerns.addAll(listOf(output.get("concerns")));
            biases.addAll(listOf(output.get("biases")));
            if (adjustment == null) {
                adjustment = output.get("confidenceAdjustment");
            }
        }
        var merged = new LinkedHashMap<String, Object>();
        merged.put("concerns", concerns);
        merged.put("biases", biases);
        if (adjustment != null) {
            merged.put("confidenceAdjustment", adjustment);
        }
        return merged;
    }

    /**
     * Starts from the first output and replaces every numeric field present in all outputs
     * with {@code sum(v_i * c_i) / sum(c_i)}. Zero total confidence means equal weights.
     */
    Map<String, Object> mergeNumeric(List<AgentContribution> contributions) {
        double totalConfidence = contributions.stream().mapToDouble(AgentContribution::confidence).sum();
        int n = contributions.size();

        var merged = new LinkedHashMap<>(contributions.get(0).output());
        for (Map.Entry<String, Object> entry : contributions.get(0).output().entrySet()) {
            String key = entry.getKey();
            if (!(entry.getValue() instanceof Number)) {
                continue;
            }
            double weighted = 0.0;
            boolean sharedByAll = true;
            for (AgentContribution contribution : contributions) {
                if (!(contribution.output().get(key) instanceof Number value)) {
                    sharedByAll = false;
                    break;
                }
                double weight = totalConfidence > 0 ? contribution.confidence() / totalConfidence : 1.0 / n;
                weighted += value.doubleValue() * weight;
            }
            if (sharedByAll) {
                merged.put(key, weighted);
            }
        }
        return merged;
    }

    /** Highest confidence wins; ties go to the earlier contribution. */
    static AgentContribution mostConfident(List<AgentContribution> contributions) {
        AgentContribution best = contributions.get(0);
        for (AgentContribution contribution : contributions) {
            if (contribution.confidence() > best.confidence()) {
                best = contribution;
            }
        }
        return best;
    }

    private static List<?> listOf(Object value) {
        return value instanceof List<?> list ? list : List.of();
    }
}
