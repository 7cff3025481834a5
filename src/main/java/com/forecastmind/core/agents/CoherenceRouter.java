package com.forecastmind.core.agents;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastmind.core.model.AgentContribution;
import com.forecastmind.core.model.ForecastContext;
import com.forecastmind.core.model.ForecastStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Ranks candidate agents for a stage when the stage config names none.
 * <p>
 * Scoring is a pure function of registry data and a read-only view of the context, so the
 * router holds no state and may be called concurrently.
 */
@Service
public class CoherenceRouter {

    private static final Logger log = LoggerFactory.getLogger(CoherenceRouter.class);

    static final int DOMAIN_AFFINITY_POINTS = 30;
    static final int TIER_MATCH_POINTS = 20;
    static final int POINTS_PER_KEYWORD = 10;
    static final int MAX_KEYWORD_MATCHES = 3;
    static final int SPECIALIST_POINTS = 10;
    static final int FOCUSED_POINTS = 5;
    static final int OUTPUT_CAPACITY_POINTS = 10;
    static final int OUTPUT_CAPACITY_THRESHOLD = 1500;

    static final Map<String, List<String>> DOMAIN_KEYWORDS = Map.of(
            "historical", List.of("history", "past", "record", "streak", "trend", "previous"),
            "statistical", List.of("stats", "numbers", "data", "percentage", "rate", "average"),
            "news", List.of("news", "report", "update", "latest", "recent", "announced"),
            "injury", List.of("injury", "health", "questionable", "out", "doubtful", "status"),
            "analytical", List.of("analysis", "evaluate", "assess", "calculate", "compute"),
            "critical", List.of("risk", "concern", "worry", "problem", "issue", "weakness"),
            "synthesis", List.of("combine", "integrate", "final", "overall", "conclusion")
    );

    static final Map<ForecastStage, List<String>> STAGE_DOMAIN_AFFINITY = new EnumMap<>(Map.of(
            ForecastStage.REFERENCE_CLASS, List.of("historical", "statistical"),
            ForecastStage.BASE_RATE, List.of("statistical", "historical"),
            ForecastStage.STRUCTURAL_DECOMPOSITION, List.of("analytical", "statistical"),
            ForecastStage.EVIDENCE_GATHERING, List.of("news", "injury", "analytical"),
            ForecastStage.BAYESIAN_UPDATE, List.of("analytical", "statistical"),
            ForecastStage.ADVERSARIAL_REVIEW, List.of("critical", "analytical"),
            ForecastStage.SYNTHESIS, List.of("synthesis", "analytical"),
            ForecastStage.CALIBRATION, List.of("statistical", "analytical")
    ));

    private static final Set<ForecastStage> DELIBERATE_STAGES =
            EnumSet.of(ForecastStage.BAYESIAN_UPDATE, ForecastStage.SYNTHESIS, ForecastStage.CALIBRATION);
    private static final Set<ForecastStage> REACTIVE_STAGES =
            EnumSet.of(ForecastStage.EVIDENCE_GATHERING, ForecastStage.REFERENCE_CLASS);
    private static final Set<ForecastStage> HIGH_OUTPUT_STAGES =
            EnumSet.of(ForecastStage.SYNTHESIS, ForecastStage.ADVERSARIAL_REVIEW);

    private final AgentRegistry registry;
    private final ObjectMapper mapper;

    @Autowired
    public CoherenceRouter(AgentRegistry registry, ObjectMapper mapper) {
        this.registry = registry;
        this.mapper = mapper;
    }

    public CoherenceRouter(AgentRegistry registry) {
        this(registry, new ObjectMapper());
    }

    /**
     * Picks up to {@code maxAgents} agents for {@code stage}. When no more candidates exist
     * than requested, all are returned unscored.
     */
    public List<String> selectAgents(ForecastStage stage, ForecastContext context, int maxAgents) {
        List<AgentCard> candidates = registry.getByStage(stage);
        if (candidates.isEmpty()) {
            log.warn("No agents available for stage {}", stage);
            return List.of();
        }
        if (candidates.size() <= maxAgents) {
            return candidates.stream().map(AgentCard::id).toList();
        }

        String contextText = contextText(context);
        List<CoherenceScore> scores = new ArrayList<>();
        for (AgentCard card : candidates) {
            scores.add(score(card, stage, contextText));
        }
        // List.sort is stable: equal scores keep registration order
        scores.sort(Comparator.comparingInt(CoherenceScore::score).reversed());

        List<String> selected = scores.stream().limit(maxAgents).map(CoherenceScore::agentId).toList();
        log.debug("Stage {} selection: {} from {}", stage, selected,
                scores.stream().map(s -> s.agentId() + "=" + s.score()).toList());
        return selected;
    }

    /** Scores every candidate for {@code stage}, in registration order, with reasons. */
    public List<CoherenceScore> explainSelection(ForecastStage stage, ForecastContext context) {
        String contextText = contextText(context);
        return registry.getByStage(stage).stream()
                .map(card -> score(card, stage, contextText))
                .toList();
    }

    CoherenceScore score(AgentCard card, ForecastStage stage, String contextText) {
        List<String> reasons = new ArrayList<>();
        int score = 0;
        String domain = card.coherenceProfile().semanticDomain();
        FrequencyTier tier = card.coherenceProfile().frequencyTier();

        if (STAGE_DOMAIN_AFFINITY.getOrDefault(stage, List.of()).contains(domain)) {
            score += DOMAIN_AFFINITY_POINTS;
            reasons.add("Domain match: " + domain);
        }

        if (DELIBERATE_STAGES.contains(stage) && tier == FrequencyTier.COORDINATOR) {
            score += TIER_MATCH_POINTS;
            reasons.add("Coordinator tier for deliberate stage");
        } else if (REACTIVE_STAGES.contains(stage) && tier == FrequencyTier.WORKER) {
            score += TIER_MATCH_POINTS;
            reasons.add("Worker tier for reactive stage");
        }

        List<String> matches = DOMAIN_KEYWORDS.getOrDefault(domain, List.of()).stream()
                .filter(contextText::contains)
                .toList();
        if (!matches.isEmpty()) {
            score += Math.min(matches.size(), MAX_KEYWORD_MATCHES) * POINTS_PER_KEYWORD;
            reasons.add("Keyword matches: " + String.join(", ", matches));
        }

        int breadth = card.capabilities().supportedStages().size();
        if (breadth == 1) {
            score += SPECIALIST_POINTS;
            reasons.add("Specialist agent");
        } else if (breadth == 2) {
            score += FOCUSED_POINTS;
            reasons.add("Focused agent");
        }

        if (HIGH_OUTPUT_STAGES.contains(stage)
                && card.constraints().maxTokensOutput() >= OUTPUT_CAPACITY_THRESHOLD) {
            score += OUTPUT_CAPACITY_POINTS;
            reasons.add("High output capacity");
        }

        return new CoherenceScore(card.id(), score, List.copyOf(reasons));
    }

    /** Lower-cased dump of the matchup and every prior contribution's output. */
    String contextText(ForecastContext context) {
        var parts = new StringBuilder();
        parts.append(context.matchup().homeTeam()).append(' ').append(context.matchup().awayTeam());
        for (List<AgentContribution> contributions : context.allContributions().values()) {
            for (AgentContribution contribution : contributions) {
                parts.append(' ').append(toJson(contribution.output()));
            }
        }
        return parts.toString().toLowerCase(Locale.ROOT);
    }

    private String toJson(Map<String, Object> output) {
        try {
            return mapper.writeValueAsString(output);
        } catch (JsonProcessingException e) {
            log.debug("Falling back to toString for contribution output: {}", e.getMessage());
            return String.valueOf(output);
        }
    }

    /**
     * @param agentId the scored agent
     * @param score   total coherence score
     * @param reasons human-readable reasons for each awarded component
     */
    public record CoherenceScore(String agentId, int score, List<String> reasons) {}
}
