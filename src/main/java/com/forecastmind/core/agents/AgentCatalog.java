package com.forecastmind.core.agents;

import com.forecastmind.core.agents.AgentCard.Capabilities;
import com.forecastmind.core.agents.AgentCard.CoherenceProfile;
import com.forecastmind.core.agents.AgentCard.Constraints;
import com.forecastmind.core.model.ForecastStage;
import com.forecastmind.core.prompt.PromptTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The built-in agents and their prompt templates.
 */
public final class AgentCatalog {

    private AgentCatalog() {}

    public static final List<AgentCard> DEFAULT_AGENTS = List.of(
            card("reference-class-historical", "Historical Matchup Finder",
                    "Finds historical games similar to this matchup by ranking, conference, venue and rivalry status.",
                    ForecastStage.REFERENCE_CLASS,
                    List.of("web_search", "database_query", "semantic_search"),
                    List.of("game_context"), List.of("reference_class_list"),
                    "historical", FrequencyTier.WORKER, 2000, 60_000, "10/minute"),
            card("base-rate-calculator", "Base Rate Calculator",
                    "Turns reference classes into a historical win probability.",
                    ForecastStage.BASE_RATE,
                    List.of("web_search", "statistical_analysis", "probability_estimation"),
                    List.of("reference_class_list"), List.of("base_rate"),
                    "statistical", FrequencyTier.WORKER, 1500, 60_000, "15/minute"),
            card("structural-decomposer", "Structural Decomposer",
                    "Breaks the prediction into independent sub-questions for a Fermi-style structural estimate.",
                    ForecastStage.STRUCTURAL_DECOMPOSITION,
                    List.of("decomposition", "probability_estimation", "structural_analysis"),
                    List.of("game_context", "base_rate"), List.of("sub_questions", "structural_estimate"),
                    "analytical", FrequencyTier.WORKER, 2000, 60_000, "10/minute"),
            card("evidence-web-search", "Web Search Evidence Gatherer",
                    "Searches recent news and analysis that could affect the outcome.",
                    ForecastStage.EVIDENCE_GATHERING,
                    List.of("web_search", "summarize", "extract_entities"),
                    List.of("game_context", "search_queries"), List.of("evidence_list"),
                    "news", FrequencyTier.WORKER, 2000, 90_000, "5/minute"),
            card("evidence-injury-analyzer", "Injury Report Analyzer",
                    "Analyzes injury reports and player availability.",
                    ForecastStage.EVIDENCE_GATHERING,
                    List.of("web_search", "data_extraction", "impact_assessment"),
                    List.of("game_context", "injury_data"), List.of("evidence_list"),
                    "injury", FrequencyTier.WORKER, 1500, 90_000, "10/minute"),
            card("contrarian-evidence-searcher", "Contrarian Evidence Searcher",
                    "Looks for disconfirming evidence and reasons the underdog could win.",
                    ForecastStage.EVIDENCE_GATHERING,
                    List.of("web_search", "contrarian_analysis", "weakness_identification"),
                    List.of("game_context", "base_rate"), List.of("evidence_list"),
                    "critical", FrequencyTier.WORKER, 2000, 90_000, "5/minute"),
            card("bayesian-updater", "Bayesian Probability Updater",
                    "Updates the prior with bounded likelihood ratios derived from the gathered evidence.",
                    ForecastStage.BAYESIAN_UPDATE,
                    List.of("likelihood_estimation", "probability_update"),
                    List.of("prior_probability", "evidence_list"), List.of("posterior_probability", "update_chain"),
                    "analytical", FrequencyTier.WORKER, 2500, 60_000, "10/minute"),
            card("devils-advocate", "Devil's Advocate",
                    "Challenges the current estimate with overlooked factors and alternative scenarios.",
                    ForecastStage.ADVERSARIAL_REVIEW,
                    List.of("adversarial_reasoning", "weakness_identification", "scenario_generation"),
                    List.of("probability_estimate", "reasoning_chain"), List.of("concerns", "alternative_scenarios"),
                    "critical", FrequencyTier.WORKER, 2000, 60_000, "10/minute"),
            card("bias-detector", "Cognitive Bias Detector",
                    "Identifies recency, confirmation and anchoring biases in the reasoning so far.",
                    ForecastStage.ADVERSARIAL_REVIEW,
                    List.of("bias_detection", "debiasing_suggestions"),
                    List.of("reasoning_chain", "evidence_list"), List.of("bias_list", "adjustment_recommendations"),
                    "analytical", FrequencyTier.WORKER, 2000, 60_000, "10/minute"),
            card("synthesis-coordinator", "Synthesis Coordinator",
                    "Integrates every prior stage into a final probability with a confidence interval.",
                    ForecastStage.SYNTHESIS,
                    List.of("multi_perspective_integration", "final_estimation", "recommendation_generation"),
                    List.of("all_stage_outputs"), List.of("final_probability", "confidence_interval", "recommendation"),
                    "synthesis", FrequencyTier.COORDINATOR, 4000, 90_000, "5/minute")
    );

    private static final String JSON_ONLY = "Respond with a single JSON object and nothing else.";

    public static final Map<String, PromptTemplate> PROMPT_TEMPLATES = Map.of(
            "reference-class-historical", new PromptTemplate("reference_class_default",
                    """
                    You are a sports historian building reference classes for probability forecasting.
                    Find historical games that resemble the matchup below and report how often the home side won.
                    Output JSON: {"matches": [{"description": string, "historicalSampleSize": number,
                    "relevanceScore": 0-1, "category": string, "winRate": 0-1}], "confidence": 0-1}
                    """ + JSON_ONLY,
                    """
                    Matchup: {{ awayTeam }} @ {{ homeTeam }}
                    Kickoff: {{ gameTime }}
                    List three to five reference classes, most relevant first.
                    """,
                    List.of("homeTeam", "awayTeam")),
            "base-rate-calculator", new PromptTemplate("base_rate_default",
                    """
                    You are a statistician converting reference classes into a base rate.
                    Weight each class by relevance and sample size.
                    Output JSON: {"probability": 0-1, "confidenceInterval": [low, high], "sampleSize": number,
                    "reasoning": string, "confidence": 0-1}
                    """ + JSON_ONLY,
                    """
                    Estimate the probability that {{ teamForProbability }} wins against {{ awayTeam }}.
                    Reference classes:
                    {{ referenceClasses | json }}
                    """,
                    List.of("teamForProbability", "referenceClasses")),
            "structural-decomposer", new PromptTemplate("structural_decomposition_default",
                    """
                    You break forecasting questions into independent sub-questions and multiply them back together.
                    Output JSON: {"subQuestions": [{"question": string, "probability": 0-1, "confidence": 0-1,
                    "reasoning": string}], "structuralEstimate": 0-1, "reconciliation": string, "confidence": 0-1}
                    """ + JSON_ONLY,
                    """
                    Question: will {{ homeTeam }} beat {{ awayTeam }}?
                    Current base rate: {{ baseRate | round(2) }}
                    Reference classes:
                    {{ referenceClasses | json }}
                    Explain how your structural estimate compares with the base rate.
                    """,
                    List.of("homeTeam", "awayTeam", "baseRate")),
            "bayesian-updater", new PromptTemplate("bayesian_update_default",
                    """
                    You apply Bayesian updating. For each evidence item, state a likelihood ratio between 0.5 and 2.0
                    and the resulting posterior. Never let one item more than double or halve the odds.
                    Output JSON: {"updates": [{"evidenceDescription": string, "likelihoodRatio": number,
                    "prior": 0-1, "posterior": 0-1, "reasoning": string}], "posterior": 0-1, "confidence": 0-1}
                    """ + JSON_ONLY,
                    """
                    Prior probability that {{ homeTeam }} wins: {{ prior | round(3) }}
                    Evidence:
                    {{ evidence | json }}
                    """,
                    List.of("prior")),
            "devils-advocate", new PromptTemplate("adversarial_review_default",
                    """
                    You are a devil's advocate running a premortem: assume the forecast turned out wrong and explain why.
                    Output JSON: {"concerns": [string], "biases": [string], "confidenceAdjustment": number,
                    "confidence": 0-1}
                    """ + JSON_ONLY,
                    """
                    Current estimate for {{ homeTeam }} over {{ awayTeam }}: {{ currentProbability | round(3) }}
                    Reasoning so far:
                    {{ reasoningSoFar | default('No prior reasoning available.') }}
                    Evidence used:
                    {{ evidenceUsed | json }}
                    """,
                    List.of("currentProbability")),
            "bias-detector", new PromptTemplate("bias_detection_default",
                    """
                    You audit forecasts for cognitive biases such as recency, confirmation, anchoring and home-team bias.
                    Output JSON: {"concerns": [string], "biases": [string], "confidenceAdjustment": number,
                    "confidence": 0-1}
                    """ + JSON_ONLY,
                    """
                    Estimate under review: {{ currentProbability | round(3) }}
                    Reasoning:
                    {{ reasoningSoFar | default('No prior reasoning available.') }}
                    """,
                    List.of("currentProbability")),
            "synthesis-coordinator", new PromptTemplate("synthesis_default",
                    """
                    You are a superforecaster integrating a multi-stage analysis into one calibrated probability.
                    Reconcile the base rate, the structural estimate and the Bayesian posterior, then apply the
                    premortem concerns. Output JSON: {"finalProbability": 0-1, "confidenceInterval": [low, high],
                    "recommendation": "home"|"away"|"neutral", "keyDrivers": [string], "confidence": 0-1}
                    """ + JSON_ONLY,
                    """
                    Matchup: {{ awayTeam }} @ {{ homeTeam }}
                    Base rate: {{ baseRate | round(3) }}
                    Structural estimate: {{ structuralEstimate | round(3) | default('n/a') }}
                    Reconciliation: {{ reconciliation | default('n/a') }}
                    Posterior: {{ posteriorProbability | round(3) }}
                    Concerns: {{ concerns | join('; ') | default('none') }}
                    Bias flags: {{ biasFlags | join('; ') | default('none') }}
                    Calibration note: {{ calibrationAnchor | default('none') }}
                    Evidence:
                    {{ allEvidence | json }}
                    """,
                    List.of("baseRate", "posteriorProbability"))
    );

    public static Optional<PromptTemplate> promptTemplate(String agentId) {
        return Optional.ofNullable(PROMPT_TEMPLATES.get(agentId));
    }

    private static AgentCard card(String id, String name, String description, ForecastStage stage,
                                  List<String> actions, List<String> inputTypes, List<String> outputTypes,
                                  String domain, FrequencyTier tier, int maxTokensInput,
                                  long timeoutMs, String rateLimit) {
        return new AgentCard(id, name, "1.0.0", description,
                new Capabilities(Set.of(stage), actions, inputTypes, outputTypes),
                new CoherenceProfile(domain, tier),
                new Constraints(maxTokensInput, 8000, timeoutMs, rateLimit));
    }
}
