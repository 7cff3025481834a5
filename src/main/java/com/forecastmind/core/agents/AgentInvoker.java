package com.forecastmind.core.agents;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastmind.core.llm.JsonResponseParser;
import com.forecastmind.core.llm.ReasoningProperties;
import com.forecastmind.core.llm.ReasoningService;
import com.forecastmind.core.llm.ReasoningService.JsonCompletion;
import com.forecastmind.core.llm.ReasoningService.ReasoningOptions;
import com.forecastmind.core.llm.ReasoningService.SearchCompletion;
import com.forecastmind.core.llm.UnparsableResponseException;
import com.forecastmind.core.logging.MdcContext;
import com.forecastmind.core.metrics.ForecastMetrics;
import com.forecastmind.core.model.AgentContribution;
import com.forecastmind.core.model.ForecastContext;
import com.forecastmind.core.model.ForecastStage;
import com.forecastmind.core.model.Matchup;
import com.forecastmind.core.prompt.PromptRenderer;
import com.forecastmind.core.prompt.PromptTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.function.Function;

/**
 * Runs a single agent against the reasoning model and turns its answer into an
 * {@link AgentContribution}.
 * <p>
 * {@link #invoke} never throws: unknown agents, unsupported stages, model errors and
 * unparsable output all come back as failed {@link InvocationResult}s so the stage can
 * decide what a partial failure means.
 */
@Service
public class AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(AgentInvoker.class);

    static final double DEFAULT_CONFIDENCE = 0.7;
    static final List<String> CONFIDENCE_FIELDS = List.of("confidence", "confidenceLevel", "certainty");

    private final AgentRegistry registry;
    private final ReasoningService reasoning;
    private final PromptRenderer renderer;
    private final StageVariables stageVariables;
    private final JsonResponseParser parser;
    private final ReasoningProperties properties;
    private final ForecastMetrics metrics;
    private final ObjectMapper mapper;
    private final ExecutorService executor;
    private final int maxParallelAgents;

    @Autowired
    public AgentInvoker(AgentRegistry registry, ReasoningService reasoning, PromptRenderer renderer,
                        StageVariables stageVariables, JsonResponseParser parser,
                        ReasoningProperties properties, ForecastMetrics metrics, ObjectMapper mapper,
                        @Qualifier("agentExecutor") ExecutorService executor,
                        @Value("${forecast.pipeline.max-parallel-agents:4}") int maxParallelAgents) {
        this.registry = registry;
        this.reasoning = reasoning;
        this.renderer = renderer;
        this.stageVariables = stageVariables;
        this.parser = parser;
        this.properties = properties;
        this.metrics = metrics;
        this.mapper = mapper;
        this.executor = executor;
        this.maxParallelAgents = Math.max(1, maxParallelAgents);
    }

    AgentInvoker(AgentRegistry registry, ReasoningService reasoning, ExecutorService executor, int maxParallelAgents) {
        this(registry, reasoning, new PromptRenderer(), new StageVariables(), new JsonResponseParser(),
                new ReasoningProperties(), null, new ObjectMapper(), executor, maxParallelAgents);
    }

    public InvocationResult invoke(String agentId, ForecastStage stage, ForecastContext context,
                                   InvocationOptions options) {
        long start = System.currentTimeMillis();
        MdcContext.setAgent(context.forecastId(), stage.wireName(), agentId);
        try {
            AgentCard card = registry.get(agentId).orElseThrow(() -> new AgentNotFoundException(agentId));
            if (!card.supports(stage)) {
                throw new StageUnsupportedException(agentId, stage);
            }
            InvocationOptions opts = options != null ? options : InvocationOptions.DEFAULTS;
            Prompts prompts = buildPrompts(card, stage, context, opts);
            Integer maxTokens = opts.maxTokens() != null ? opts.maxTokens() : card.constraints().maxTokensOutput();
            ReasoningOptions reasoningOptions = ReasoningOptions.json(opts.temperature(), maxTokens);

            Map<String, Object> output;
            List<String> sources;
            if (card.usesWebSearch() && properties.isWebSearchEnabled()) {
                SearchCompletion search = reasoning.completeWithSearch(
                        prompts.system() + "\n\n" + prompts.user(), reasoningOptions);
                output = parseSearchOutput(search.text(), stage);
                sources = search.sources();
            } else {
                JsonCompletion completion = reasoning.completeJson(prompts.system(), prompts.user(), reasoningOptions);
                output = completion.parsed();
                sources = List.of();
            }

            double confidence = extractConfidence(output);
            long latency = System.currentTimeMillis() - start;
            var contribution = new AgentContribution(agentId, card.name(), output, confidence,
                    latency, Instant.now(), sources);
            recordMetrics(agentId, true, latency);
            log.info("Agent {} contributed to {} in {}ms (confidence {})", agentId, stage, latency, confidence);
            return InvocationResult.success(contribution);
        } catch (RuntimeException e) {
            long latency = System.currentTimeMillis() - start;
            recordMetrics(agentId, false, latency);
            log.warn("Agent {} failed on {} after {}ms: {}", agentId, stage, latency, e.getMessage());
            return InvocationResult.failure(agentId, e.getMessage(), latency);
        } finally {
            MdcContext.clearAgent();
        }
    }

    /**
     * Invokes several agents concurrently, at most {@code max-parallel-agents} at a time.
     * Results come back in the order of {@code agentIds}.
     */
    public List<InvocationResult> invokeParallel(List<String> agentIds, ForecastStage stage,
                                                 ForecastContext context,
                                                 Function<String, InvocationOptions> optionsFor) {
        if (agentIds.isEmpty()) {
            return List.of();
        }
        if (agentIds.size() == 1) {
            String only = agentIds.get(0);
            return List.of(invoke(only, stage, context, optionsFor.apply(only)));
        }

        var semaphore = new Semaphore(maxParallelAgents);
        var callerMdc = MDC.getCopyOfContextMap();
        var futures = new ArrayList<CompletableFuture<InvocationResult>>();

        for (String agentId : agentIds) {
            InvocationOptions options = optionsFor.apply(agentId);
            futures.add(CompletableFuture.supplyAsync(() -> {
                if (callerMdc != null) {
                    MDC.setContextMap(callerMdc);
                }
                try {
                    semaphore.acquire();
                    try {
                        return invoke(agentId, stage, context, options);
                    } finally {
                        semaphore.release();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return InvocationResult.failure(agentId, "Interrupted while waiting for an agent slot", 0);
                } finally {
                    MDC.clear();
                }
            }, executor));
        }

        return futures.stream().map(CompletableFuture::join).toList();
    }

    private Prompts buildPrompts(AgentCard card, ForecastStage stage, ForecastContext context,
                                 InvocationOptions options) {
        Map<String, Object> variables = stageVariables.build(stage, context);
        PromptTemplate template = AgentCatalog.promptTemplate(card.id()).orElse(null);

        String system;
        String user;
        if (template != null) {
            renderer.requireVariables(template.requiredVariables(), variables);
            system = template.systemPrompt();
            user = template.userPromptTemplate();
        } else {
            system = genericSystemPrompt(card);
            user = genericUserPrompt(context, stage);
        }
        if (options.systemPromptOverride() != null) {
            system = options.systemPromptOverride();
        }
        if (options.userPromptOverride() != null) {
            user = options.userPromptOverride();
        }
        return new Prompts(renderer.render(system, variables), renderer.render(user, variables));
    }

    static String genericSystemPrompt(AgentCard card) {
        String description = card.description().endsWith(".")
                ? card.description().substring(0, card.description().length() - 1)
                : card.description();
        return "You are " + card.name() + ". " + description + ". Output valid JSON only.";
    }

    private String genericUserPrompt(ForecastContext context, ForecastStage stage) {
        Matchup matchup = context.matchup();
        var previous = new LinkedHashMap<String, Object>();
        context.previousOutputs().forEach((s, outputs) -> previous.put(s.wireName(), outputs));
        String previousJson;
        try {
            previousJson = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(previous);
        } catch (JsonProcessingException e) {
            log.debug("Could not serialize previous outputs: {}", e.getMessage());
            previousJson = String.valueOf(previous);
        }
        return "Game: " + matchup.awayTeam() + " @ " + matchup.homeTeam() + "\n"
                + "Time: " + (matchup.gameTime() != null ? matchup.gameTime() : "TBD") + "\n"
                + "Stage: " + stage.wireName() + "\n\n"
                + "Previous outputs:\n" + previousJson;
    }

    private Map<String, Object> parseSearchOutput(String text, ForecastStage stage) {
        try {
            return parser.parse(text).value();
        } catch (UnparsableResponseException e) {
            if (stage != ForecastStage.EVIDENCE_GATHERING) {
                throw e;
            }
            log.info("Search answer had no JSON object; keeping it as an evidence summary");
            var wrapped = new LinkedHashMap<String, Object>();
            wrapped.put("summary", text);
            wrapped.put("evidenceItems", List.of());
            wrapped.put("confidence", 0.5);
            return wrapped;
        }
    }

    /**
     * Reads the first numeric confidence field, clamped to [0, 1]. Defaults to 0.7.
     */
    static double extractConfidence(Map<String, Object> output) {
        for (String field : CONFIDENCE_FIELDS) {
            Double value = asDouble(output.get(field));
            if (value != null && !value.isNaN()) {
                return Math.max(0.0, Math.min(1.0, value));
            }
        }
        return DEFAULT_CONFIDENCE;
    }

    private static Double asDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private void recordMetrics(String agentId, boolean success, long latencyMs) {
        if (metrics != null) {
            metrics.recordAgentInvocation(agentId, success, latencyMs);
        }
    }

    private record Prompts(String system, String user) {}
}
