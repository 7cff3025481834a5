package com.forecastmind.dispatch.api;

import com.forecastmind.core.agents.AgentCard;
import com.forecastmind.core.agents.AgentCatalog;
import com.forecastmind.core.agents.AgentInvoker;
import com.forecastmind.core.agents.AgentNotFoundException;
import com.forecastmind.core.agents.AgentRegistry;
import com.forecastmind.core.agents.CoherenceRouter;
import com.forecastmind.core.agents.CoherenceRouter.CoherenceScore;
import com.forecastmind.core.agents.InvocationOptions;
import com.forecastmind.core.agents.InvocationResult;
import com.forecastmind.core.agents.SampleContexts;
import com.forecastmind.core.model.ForecastContext;
import com.forecastmind.core.model.ForecastStage;
import com.forecastmind.core.model.PresetDefinition;
import com.forecastmind.core.pipeline.ForecastStatus;
import com.forecastmind.core.pipeline.PipelineOrchestrator;
import com.forecastmind.core.pipeline.PresetCatalog;
import com.forecastmind.core.prompt.PromptTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Views of the agent catalog, presets and stage sequence, plus a one-off agent trial run.
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    static final double TEST_TEMPERATURE = 0.7;
    static final int TEST_MAX_TOKENS = 2000;

    private final AgentRegistry registry;
    private final PresetCatalog presets;
    private final CoherenceRouter router;
    private final PipelineOrchestrator orchestrator;
    private final AgentInvoker invoker;

    public AgentController(AgentRegistry registry, PresetCatalog presets, CoherenceRouter router,
                           PipelineOrchestrator orchestrator, AgentInvoker invoker) {
        this.registry = registry;
        this.presets = presets;
        this.router = router;
        this.orchestrator = orchestrator;
        this.invoker = invoker;
    }

    /**
     * GET /api/v1/agents?stage=evidence_gathering: all agents, optionally filtered by stage.
     */
    @GetMapping
    public List<AgentCard> listAgents(@RequestParam(required = false) String stage) {
        if (stage == null || stage.isBlank()) {
            return registry.getAll();
        }
        return registry.getByStage(ForecastStage.fromWire(stage));
    }

    @GetMapping("/presets")
    public List<PresetDefinition> listPresets() {
        return presets.presets();
    }

    /**
     * GET /api/v1/agents/preset/{presetId}: the preset with its agents grouped by stage.
     */
    @GetMapping("/preset/{presetId}")
    public ResponseEntity<Map<String, Object>> getPreset(@PathVariable String presetId) {
        Optional<PresetDefinition> found = presets.preset(presetId);
        if (found.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Preset not found: " + presetId));
        }
        PresetDefinition preset = found.get();

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", preset.id());
        summary.put("name", preset.name());
        summary.put("description", preset.description());
        summary.put("agentCount", preset.agentCount());
        summary.put("estimatedTimeSeconds", preset.estimatedTimeSeconds());

        Map<String, List<Map<String, String>>> stages = new LinkedHashMap<>();
        for (ForecastStage stage : ForecastStage.ordered()) {
            List<String> agentIds = preset.stages().get(stage);
            if (agentIds == null) {
                continue;
            }
            stages.put(stage.wireName(), agentIds.stream()
                    .map(registry::get)
                    .flatMap(Optional::stream)
                    .map(card -> Map.of("id", card.id(), "name", card.name(), "description", card.description()))
                    .toList());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("preset", summary);
        body.put("stages", stages);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/stages")
    public List<Map<String, Object>> listStages() {
        return ForecastStage.ordered().stream().map(stage -> {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("stage", stage.wireName());
            info.put("name", stage.displayName());
            info.put("description", stage.description());
            info.put("position", stage.position());
            info.put("agents", registry.getByStage(stage).stream().map(AgentCard::id).toList());
            return info;
        }).toList();
    }

    /**
     * GET /api/v1/agents/route/{stage}?forecast_id=...: coherence scores for every candidate,
     * against the given forecast's accumulated context.
     */
    @GetMapping("/route/{stage}")
    public ResponseEntity<List<CoherenceScore>> explainRoute(@PathVariable String stage,
                                                             @RequestParam("forecast_id") String forecastId) {
        ForecastStage forecastStage = ForecastStage.fromWire(stage);
        ForecastContext context = orchestrator.getStatus(forecastId).map(ForecastStatus::context).orElse(null);
        if (context == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(router.explainSelection(forecastStage, context));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AgentCard> getAgent(@PathVariable String id) {
        return registry.get(id).map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/agents/{id}/prompt: the agent's prompt template before rendering.
     */
    @GetMapping("/{id}/prompt")
    public ResponseEntity<Map<String, Object>> getPrompt(@PathVariable String id) {
        AgentCard card = registry.get(id).orElseThrow(() -> new AgentNotFoundException(id));
        Optional<PromptTemplate> template = AgentCatalog.promptTemplate(id);
        if (template.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "No prompt template for agent: " + id));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("agentId", card.id());
        body.put("agentName", card.name());
        body.put("template", template.get());
        return ResponseEntity.ok(body);
    }

    /**
     * POST /api/v1/agents/{id}/test: runs one agent against a sample context for the chosen stage.
     * The call is synchronous and spends real model tokens.
     */
    @PostMapping("/{id}/test")
    public ResponseEntity<Map<String, Object>> testAgent(@PathVariable String id,
                                                         @RequestBody(required = false) AgentTestRequest request) {
        AgentCard card = registry.get(id).orElseThrow(() -> new AgentNotFoundException(id));
        List<String> supported = ForecastStage.ordered().stream()
                .filter(card::supports)
                .map(ForecastStage::wireName)
                .toList();

        String requested = request != null ? request.stage() : null;
        ForecastStage stage;
        if (requested == null || requested.isBlank()) {
            if (supported.isEmpty()) {
                return ResponseEntity.badRequest().body(Map.of("error", "Agent " + id + " supports no stage",
                        "supportedStages", supported));
            }
            stage = ForecastStage.fromWire(supported.get(0));
        } else {
            stage = ForecastStage.fromWire(requested);
            if (!card.supports(stage)) {
                return ResponseEntity.badRequest().body(Map.of(
                        "error", "Agent " + id + " does not support stage " + stage.wireName(),
                        "supportedStages", supported));
            }
        }

        ForecastContext context = SampleContexts.forStage(stage,
                request != null ? request.homeTeam() : null,
                request != null ? request.awayTeam() : null);
        log.info("Test-invoking agent {} for stage {}", id, stage);
        InvocationResult result = invoker.invoke(id, stage, context,
                new InvocationOptions(TEST_TEMPERATURE, TEST_MAX_TOKENS, null, null));

        Map<String, Object> testContext = new LinkedHashMap<>();
        testContext.put("homeTeam", context.matchup().homeTeam());
        testContext.put("awayTeam", context.matchup().awayTeam());
        testContext.put("gameTime", context.matchup().gameTime());

        Map<String, Object> outcome = new LinkedHashMap<>();
        if (result.success()) {
            outcome.put("output", result.contribution().output());
            outcome.put("confidence", result.contribution().confidence());
            outcome.put("sources", result.contribution().sources());
        } else {
            outcome.put("error", result.error());
        }
        outcome.put("latencyMs", result.latencyMs());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", result.success());
        body.put("agent", Map.of("id", card.id(), "name", card.name()));
        body.put("stage", stage.wireName());
        body.put("testContext", testContext);
        body.put("result", outcome);
        return ResponseEntity.ok(body);
    }
}
