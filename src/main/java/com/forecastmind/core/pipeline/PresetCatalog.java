package com.forecastmind.core.pipeline;

import com.forecastmind.core.agents.AgentCard;
import com.forecastmind.core.agents.AgentRegistry;
import com.forecastmind.core.model.AgentConfig;
import com.forecastmind.core.model.ForecastStage;
import com.forecastmind.core.model.PipelineConfig;
import com.forecastmind.core.model.PresetDefinition;
import com.forecastmind.core.model.StageConfig;
import com.forecastmind.core.model.UnknownPresetException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.forecastmind.core.model.ForecastStage.ADVERSARIAL_REVIEW;
import static com.forecastmind.core.model.ForecastStage.BASE_RATE;
import static com.forecastmind.core.model.ForecastStage.BAYESIAN_UPDATE;
import static com.forecastmind.core.model.ForecastStage.CALIBRATION;
import static com.forecastmind.core.model.ForecastStage.EVIDENCE_GATHERING;
import static com.forecastmind.core.model.ForecastStage.REFERENCE_CLASS;
import static com.forecastmind.core.model.ForecastStage.STRUCTURAL_DECOMPOSITION;
import static com.forecastmind.core.model.ForecastStage.SYNTHESIS;

/**
 * The built-in pipeline presets and their expansion into a {@link PipelineConfig}.
 */
@Component
public class PresetCatalog {

    static final double DEFAULT_TEMPERATURE = 0.7;
    static final int FALLBACK_MAX_TOKENS = 4000;

    static final Set<ForecastStage> PARALLEL_STAGES = EnumSet.of(EVIDENCE_GATHERING, ADVERSARIAL_REVIEW);

    private static final Map<String, PresetDefinition> PRESETS = new LinkedHashMap<>();

    static {
        register(new PresetDefinition("quick", "Quick",
                "Reference class, base rate and synthesis. Fast and cheap.",
                2, 30, false,
                stages(List.of("reference-class-historical"),
                        List.of("base-rate-calculator"),
                        List.of(),
                        List.of(),
                        List.of(),
                        List.of(),
                        List.of("synthesis-coordinator"))));
        register(new PresetDefinition("balanced", "Balanced",
                "Adds web evidence, a Bayesian update and a devil's advocate review.",
                1, 90, true,
                stages(List.of("reference-class-historical"),
                        List.of("base-rate-calculator"),
                        List.of(),
                        List.of("evidence-web-search"),
                        List.of("bayesian-updater"),
                        List.of("devils-advocate"),
                        List.of("synthesis-coordinator"))));
        register(new PresetDefinition("deep", "Deep",
                "Full pipeline with structural decomposition, injury analysis and bias detection.",
                0, 180, false,
                stages(List.of("reference-class-historical"),
                        List.of("base-rate-calculator"),
                        List.of("structural-decomposer"),
                        List.of("evidence-web-search", "evidence-injury-analyzer"),
                        List.of("bayesian-updater"),
                        List.of("devils-advocate", "bias-detector"),
                        List.of("synthesis-coordinator"))));
    }

    private final AgentRegistry registry;

    public PresetCatalog(AgentRegistry registry) {
        this.registry = registry;
    }

    public List<PresetDefinition> presets() {
        return List.copyOf(PRESETS.values());
    }

    public Optional<PresetDefinition> preset(String presetId) {
        return Optional.ofNullable(presetId != null ? PRESETS.get(presetId) : null);
    }

    public boolean exists(String presetId) {
        return preset(presetId).isPresent();
    }

    /**
     * Expands a preset into per-stage configs. Stages with no agents are disabled.
     *
     * @throws UnknownPresetException if the preset is not defined
     */
    public PipelineConfig buildPipelineConfig(String presetId) {
        PresetDefinition preset = preset(presetId).orElseThrow(() -> new UnknownPresetException(presetId));
        var stages = new EnumMap<ForecastStage, StageConfig>(ForecastStage.class);
        for (ForecastStage stage : ForecastStage.ordered()) {
            List<String> agentIds = preset.stages().getOrDefault(stage, List.of());
            if (agentIds.isEmpty()) {
                stages.put(stage, StageConfig.disabled());
                continue;
            }
            var agents = new ArrayList<AgentConfig>(agentIds.size());
            for (String agentId : agentIds) {
                int maxTokens = registry.get(agentId)
                        .map(AgentCard::constraints)
                        .map(AgentCard.Constraints::maxTokensOutput)
                        .orElse(FALLBACK_MAX_TOKENS);
                agents.add(AgentConfig.defaults(agentId, maxTokens));
            }
            stages.put(stage, new StageConfig(true, PARALLEL_STAGES.contains(stage), agents));
        }
        return new PipelineConfig(preset.id(), stages);
    }

    public int priorityOf(String presetId) {
        return preset(presetId).map(PresetDefinition::priority).orElse(0);
    }

    private static void register(PresetDefinition preset) {
        PRESETS.put(preset.id(), preset);
    }

    private static Map<ForecastStage, List<String>> stages(List<String> referenceClass, List<String> baseRate,
                                                           List<String> decomposition, List<String> evidence,
                                                           List<String> bayesian, List<String> adversarial,
                                                           List<String> synthesis) {
        var map = new EnumMap<ForecastStage, List<String>>(ForecastStage.class);
        map.put(REFERENCE_CLASS, referenceClass);
        map.put(BASE_RATE, baseRate);
        map.put(STRUCTURAL_DECOMPOSITION, decomposition);
        map.put(EVIDENCE_GATHERING, evidence);
        map.put(BAYESIAN_UPDATE, bayesian);
        map.put(ADVERSARIAL_REVIEW, adversarial);
        map.put(SYNTHESIS, synthesis);
        // no agent declares the calibration stage; outcomes are logged by CalibrationService
        map.put(CALIBRATION, List.of());
        return map;
    }
}
