package com.forecastmind.core.pipeline;

import com.forecastmind.core.agents.AgentCatalog;
import com.forecastmind.core.agents.AgentRegistry;
import com.forecastmind.core.model.ForecastStage;
import com.forecastmind.core.model.PipelineConfig;
import com.forecastmind.core.model.PresetDefinition;
import com.forecastmind.core.model.StageConfig;
import com.forecastmind.core.model.UnknownPresetException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PresetCatalogTest {

    private final PresetCatalog catalog = new PresetCatalog(new AgentRegistry(AgentCatalog.DEFAULT_AGENTS));

    @Test
    @DisplayName("defines quick, balanced and deep with descending priority")
    void presets() {
        assertEquals(List.of("quick", "balanced", "deep"),
                catalog.presets().stream().map(PresetDefinition::id).toList());
        assertEquals(2, catalog.priorityOf("quick"));
        assertEquals(1, catalog.priorityOf("balanced"));
        assertEquals(0, catalog.priorityOf("deep"));
        assertTrue(catalog.preset("balanced").orElseThrow().recommended());
    }

    @Test
    @DisplayName("every preset only names registered agents")
    void agentsRegistered() {
        var registry = new AgentRegistry(AgentCatalog.DEFAULT_AGENTS);
        for (PresetDefinition preset : catalog.presets()) {
            for (List<String> ids : preset.stages().values()) {
                assertTrue(registry.validate(ids).isValid(), preset.id() + " names unknown agents: " + ids);
            }
        }
    }

    @Test
    @DisplayName("quick disables every stage it has no agents for")
    void quickConfig() {
        PipelineConfig config = catalog.buildPipelineConfig("quick");

        assertTrue(config.stage(ForecastStage.REFERENCE_CLASS).enabled());
        assertTrue(config.stage(ForecastStage.BASE_RATE).enabled());
        assertTrue(config.stage(ForecastStage.SYNTHESIS).enabled());
        assertFalse(config.stage(ForecastStage.EVIDENCE_GATHERING).enabled());
        assertFalse(config.stage(ForecastStage.CALIBRATION).enabled());
    }

    @Test
    @DisplayName("quick describes the reference class stage it runs")
    void quickDescription() {
        PresetDefinition quick = catalog.preset("quick").orElseThrow();

        assertEquals(List.of("reference-class-historical"), quick.stages().get(ForecastStage.REFERENCE_CLASS));
        assertTrue(quick.description().startsWith("Reference class, base rate and synthesis"));
        assertFalse(quick.description().contains("only"));
    }

    @Test
    @DisplayName("deep runs evidence and adversarial review in parallel with card token limits")
    void deepConfig() {
        PipelineConfig config = catalog.buildPipelineConfig("deep");
        StageConfig evidence = config.stage(ForecastStage.EVIDENCE_GATHERING);

        assertTrue(evidence.parallel());
        assertEquals(List.of("evidence-web-search", "evidence-injury-analyzer"), evidence.enabledAgentIds());
        assertEquals(8000, evidence.agentConfig("evidence-web-search").maxTokens());
        assertEquals(0.7, evidence.agentConfig("evidence-web-search").temperature());
        assertFalse(config.stage(ForecastStage.BASE_RATE).parallel());
        assertTrue(config.stage(ForecastStage.ADVERSARIAL_REVIEW).parallel());
    }

    @Test
    @DisplayName("unknown preset is rejected")
    void unknown() {
        assertFalse(catalog.exists("turbo"));
        assertThrows(UnknownPresetException.class, () -> catalog.buildPipelineConfig("turbo"));
        assertThrows(UnknownPresetException.class, () -> catalog.buildPipelineConfig(null));
    }
}
