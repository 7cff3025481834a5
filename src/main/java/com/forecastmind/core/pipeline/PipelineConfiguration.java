package com.forecastmind.core.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastmind.core.agents.AgentCatalog;
import com.forecastmind.core.agents.AgentRegistry;
import com.forecastmind.core.agents.LikelihoodRatioClamp;
import com.forecastmind.core.llm.JsonResponseParser;
import com.forecastmind.core.model.output.StageOutputReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the pipeline's plain collaborators and its two worker pools.
 */
@Configuration
@EnableScheduling
public class PipelineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfiguration.class);

    @Bean
    public AgentRegistry agentRegistry() {
        var registry = new AgentRegistry(AgentCatalog.DEFAULT_AGENTS);
        log.info("Registered {} agent(s)", registry.size());
        return registry;
    }

    @Bean
    public LikelihoodRatioClamp likelihoodRatioClamp(PipelineProperties properties) {
        return new LikelihoodRatioClamp(properties.getLikelihoodRatio().getMin(),
                properties.getLikelihoodRatio().getMax());
    }

    @Bean
    public StageOutputReader stageOutputReader() {
        return new StageOutputReader();
    }

    @Bean
    public JsonResponseParser jsonResponseParser(ObjectMapper objectMapper) {
        return new JsonResponseParser(objectMapper);
    }

    /** Runs whole pipelines, one task per thread. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pipelineExecutor(PipelineProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrentPipelines()),
                new CustomizableThreadFactory("pipeline-"));
    }

    /** Runs parallel agent calls within a stage; the invoker bounds them with a semaphore. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentExecutor(PipelineProperties properties) {
        int threads = Math.max(1, properties.getMaxConcurrentPipelines() * properties.getMaxParallelAgents());
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("agent-"));
    }
}
