package com.forecastmind.core.pipeline;

import com.forecastmind.core.model.ForecastStage;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConfigurationProperties(prefix = "forecast.pipeline")
public class PipelineProperties {

    private int maxConcurrentPipelines = 4;
    private int maxParallelAgents = 4;
    private int routerFanOut = 2;
    private List<ForecastStage> criticalStages = List.of(ForecastStage.BASE_RATE, ForecastStage.SYNTHESIS);
    private String defaultPreset = "balanced";
    private LikelihoodRatio likelihoodRatio = new LikelihoodRatio();

    public int getMaxConcurrentPipelines() { return maxConcurrentPipelines; }
    public void setMaxConcurrentPipelines(int maxConcurrentPipelines) { this.maxConcurrentPipelines = maxConcurrentPipelines; }

    public int getMaxParallelAgents() { return maxParallelAgents; }
    public void setMaxParallelAgents(int maxParallelAgents) { this.maxParallelAgents = maxParallelAgents; }

    public int getRouterFanOut() { return routerFanOut; }
    public void setRouterFanOut(int routerFanOut) { this.routerFanOut = routerFanOut; }

    public List<ForecastStage> getCriticalStages() { return criticalStages; }
    public void setCriticalStages(List<ForecastStage> criticalStages) { this.criticalStages = criticalStages; }

    public String getDefaultPreset() { return defaultPreset; }
    public void setDefaultPreset(String defaultPreset) { this.defaultPreset = defaultPreset; }

    public LikelihoodRatio getLikelihoodRatio() { return likelihoodRatio; }
    public void setLikelihoodRatio(LikelihoodRatio likelihoodRatio) { this.likelihoodRatio = likelihoodRatio; }

    public static class LikelihoodRatio {
        private double min = 0.5;
        private double max = 2.0;

        public double getMin() { return min; }
        public void setMin(double min) { this.min = min; }
        public double getMax() { return max; }
        public void setMax(double max) { this.max = max; }
    }
}
