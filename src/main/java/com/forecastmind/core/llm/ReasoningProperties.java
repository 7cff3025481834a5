package com.forecastmind.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "forecast.llm")
public class ReasoningProperties {

    private String model = "";
    private double defaultTemperature = 0.7;
    private boolean webSearchEnabled = true;
    private int maxSources = 20;
    private String searchModel = "gpt-4o-mini-search-preview";
    private String searchContextSize = "medium";

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public double getDefaultTemperature() {
        return defaultTemperature;
    }

    public void setDefaultTemperature(double defaultTemperature) {
        this.defaultTemperature = defaultTemperature;
    }

    public boolean isWebSearchEnabled() {
        return webSearchEnabled;
    }

    public void setWebSearchEnabled(boolean webSearchEnabled) {
        this.webSearchEnabled = webSearchEnabled;
    }

    public int getMaxSources() {
        return maxSources;
    }

    public void setMaxSources(int maxSources) {
        this.maxSources = maxSources;
    }

    public String getSearchModel() {
        return searchModel;
    }

    public void setSearchModel(String searchModel) {
        this.searchModel = searchModel;
    }

    public String getSearchContextSize() {
        return searchContextSize;
    }

    public void setSearchContextSize(String searchContextSize) {
        this.searchContextSize = searchContextSize;
    }
}
