package com.forecastmind.core.pipeline;

public record StartedForecast(String forecastId, String taskId) {}
