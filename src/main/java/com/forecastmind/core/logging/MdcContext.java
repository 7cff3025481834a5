package com.forecastmind.core.logging;

import org.slf4j.MDC;

/**
 * Manages the forecast-specific MDC keys used by the log pattern.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setForecast(String forecastId, String taskId) {
        MDC.put("forecastId", forecastId);
        if (taskId != null) {
            MDC.put("taskId", taskId);
        }
    }

    public static void setStage(String forecastId, String stage) {
        MDC.put("forecastId", forecastId);
        MDC.put("stage", stage);
    }

    public static void setAgent(String forecastId, String stage, String agentId) {
        MDC.put("forecastId", forecastId);
        MDC.put("stage", stage);
        MDC.put("agentId", agentId);
    }

    public static void clearAgent() {
        MDC.remove("agentId");
    }

    public static void clear() {
        MDC.remove("forecastId");
        MDC.remove("taskId");
        MDC.remove("stage");
        MDC.remove("agentId");
    }
}
