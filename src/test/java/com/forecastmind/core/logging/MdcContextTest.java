package com.forecastmind.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setForecast puts forecastId and taskId in MDC")
    void setForecast() {
        MdcContext.setForecast("fc-1a2b3c4d", "task-9f8e7d6c");
        assertEquals("fc-1a2b3c4d", MDC.get("forecastId"));
        assertEquals("task-9f8e7d6c", MDC.get("taskId"));
    }

    @Test
    @DisplayName("setForecast without a task leaves taskId unset")
    void setForecastWithoutTask() {
        MdcContext.setForecast("fc-1a2b3c4d", null);
        assertEquals("fc-1a2b3c4d", MDC.get("forecastId"));
        assertNull(MDC.get("taskId"));
    }

    @Test
    @DisplayName("setAgent puts forecastId, stage and agentId in MDC; clearAgent drops only the agent")
    void setAgent() {
        MdcContext.setAgent("fc-1a2b3c4d", "evidence_gathering", "evidence-web-search");
        assertEquals("evidence_gathering", MDC.get("stage"));
        assertEquals("evidence-web-search", MDC.get("agentId"));

        MdcContext.clearAgent();
        assertNull(MDC.get("agentId"));
        assertEquals("evidence_gathering", MDC.get("stage"));
    }

    @Test
    @DisplayName("clear removes all forecast MDC keys")
    void clear() {
        MdcContext.setForecast("fc-1a2b3c4d", "task-9f8e7d6c");
        MdcContext.setAgent("fc-1a2b3c4d", "synthesis", "synthesis-coordinator");
        MdcContext.clear();
        assertNull(MDC.get("forecastId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("stage"));
        assertNull(MDC.get("agentId"));
    }
}
