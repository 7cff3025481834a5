package com.forecastmind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional JSON body for POST /api/v1/agents/{id}/test.
 *
 * @param stage    stage wire name; nullable, defaults to the agent's first supported stage
 * @param homeTeam nullable
 * @param awayTeam nullable
 */
public record AgentTestRequest(
    String stage,
    @JsonProperty("home_team") String homeTeam,
    @JsonProperty("away_team") String awayTeam
) {}
