package com.forecastmind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/forecasts.
 *
 * @param gameId   external game identifier
 * @param homeTeam team whose win probability is forecast
 * @param awayTeam opponent
 * @param gameTime ISO-8601 start time; nullable
 * @param preset   quick, balanced or deep; nullable, defaults to the configured preset
 */
public record ForecastRequest(
    @JsonProperty("game_id") String gameId,
    @JsonProperty("home_team") String homeTeam,
    @JsonProperty("away_team") String awayTeam,
    @JsonProperty("game_time") String gameTime,
    String preset
) {}
