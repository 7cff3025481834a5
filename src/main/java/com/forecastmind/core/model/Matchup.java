package com.forecastmind.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * The pair of entities a forecast is about.
 *
 * @param gameId   external identifier of the game
 * @param homeTeam entity whose win probability is forecast
 * @param awayTeam the opponent
 * @param gameTime scheduled start
 */
public record Matchup(
    String gameId,
    String homeTeam,
    String awayTeam,
    Instant gameTime
) implements Serializable {}
