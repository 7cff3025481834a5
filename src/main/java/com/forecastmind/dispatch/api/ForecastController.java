package com.forecastmind.dispatch.api;

import com.forecastmind.core.model.Matchup;
import com.forecastmind.core.pipeline.CancelOutcome;
import com.forecastmind.core.pipeline.ForecastStatus;
import com.forecastmind.core.pipeline.PipelineOrchestrator;
import com.forecastmind.core.pipeline.StartedForecast;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for forecast lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/forecasts")
public class ForecastController {

    private static final Logger log = LoggerFactory.getLogger(ForecastController.class);

    private final PipelineOrchestrator orchestrator;
    private final SseStreamingService sseStreamingService;

    public ForecastController(PipelineOrchestrator orchestrator, SseStreamingService sseStreamingService) {
        this.orchestrator = orchestrator;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/forecasts: Request a forecast. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submitForecast(@RequestBody ForecastRequest request) {
        if (isBlank(request.gameId()) || isBlank(request.homeTeam()) || isBlank(request.awayTeam())) {
            return ResponseEntity.badRequest().body(
                    Map.of("error", "game_id, home_team and away_team are required"));
        }
        Instant gameTime = null;
        if (!isBlank(request.gameTime())) {
            try {
                gameTime = Instant.parse(request.gameTime());
            } catch (DateTimeParseException e) {
                return ResponseEntity.badRequest().body(
                        Map.of("error", "Invalid game_time: " + request.gameTime()));
            }
        }

        // unknown presets surface as UnknownPresetException -> 400
        StartedForecast started = orchestrator.start(
                new Matchup(request.gameId(), request.homeTeam(), request.awayTeam(), gameTime),
                request.preset());
        log.info("Accepted forecast {} for game {}", started.forecastId(), request.gameId());

        return ResponseEntity.accepted().body(Map.of(
                "forecast_id", started.forecastId(),
                "task_id", started.taskId(),
                "status", "QUEUED"));
    }

    @GetMapping
    public ResponseEntity<List<ForecastResponse>> listForecasts() {
        return ResponseEntity.ok(orchestrator.listStatuses().stream().map(ForecastResponse::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ForecastResponse> getForecast(@PathVariable String id) {
        Optional<ForecastStatus> status = orchestrator.getStatus(id);
        return status.map(s -> ResponseEntity.ok(ForecastResponse.from(s)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/forecasts/{id}/cancel: 200 when cancelled or cancelling, 409 when already finished.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancelForecast(@PathVariable String id) {
        CancelOutcome outcome = orchestrator.cancel(id);
        return switch (outcome) {
            case NOT_FOUND -> ResponseEntity.notFound().build();
            case ALREADY_TERMINAL -> ResponseEntity.status(HttpStatus.CONFLICT).body(
                    Map.of("error", "Forecast " + id + " has already finished"));
            case CANCELLED, CANCELLING -> {
                log.info("Cancel requested for forecast {}: {}", id, outcome);
                yield ResponseEntity.ok(Map.of("forecast_id", id, "status", outcome.name()));
            }
        };
    }

    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        if (orchestrator.getStatus(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
