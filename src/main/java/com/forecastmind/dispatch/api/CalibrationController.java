package com.forecastmind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.forecastmind.core.calibration.CalibrationService;
import com.forecastmind.core.calibration.CalibrationSummary;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/calibration")
public class CalibrationController {

    private final CalibrationService calibration;

    public CalibrationController(CalibrationService calibration) {
        this.calibration = calibration;
    }

    @GetMapping
    public CalibrationSummary summary() {
        return calibration.summary();
    }

    /**
     * POST /api/v1/calibration/{forecastId}/outcome: body {@code {"occurred": true}}.
     * 404 for an unknown forecast, 409 if its outcome is already recorded.
     */
    @PostMapping("/{forecastId}/outcome")
    public ResponseEntity<Map<String, Object>> recordOutcome(@PathVariable String forecastId,
                                                             @RequestBody OutcomeRequest request) {
        if (request.occurred() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "occurred is required"));
        }
        var prediction = calibration.prediction(forecastId);
        if (prediction.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (!calibration.recordOutcome(forecastId, request.occurred())) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(
                    Map.of("error", "Outcome already recorded for " + forecastId));
        }
        return ResponseEntity.ok(Map.of(
                "forecast_id", forecastId,
                "occurred", request.occurred(),
                "bucket", prediction.get().bucket()));
    }

    public record OutcomeRequest(@JsonProperty("occurred") Boolean occurred) {}
}
