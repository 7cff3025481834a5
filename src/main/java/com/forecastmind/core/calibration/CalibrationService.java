package com.forecastmind.core.calibration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks prediction accuracy per 10% probability bucket.
 * <p>
 * Predictions are logged when a forecast completes; outcomes are recorded later by an
 * operator. Bucket statistics count resolved predictions only.
 */
@Service
public class CalibrationService {

    private static final Logger log = LoggerFactory.getLogger(CalibrationService.class);

    static final int BUCKET_COUNT = 10;
    static final int MIN_SAMPLES = 5;
    static final double WELL_CALIBRATED_TOLERANCE = 0.05;

    private final Map<String, CalibrationBucket> buckets = new LinkedHashMap<>();
    private final Map<String, PredictionRecord> predictions = new ConcurrentHashMap<>();

    public CalibrationService() {
        initializeBuckets();
    }

    private synchronized void initializeBuckets() {
        buckets.clear();
        for (int i = 0; i < BUCKET_COUNT; i++) {
            String id = (i * 10) + "-" + ((i + 1) * 10) + "%";
            buckets.put(id, new CalibrationBucket(id, i / 10.0, (i + 1) / 10.0, 0, 0));
        }
    }

    static String bucketId(double probability) {
        int index = (int) Math.floor(Math.max(0.0, Math.min(1.0, probability)) * BUCKET_COUNT);
        index = Math.min(index, BUCKET_COUNT - 1);
        return (index * 10) + "-" + ((index + 1) * 10) + "%";
    }

    public void recordPrediction(String forecastId, String gameId, double probability) {
        String bucket = bucketId(probability);
        predictions.put(forecastId,
                new PredictionRecord(forecastId, gameId, probability, bucket, Instant.now(), null));
        log.info("Prediction {} recorded for calibration: p={} bucket={}", forecastId, probability, bucket);
    }

    /**
     * Resolves a prediction. Unknown ids and repeated outcomes are logged and ignored.
     *
     * @return true if the outcome was applied
     */
    public synchronized boolean recordOutcome(String forecastId, boolean occurred) {
        PredictionRecord record = predictions.get(forecastId);
        if (record == null) {
            log.warn("No prediction found for forecast {}", forecastId);
            return false;
        }
        if (record.isResolved()) {
            log.warn("Outcome already recorded for forecast {}", forecastId);
            return false;
        }
        predictions.put(forecastId, record.resolve(occurred));
        CalibrationBucket bucket = buckets.get(record.bucket()).withOutcome(occurred);
        buckets.put(bucket.bucketId(), bucket);
        log.info("Outcome recorded for {}: occurred={} bucket={} accuracy={} n={}",
                forecastId, occurred, bucket.bucketId(), bucket.accuracy(), bucket.predictions());
        return true;
    }

    public synchronized CalibrationAnchor anchor(double probability) {
        String id = bucketId(probability);
        CalibrationBucket bucket = buckets.get(id);
        if (bucket.predictions() < MIN_SAMPLES) {
            return new CalibrationAnchor(id, null, bucket.predictions(),
                    "Insufficient data for " + id + " bucket (" + bucket.predictions()
                            + " predictions). No calibration adjustment recommended.");
        }
        double accuracy = bucket.accuracy();
        double diff = accuracy - bucket.midpoint();
        String pct = String.format("%.0f%%", accuracy * 100);
        String message;
        if (Math.abs(diff) < WELL_CALIBRATED_TOLERANCE) {
            message = "When predicting " + id + ", historical accuracy is " + pct
                    + " (n=" + bucket.predictions() + "). Well calibrated.";
        } else if (diff > 0) {
            message = "When predicting " + id + ", events occurred " + pct
                    + " of the time (n=" + bucket.predictions() + "). You may be slightly underconfident.";
        } else {
            message = "When predicting " + id + ", events occurred " + pct
                    + " of the time (n=" + bucket.predictions() + "). You may be slightly overconfident.";
        }
        return new CalibrationAnchor(id, accuracy, bucket.predictions(), message);
    }

    public synchronized CalibrationSummary summary() {
        int total = 0;
        int resolved = 0;
        double brierSum = 0;
        for (PredictionRecord record : predictions.values()) {
            total++;
            if (record.isResolved()) {
                resolved++;
                double outcome = record.outcome() ? 1.0 : 0.0;
                brierSum += Math.pow(record.predictedProbability() - outcome, 2);
            }
        }

        double errorSum = 0;
        int bucketsWithData = 0;
        for (CalibrationBucket bucket : buckets.values()) {
            if (bucket.predictions() >= MIN_SAMPLES) {
                errorSum += Math.abs(bucket.accuracy() - bucket.midpoint());
                bucketsWithData++;
            }
        }

        return new CalibrationSummary(total, resolved, total - resolved,
                resolved > 0 ? brierSum / resolved : null,
                bucketsWithData > 0 ? errorSum / bucketsWithData : null,
                List.copyOf(buckets.values()));
    }

    public Optional<PredictionRecord> prediction(String forecastId) {
        return Optional.ofNullable(predictions.get(forecastId));
    }

    public List<PredictionRecord> pendingPredictions() {
        var pending = new ArrayList<PredictionRecord>();
        for (PredictionRecord record : predictions.values()) {
            if (!record.isResolved()) {
                pending.add(record);
            }
        }
        return pending;
    }

    public synchronized void reset() {
        predictions.clear();
        initializeBuckets();
        log.info("Calibration data reset");
    }
}
