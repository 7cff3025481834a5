package com.forecastmind.core.calibration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;

class CalibrationServiceTest {

    private CalibrationService service;

    @BeforeEach
    void setUp() {
        service = new CalibrationService();
    }

    /** Logs {@code count} predictions at {@code probability}, the first {@code occurred} of which happen. */
    private void resolve(String prefix, double probability, int count, int occurred) {
        for (int i = 0; i < count; i++) {
            String id = prefix + "-" + i;
            service.recordPrediction(id, "g-" + i, probability);
            service.recordOutcome(id, i < occurred);
        }
    }

    @Test
    @DisplayName("bucketId maps probabilities to 10% bands, 1.0 into the top band")
    void bucketIds() {
        assertEquals("0-10%", CalibrationService.bucketId(0.0));
        assertEquals("60-70%", CalibrationService.bucketId(0.65));
        assertEquals("70-80%", CalibrationService.bucketId(0.7));
        assertEquals("90-100%", CalibrationService.bucketId(1.0));
        assertEquals("0-10%", CalibrationService.bucketId(-0.2));
    }

    @Nested
    @DisplayName("outcomes")
    class Outcomes {

        @Test
        @DisplayName("a prediction is pending until its outcome is recorded")
        void pendingThenResolved() {
            service.recordPrediction("fc-1", "g-1", 0.62);
            assertEquals(1, service.pendingPredictions().size());

            assertTrue(service.recordOutcome("fc-1", true));

            assertTrue(service.pendingPredictions().isEmpty());
            assertEquals(Boolean.TRUE, service.prediction("fc-1").orElseThrow().outcome());
        }

        @Test
        @DisplayName("unknown and already-resolved predictions are ignored")
        void ignored() {
            service.recordPrediction("fc-1", "g-1", 0.62);
            service.recordOutcome("fc-1", true);

            assertFalse(service.recordOutcome("fc-1", false));
            assertFalse(service.recordOutcome("fc-missing", true));
            assertEquals(1, service.summary().buckets().stream()
                    .filter(b -> b.bucketId().equals("60-70%")).findFirst().orElseThrow().predictions());
        }
    }

    @Nested
    @DisplayName("anchor")
    class Anchor {

        @Test
        @DisplayName("reports insufficient data below five resolved predictions")
        void insufficient() {
            resolve("fc", 0.65, 4, 3);

            CalibrationAnchor anchor = service.anchor(0.66);

            assertEquals("60-70%", anchor.probabilityBucket());
            assertNull(anchor.historicalAccuracy());
            assertEquals(4, anchor.sampleSize());
            assertThat(anchor.message(), containsString("Insufficient data"));
        }

        @Test
        @DisplayName("accuracy within 5 points of the midpoint is well calibrated")
        void wellCalibrated() {
            // 13 of 20 = 65%, bucket midpoint 65%
            resolve("fc", 0.65, 20, 13);

            CalibrationAnchor anchor = service.anchor(0.61);

            assertThat(anchor.historicalAccuracy(), closeTo(0.65, 1e-9));
            assertThat(anchor.message(), containsString("Well calibrated"));
        }

        @Test
        @DisplayName("flags over- and underconfidence")
        void miscalibrated() {
            resolve("low", 0.65, 5, 1);
            resolve("high", 0.25, 5, 4);

            assertThat(service.anchor(0.65).message(), containsString("overconfident"));
            assertThat(service.anchor(0.25).message(), containsString("underconfident"));
        }
    }

    @Test
    @DisplayName("summary reports Brier score and calibration error over resolved predictions")
    void summary() {
        resolve("fc", 0.65, 5, 1);
        service.recordPrediction("fc-pending", "g-x", 0.4);

        CalibrationSummary summary = service.summary();

        assertEquals(6, summary.totalPredictions());
        assertEquals(5, summary.resolvedPredictions());
        assertEquals(1, summary.pendingPredictions());
        // one hit at (0.35)^2 and four misses at (0.65)^2
        assertThat(summary.brierScore(), closeTo((0.1225 + 4 * 0.4225) / 5, 1e-9));
        assertThat(summary.calibrationError(), closeTo(0.45, 1e-9));
        assertEquals(10, summary.buckets().size());
    }

    @Test
    @DisplayName("reset clears predictions and buckets")
    void reset() {
        resolve("fc", 0.65, 5, 5);

        service.reset();

        CalibrationSummary summary = service.summary();
        assertEquals(0, summary.totalPredictions());
        assertNull(summary.brierScore());
        assertNull(summary.calibrationError());
        assertTrue(summary.buckets().stream().allMatch(b -> b.predictions() == 0));
    }
}
