package com.forecastmind.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * The analytical phases of a forecast, declared in execution order.
 */
public enum ForecastStage {

    REFERENCE_CLASS("reference_class", "Reference Class",
            "Find similar historical situations to anchor the estimate"),
    BASE_RATE("base_rate", "Base Rate",
            "Turn reference classes into a prior probability"),
    STRUCTURAL_DECOMPOSITION("structural_decomposition", "Structural Decomposition",
            "Break the question into independent sub-questions"),
    EVIDENCE_GATHERING("evidence_gathering", "Evidence",
            "Collect current evidence that bears on the outcome"),
    BAYESIAN_UPDATE("bayesian_update", "Bayesian Update",
            "Move the prior by bounded likelihood ratios"),
    ADVERSARIAL_REVIEW("adversarial_review", "Adversarial Review",
            "Challenge the estimate and flag cognitive biases"),
    SYNTHESIS("synthesis", "Synthesis",
            "Integrate all stages into a final probability"),
    CALIBRATION("calibration", "Calibration",
            "Log the prediction for later calibration scoring");

    private static final List<ForecastStage> ORDERED = List.of(values());

    private final String wireName;
    private final String displayName;
    private final String description;

    ForecastStage(String wireName, String displayName, String description) {
        this.wireName = wireName;
        this.displayName = displayName;
        this.description = description;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    /** Zero-based position in the pipeline sequence. */
    public int position() {
        return ordinal();
    }

    public static List<ForecastStage> ordered() {
        return ORDERED;
    }

    /**
     * Resolves a stage from its wire name ("base_rate") or enum name ("BASE_RATE").
     *
     * @throws IllegalArgumentException if no stage matches
     */
    @JsonCreator
    public static ForecastStage fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Stage name is required");
        }
        for (ForecastStage stage : ORDERED) {
            if (stage.wireName.equalsIgnoreCase(value) || stage.name().equalsIgnoreCase(value)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
