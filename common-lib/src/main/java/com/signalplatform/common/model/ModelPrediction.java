package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Output of a single predictor. {@code timestamp} is the feature timestamp, not the
 * wall clock, so replayed predictions are identical to the live ones.
 */
public record ModelPrediction(
    @JsonProperty("predictorId") String predictorId,
    @JsonProperty("direction")   Direction direction,
    @JsonProperty("confidence")  double confidence,
    @JsonProperty("timestamp")   Instant timestamp
) {
    public ModelPrediction {
        Objects.requireNonNull(predictorId, "predictorId");
        Objects.requireNonNull(direction, "direction");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                "confidence must be in [0,1], got " + confidence + " from predictor=" + predictorId);
        }
    }
}
