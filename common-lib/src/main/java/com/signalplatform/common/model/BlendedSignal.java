package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Ensemble output before the risk gate.
 *
 * <ul>
 *   <li>{@code weightedScore}       : Σ(normalizedWeight × sign) in [−1, +1]</li>
 *   <li>{@code positionSizeFraction}: proposed exposure change as a fraction of capital</li>
 *   <li>{@code weights}             : normalized weight per responding predictor</li>
 *   <li>{@code lowConfidence}       : predictors outside their validated regimes</li>
 *   <li>{@code failed}              : predictors that timed out or errored</li>
 * </ul>
 */
public record BlendedSignal(
    @JsonProperty("direction")            Direction direction,
    @JsonProperty("confidence")           double confidence,
    @JsonProperty("weightedScore")        double weightedScore,
    @JsonProperty("positionSizeFraction") double positionSizeFraction,
    @JsonProperty("respondedPredictors")  int respondedPredictors,
    @JsonProperty("totalPredictors")      int totalPredictors,
    @JsonProperty("weights")              Map<String, Double> weights,
    @JsonProperty("lowConfidence")        List<String> lowConfidence,
    @JsonProperty("failed")               List<String> failed
) {
    public BlendedSignal {
        weights       = weights == null ? Map.of() : weights;
        lowConfidence = lowConfidence == null ? List.of() : List.copyOf(lowConfidence);
        failed        = failed == null ? List.of() : List.copyOf(failed);
    }

    public boolean degraded() {
        return respondedPredictors < totalPredictors;
    }
}
