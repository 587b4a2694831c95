package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

/**
 * Outcome of one predictor call inside a decision cycle: either a prediction or a
 * failure reason. Carries the registry metadata the aggregator needs so the ensemble
 * step does not depend on the predictor implementations.
 */
public record PredictorResult(
    @JsonProperty("predictorId")   String predictorId,
    @JsonProperty("baseWeight")    double baseWeight,
    @JsonProperty("validRegimes")  Set<Regime> validRegimes,
    @JsonProperty("prediction")    ModelPrediction prediction,
    @JsonProperty("failure")       String failure,
    @JsonProperty("timedOut")      boolean timedOut
) {
    public PredictorResult {
        validRegimes = validRegimes == null ? Set.of() : Set.copyOf(validRegimes);
    }

    public static PredictorResult success(String predictorId, double baseWeight,
                                          Set<Regime> validRegimes, ModelPrediction prediction) {
        return new PredictorResult(predictorId, baseWeight, validRegimes, prediction, null, false);
    }

    public static PredictorResult failed(String predictorId, double baseWeight,
                                         Set<Regime> validRegimes, String reason, boolean timedOut) {
        return new PredictorResult(predictorId, baseWeight, validRegimes, null, reason, timedOut);
    }

    @JsonIgnore
    public boolean responded() {
        return prediction != null;
    }

    /** An empty validity set means the predictor was validated for every regime. */
    public boolean validFor(Regime regime) {
        return validRegimes.isEmpty() || validRegimes.contains(regime);
    }
}
