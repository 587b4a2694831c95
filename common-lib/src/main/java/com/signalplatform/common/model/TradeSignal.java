package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Final output of one decision cycle. Immutable; exactly one per arbiter invocation.
 *
 * <p>Carries the full audit context: the ensemble's own direction and confidence
 * (preserved when the risk gate vetoes), the committed regime, the risk verdict and
 * reason, and whether the ensemble ran degraded.
 */
public record TradeSignal(
    @JsonProperty("instrument")           String instrument,
    @JsonProperty("timestamp")            Instant timestamp,
    @JsonProperty("direction")            Direction direction,
    @JsonProperty("positionSizeFraction") double positionSizeFraction,
    @JsonProperty("confidence")           double confidence,
    @JsonProperty("blendedDirection")     Direction blendedDirection,
    @JsonProperty("proposedSizeFraction") double proposedSizeFraction,
    @JsonProperty("regime")               Regime regime,
    @JsonProperty("regimeConfidence")     double regimeConfidence,
    @JsonProperty("riskVerdict")          RiskVerdict riskVerdict,
    @JsonProperty("riskReason")           String riskReason,
    @JsonProperty("degradedEnsemble")     boolean degradedEnsemble,
    @JsonProperty("respondedPredictors")  int respondedPredictors,
    @JsonProperty("totalPredictors")      int totalPredictors,
    @JsonProperty("predictorWeights")     Map<String, Double> predictorWeights
) {
    public static TradeSignal of(MarketSnapshot snapshot, RegimeState regime,
                                 BlendedSignal blended, RiskAssessment risk) {
        return new TradeSignal(
            snapshot.instrument(),
            snapshot.timestamp(),
            risk.direction(),
            risk.positionSizeFraction(),
            blended.confidence(),
            blended.direction(),
            blended.positionSizeFraction(),
            regime.regime(),
            regime.confidence(),
            risk.verdict(),
            risk.reason(),
            blended.degraded(),
            blended.respondedPredictors(),
            blended.totalPredictors(),
            blended.weights());
    }

    /** Signed exposure change this signal asks for. */
    public double signedSize() {
        return direction.sign() * positionSizeFraction;
    }
}
