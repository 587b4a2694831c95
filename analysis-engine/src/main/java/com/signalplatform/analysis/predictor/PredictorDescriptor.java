package com.signalplatform.analysis.predictor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.signalplatform.common.model.Regime;

import java.time.Duration;
import java.util.Set;

/**
 * One model registry entry: identity, accepted feature schema, validated regimes, latency
 * budget, configured base weight and family-specific model parameters.
 *
 * <p>An empty {@code validRegimes} set means the predictor is validated for every regime.
 */
public record PredictorDescriptor(
    @JsonProperty("id")           String id,
    @JsonProperty("type")         PredictorType type,
    @JsonProperty("schemaId")     String schemaId,
    @JsonProperty("validRegimes") Set<Regime> validRegimes,
    @JsonProperty("timeoutMs")    long timeoutMs,
    @JsonProperty("baseWeight")   double baseWeight,
    @JsonProperty("params")       JsonNode params
) {
    public PredictorDescriptor {
        validRegimes = validRegimes == null ? Set.of() : Set.copyOf(validRegimes);
        params       = params == null ? MissingNode.getInstance() : params;
    }

    @JsonIgnore
    public Duration timeout() {
        return Duration.ofMillis(timeoutMs);
    }
}
