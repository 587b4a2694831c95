package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Committed regime label, the confidence of the classification that supports it and
 * the snapshot time at which it was committed ({@code null} while undetermined).
 */
public record RegimeState(
    @JsonProperty("regime")      Regime regime,
    @JsonProperty("confidence")  double confidence,
    @JsonProperty("committedAt") Instant committedAt
) {
    public static final RegimeState UNDETERMINED = new RegimeState(Regime.UNDETERMINED, 0.0, null);
}
