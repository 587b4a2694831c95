package com.signalplatform.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalplatform.common.model.MarketSnapshot;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.time.Instant;
import java.util.List;

/**
 * Decision request. The snapshot at {@code timestamp} (the newest one when
 * {@code timestamp} is omitted) is decided on; earlier snapshots are context.
 */
public record DecideRequest(
    @JsonProperty("instrument") @NotBlank String instrument,
    @JsonProperty("timestamp")  Instant timestamp,
    @JsonProperty("snapshots")  @NotEmpty List<MarketSnapshot> snapshots
) {}
