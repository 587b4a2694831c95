package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Immutable result of a replay run: ordered event log plus summary statistics.
 */
public record BacktestResult(
    @JsonProperty("instrument") String instrument,
    @JsonProperty("events")     List<BacktestEvent> events,
    @JsonProperty("summary")    BacktestSummary summary
) {
    public BacktestResult {
        events = List.copyOf(events);
    }
}
