package com.signalplatform.orchestrator.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalplatform.common.model.Regime;
import com.signalplatform.common.risk.RiskBudget;

import java.time.Instant;
import java.util.Map;

/**
 * Persisted form of the live reliability tables and risk budgets, keyed by instrument.
 * Regime windows are not persisted; they refill from incoming ticks.
 */
public record StateCheckpoint(
    @JsonProperty("savedAt")     Instant savedAt,
    @JsonProperty("instruments") Map<String, Entry> instruments
) {
    public record Entry(
        @JsonProperty("reliabilities") Map<String, Map<Regime, Double>> reliabilities,
        @JsonProperty("risk")          RiskBudget.Snapshot risk
    ) {}

    public StateCheckpoint {
        instruments = instruments == null ? Map.of() : instruments;
    }
}
