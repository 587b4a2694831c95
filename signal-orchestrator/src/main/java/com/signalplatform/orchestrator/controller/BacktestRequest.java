package com.signalplatform.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalplatform.common.model.MarketSnapshot;

import java.util.List;
import java.util.Map;

/**
 * Backtest request. Inline {@code data} takes precedence over the snapshot store; with
 * neither {@code data} nor {@code instruments}, every stored instrument is replayed.
 * Null flags fall back to configuration.
 */
public record BacktestRequest(
    @JsonProperty("instruments")       List<String> instruments,
    @JsonProperty("data")              Map<String, List<MarketSnapshot>> data,
    @JsonProperty("seedFromLive")      Boolean seedFromLive,
    @JsonProperty("verifyDeterminism") Boolean verifyDeterminism
) {
    public static BacktestRequest empty() {
        return new BacktestRequest(null, null, null, null);
    }
}
