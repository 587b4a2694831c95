package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One replay step: the signal emitted at {@code timestamp}, the exposure held after it,
 * and the P&L realized over the move to the next snapshot (fraction of equity). The first
 * event of a replay also carries, compounded in, the P&L of any exposure the starting
 * state already held before it.
 */
public record BacktestEvent(
    @JsonProperty("timestamp")       Instant timestamp,
    @JsonProperty("signal")          TradeSignal signal,
    @JsonProperty("exposureAfter")   double exposureAfter,
    @JsonProperty("realizedPnl")     double realizedPnl,
    @JsonProperty("equityAfter")     double equityAfter
) {}
