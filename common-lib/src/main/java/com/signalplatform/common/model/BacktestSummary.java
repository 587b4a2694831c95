package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate statistics of one replay run.
 *
 * <ul>
 *   <li>{@code sharpeRatio} : mean / sample stdev of per-step P&L (not annualized)</li>
 *   <li>{@code maxDrawdown} : largest peak-to-trough equity decline, fraction of peak</li>
 *   <li>{@code winRate}     : winning steps / steps that held exposure</li>
 *   <li>{@code profitFactor}: gross profit / gross loss; 0.0 when there was no loss</li>
 * </ul>
 */
public record BacktestSummary(
    @JsonProperty("stepsReplayed")   int stepsReplayed,
    @JsonProperty("decisions")       int decisions,
    @JsonProperty("skippedTicks")    int skippedTicks,
    @JsonProperty("totalTrades")     int totalTrades,
    @JsonProperty("vetoes")          int vetoes,
    @JsonProperty("winRate")         double winRate,
    @JsonProperty("totalReturn")     double totalReturn,
    @JsonProperty("sharpeRatio")     double sharpeRatio,
    @JsonProperty("maxDrawdown")     double maxDrawdown,
    @JsonProperty("profitFactor")    double profitFactor
) {}
