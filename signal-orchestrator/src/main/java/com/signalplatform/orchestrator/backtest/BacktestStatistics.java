package com.signalplatform.orchestrator.backtest;

import com.signalplatform.common.model.BacktestEvent;
import com.signalplatform.common.model.BacktestSummary;
import com.signalplatform.common.model.Direction;
import com.signalplatform.common.model.RiskVerdict;

import java.util.List;

/**
 * Summary statistics over a replay's event log.
 *
 * <h3>Definitions</h3>
 * <pre>
 *   totalReturn  = finalEquity / initialEquity − 1
 *   winRate      = steps with pnl &gt; 0 / steps holding exposure
 *   sharpeRatio  = mean(pnl) / sampleStdDev(pnl)          (per step, not annualized)
 *   maxDrawdown  = max over the equity path of 1 − equity / runningPeak
 *   profitFactor = Σ positive pnl / |Σ negative pnl|      (0.0 when there is no loss)
 * </pre>
 * Pure function of its inputs.
 */
public final class BacktestStatistics {

    private BacktestStatistics() {}

    public static BacktestSummary summarize(List<BacktestEvent> events, int stepsReplayed, int skippedTicks,
                                            double initialEquity, double finalEquity) {
        int trades = 0;
        int vetoes = 0;
        int exposedSteps = 0;
        int wins = 0;
        double grossProfit = 0.0;
        double grossLoss   = 0.0;
        double sum = 0.0;

        double peak = initialEquity;
        double maxDrawdown = 0.0;

        for (BacktestEvent e : events) {
            if (e.signal().direction() != Direction.HOLD) trades++;
            if (e.signal().riskVerdict() == RiskVerdict.VETOED) vetoes++;

            double pnl = e.realizedPnl();
            sum += pnl;
            if (e.exposureAfter() != 0.0) {
                exposedSteps++;
                if (pnl > 0.0) wins++;
            }
            if (pnl > 0.0) grossProfit += pnl;
            if (pnl < 0.0) grossLoss   -= pnl;

            peak = Math.max(peak, e.equityAfter());
            if (peak > 0.0) {
                maxDrawdown = Math.max(maxDrawdown, 1.0 - e.equityAfter() / peak);
            }
        }

        int n = events.size();
        double sharpe = 0.0;
        if (n > 1) {
            double mean = sum / n;
            double sq = 0.0;
            for (BacktestEvent e : events) {
                double d = e.realizedPnl() - mean;
                sq += d * d;
            }
            double stdDev = Math.sqrt(sq / (n - 1));
            sharpe = stdDev > 0.0 ? mean / stdDev : 0.0;
        }

        return new BacktestSummary(
            stepsReplayed,
            n,
            skippedTicks,
            trades,
            vetoes,
            exposedSteps == 0 ? 0.0 : (double) wins / exposedSteps,
            initialEquity > 0.0 ? finalEquity / initialEquity - 1.0 : 0.0,
            sharpe,
            maxDrawdown,
            grossLoss > 0.0 ? grossProfit / grossLoss : 0.0);
    }
}
