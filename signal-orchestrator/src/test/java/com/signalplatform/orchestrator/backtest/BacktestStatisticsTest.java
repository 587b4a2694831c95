package com.signalplatform.orchestrator.backtest;

import com.signalplatform.common.model.BacktestEvent;
import com.signalplatform.common.model.BacktestSummary;
import com.signalplatform.common.model.Direction;
import com.signalplatform.common.model.Regime;
import com.signalplatform.common.model.RiskVerdict;
import com.signalplatform.common.model.TradeSignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BacktestStatisticsTest {

    private static final Instant T0 = Instant.parse("2024-04-01T00:00:00Z");

    private static BacktestEvent event(int i, Direction direction, RiskVerdict verdict,
                                       double exposure, double pnl, double equity) {
        TradeSignal signal = new TradeSignal("EURUSD", T0.plusSeconds(i), direction, 0.05, 0.5,
            direction, 0.05, Regime.TRENDING, 0.8, verdict, null, false, 1, 1, Map.of("p", 1.0));
        return new BacktestEvent(T0.plusSeconds(i), signal, exposure, pnl, equity);
    }

    @Test
    @DisplayName("returns, win rate, profit factor and drawdown follow the equity path")
    void summary() {
        List<BacktestEvent> events = List.of(
            event(0, Direction.BUY,  RiskVerdict.PASSED, 0.1,  0.02, 102.0),
            event(1, Direction.HOLD, RiskVerdict.PASSED, 0.1, -0.01, 100.98),
            event(2, Direction.HOLD, RiskVerdict.VETOED, 0.0,  0.0,  100.98),
            event(3, Direction.SELL, RiskVerdict.SCALED, 0.1,  0.01, 101.99));

        BacktestSummary s = BacktestStatistics.summarize(events, 6, 2, 100.0, 101.99);

        assertEquals(6, s.stepsReplayed());
        assertEquals(4, s.decisions());
        assertEquals(2, s.skippedTicks());
        assertEquals(2, s.totalTrades());
        assertEquals(1, s.vetoes());
        assertEquals(2.0 / 3.0, s.winRate(), 1e-12);
        assertEquals(0.0199, s.totalReturn(), 1e-9);
        assertEquals(3.0, s.profitFactor(), 1e-9);
        assertEquals(1.0 - 100.98 / 102.0, s.maxDrawdown(), 1e-12);
        assertTrue(s.sharpeRatio() > 0.0);
    }

    @Test
    @DisplayName("without losses the profit factor is 0 and a flat P&L series has Sharpe 0")
    void degenerate() {
        List<BacktestEvent> events = List.of(
            event(0, Direction.BUY, RiskVerdict.PASSED, 0.1, 0.01, 101.0),
            event(1, Direction.BUY, RiskVerdict.PASSED, 0.1, 0.01, 102.01));

        BacktestSummary s = BacktestStatistics.summarize(events, 2, 0, 100.0, 102.01);

        assertEquals(0.0, s.profitFactor());
        assertEquals(0.0, s.sharpeRatio());
        assertEquals(0.0, s.maxDrawdown());
        assertEquals(1.0, s.winRate());
    }

    @Test
    @DisplayName("no events gives an all-zero summary")
    void empty() {
        BacktestSummary s = BacktestStatistics.summarize(List.of(), 3, 3, 100.0, 100.0);

        assertEquals(0, s.decisions());
        assertEquals(0.0, s.winRate());
        assertEquals(0.0, s.totalReturn());
        assertEquals(0.0, s.sharpeRatio());
    }
}
