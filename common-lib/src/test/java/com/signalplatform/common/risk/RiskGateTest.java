package com.signalplatform.common.risk;

import com.signalplatform.common.model.BlendedSignal;
import com.signalplatform.common.model.Direction;
import com.signalplatform.common.model.MarketSnapshot;
import com.signalplatform.common.model.Regime;
import com.signalplatform.common.model.RegimeState;
import com.signalplatform.common.model.RiskAssessment;
import com.signalplatform.common.model.RiskVerdict;
import com.signalplatform.common.model.TradeSignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RiskGateTest {

    private static final String INSTRUMENT = "XAUUSD";
    private static final RiskLimits LIMITS = new RiskLimits(0.10, 0.50, 1.00, 0.20);

    private static BlendedSignal blended(Direction direction, double confidence, double size) {
        return new BlendedSignal(direction, confidence, direction.sign(), size, 3, 3,
                                 Map.of("p1", 1.0), List.of(), List.of());
    }

    private static RiskBudget budgetWithExposure(double exposure) {
        RiskBudget budget = new RiskBudget(LIMITS, 100_000.0);
        budget.adjustExposure(exposure);
        return budget;
    }

    @Nested
    @DisplayName("rule 1: per-instrument limit")
    class InstrumentLimitTests {

        @Test
        @DisplayName("growing past the instrument limit → veto")
        void exceedsInstrumentLimit_veto() {
            RiskAssessment a = RiskGate.evaluate(blended(Direction.BUY, 0.9, 0.09),
                budgetWithExposure(0.45), Map.of(), INSTRUMENT);
            assertEquals(RiskVerdict.VETOED, a.verdict());
            assertEquals(Direction.HOLD, a.direction());
            assertEquals(0.0, a.positionSizeFraction());
            assertTrue(a.reason().contains("per-instrument limit"));
        }

        @Test
        @DisplayName("reducing an over-limit position is allowed")
        void reducingExposure_passes() {
            RiskAssessment a = RiskGate.evaluate(blended(Direction.SELL, 0.9, 0.09),
                budgetWithExposure(0.55), Map.of(), INSTRUMENT);
            assertEquals(RiskVerdict.PASSED, a.verdict());
            assertEquals(0.09, a.positionSizeFraction());
        }

        @Test
        @DisplayName("the limit is checked against the size left after the max position cap")
        void limitUsesCappedSize() {
            RiskAssessment a = RiskGate.evaluate(blended(Direction.BUY, 0.9, 0.20),
                budgetWithExposure(0.35), Map.of(), INSTRUMENT);
            assertEquals(RiskVerdict.SCALED, a.verdict());
            assertEquals(Direction.BUY, a.direction());
            assertEquals(0.10, a.positionSizeFraction(), 1e-12);

            RiskAssessment over = RiskGate.evaluate(blended(Direction.BUY, 0.9, 0.20),
                budgetWithExposure(0.45), Map.of(), INSTRUMENT);
            assertEquals(RiskVerdict.VETOED, over.verdict());
            assertTrue(over.reason().contains("per-instrument limit"));
        }
    }

    @Nested
    @DisplayName("rule 2: aggregate headroom")
    class AggregateTests {

        @Test
        @DisplayName("95% of aggregate used, +10% proposed → scaled to the 5% headroom")
        void scaledToHeadroom() {
            RiskAssessment a = RiskGate.evaluate(blended(Direction.BUY, 1.0, 0.10),
                budgetWithExposure(0.0), Map.of("EURUSD", 0.50, "GBPUSD", -0.45), INSTRUMENT);
            assertEquals(RiskVerdict.SCALED, a.verdict());
            assertEquals(Direction.BUY, a.direction());
            assertEquals(0.05, a.positionSizeFraction(), 1e-9);
            assertNotNull(a.reason());
        }

        @Test
        @DisplayName("no headroom left → veto")
        void noHeadroom_veto() {
            RiskAssessment a = RiskGate.evaluate(blended(Direction.SELL, 0.8, 0.05),
                budgetWithExposure(0.0), Map.of("EURUSD", 0.50, "GBPUSD", 0.50), INSTRUMENT);
            assertEquals(RiskVerdict.VETOED, a.verdict());
        }

        @Test
        @DisplayName("proposal above maxPositionSize is capped")
        void cappedAtMaxPositionSize() {
            RiskAssessment a = RiskGate.evaluate(blended(Direction.BUY, 1.0, 0.25),
                budgetWithExposure(0.0), Map.of(), INSTRUMENT);
            assertEquals(RiskVerdict.SCALED, a.verdict());
            assertEquals(0.10, a.positionSizeFraction());
        }

        @Test
        @DisplayName("own entry in openPositions is superseded by the budget")
        void ownEntryIgnored() {
            RiskAssessment a = RiskGate.evaluate(blended(Direction.BUY, 1.0, 0.10),
                budgetWithExposure(0.20), Map.of(INSTRUMENT, 0.90), INSTRUMENT);
            assertEquals(RiskVerdict.PASSED, a.verdict());
        }
    }

    @Nested
    @DisplayName("rule 3: drawdown circuit breaker")
    class DrawdownTests {

        @Test
        @DisplayName("breached drawdown vetoes any direction and keeps blended confidence in the signal")
        void drawdownBreached_vetoAll() {
            RiskBudget budget = budgetWithExposure(0.0);
            budget.applyPnl(0.10);
            budget.applyPnl(-0.25);
            assertTrue(budget.drawdown() >= LIMITS.maxDrawdown());

            for (Direction d : Direction.values()) {
                BlendedSignal b = blended(d, 0.93, d == Direction.HOLD ? 0.0 : 0.05);
                RiskAssessment a = RiskGate.evaluate(b, budget, Map.of(), INSTRUMENT);
                assertEquals(RiskVerdict.VETOED, a.verdict());
                assertTrue(a.reason().contains("drawdown"));

                MarketSnapshot snap = MarketSnapshot.of(INSTRUMENT, Instant.EPOCH, 1.0, 1.0, 1.0, 1.0);
                TradeSignal signal = TradeSignal.of(snap, new RegimeState(Regime.TRENDING, 0.7, Instant.EPOCH), b, a);
                assertEquals(Direction.HOLD, signal.direction());
                assertEquals(0.93, signal.confidence());
                assertEquals(d, signal.blendedDirection());
            }
        }
    }

    @Nested
    @DisplayName("bounds that hold for every input")
    class Bounds {

        @Test
        @DisplayName("output size never exceeds the proposed size")
        void monotoneNonIncreasing() {
            double[] exposures = {-0.6, -0.3, 0.0, 0.2, 0.45, 0.6};
            double[] sizes = {0.0, 0.01, 0.05, 0.1, 0.3};
            double[] others = {0.0, 0.4, 0.9, 1.2};
            for (double exposure : exposures) {
                for (double size : sizes) {
                    for (double other : others) {
                        for (Direction d : Direction.values()) {
                            RiskAssessment a = RiskGate.evaluate(blended(d, 0.8, size),
                                budgetWithExposure(exposure), Map.of("OTHER", other), INSTRUMENT);
                            assertTrue(a.positionSizeFraction() <= size,
                                () -> "size increased by the gate");
                            assertTrue(a.positionSizeFraction() >= 0.0);
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("commit applies the signed size to exposure")
        void commitUpdatesExposure() {
            RiskBudget budget = budgetWithExposure(0.1);
            MarketSnapshot snap = MarketSnapshot.of(INSTRUMENT, Instant.EPOCH, 1.0, 1.0, 1.0, 1.0);
            BlendedSignal b = blended(Direction.SELL, 0.8, 0.04);
            TradeSignal signal = TradeSignal.of(snap, RegimeState.UNDETERMINED, b,
                RiskGate.evaluate(b, budget, Map.of(), INSTRUMENT));
            RiskGate.commit(budget, signal);
            assertEquals(0.06, budget.exposure(), 1e-12);
        }
    }
}
