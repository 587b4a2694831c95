package com.signalplatform.orchestrator.backtest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.model.BacktestEvent;
import com.signalplatform.common.model.BacktestResult;
import com.signalplatform.common.model.MarketSnapshot;
import com.signalplatform.common.model.Regime;
import com.signalplatform.common.risk.RiskBudget;
import com.signalplatform.orchestrator.catalog.PredictorCatalog;
import com.signalplatform.orchestrator.config.SignalPlatformProperties;
import com.signalplatform.orchestrator.pipeline.DecisionState;
import com.signalplatform.orchestrator.state.InstrumentStateArena;
import com.signalplatform.orchestrator.support.PipelineFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BacktestReplayerTest {

    private static final String EURUSD = "EURUSD";

    private final SignalPlatformProperties properties = PipelineFixtures.properties();
    private final ObjectMapper mapper = PipelineFixtures.objectMapper();
    private final PredictorCatalog catalog = PipelineFixtures.catalog(properties, mapper);
    private final InstrumentStateArena arena = new InstrumentStateArena(properties);
    private final BacktestReplayer replayer =
        new BacktestReplayer(PipelineFixtures.arbiter(properties), catalog, arena, mapper);

    private final List<MarketSnapshot> series = PipelineFixtures.series(EURUSD, 40);

    @Nested
    @DisplayName("determinism")
    class Determinism {

        @Test
        @DisplayName("two replays of the same input serialize to identical bytes")
        void identicalBytes() throws Exception {
            BacktestResult first  = replayer.replay(EURUSD, series, false);
            BacktestResult second = replayer.replay(EURUSD, series, false);

            assertArrayEquals(mapper.writeValueAsBytes(first), mapper.writeValueAsBytes(second));
        }

        @Test
        @DisplayName("verified replay passes and returns the same result as a plain replay")
        void verified() {
            BacktestResult verified = replayer.replayVerified(EURUSD, series, false);

            assertEquals(replayer.replay(EURUSD, series, false), verified);
        }

        @Test
        @DisplayName("input order does not matter; snapshots are replayed by timestamp")
        void shuffledInput() {
            List<MarketSnapshot> reversed = new ArrayList<>(series);
            java.util.Collections.reverse(reversed);

            assertEquals(replayer.replay(EURUSD, series, false), replayer.replay(EURUSD, reversed, false));
        }

        @Test
        @DisplayName("the non-deterministic advisory predictor is left out of replays")
        void advisoryExcluded() {
            BacktestResult result = replayer.replay(EURUSD, series, false);

            assertFalse(result.events().get(0).signal().predictorWeights().containsKey("llm-advisor"));
            assertEquals(catalog.deterministicPredictors().size(), result.events().get(0).signal().totalPredictors());
        }
    }

    @Nested
    @DisplayName("event log and summary")
    class EventLog {

        @Test
        @DisplayName("warm-up ticks are skipped, every later tick produces one event")
        void counts() {
            BacktestResult result = replayer.replay(EURUSD, series, false);

            assertEquals(40, result.summary().stepsReplayed());
            assertEquals(PipelineFixtures.MIN_LOOKBACK, result.summary().skippedTicks());
            assertEquals(40 - PipelineFixtures.MIN_LOOKBACK, result.events().size());
            assertEquals(result.events().size(), result.summary().decisions());
            assertEquals(series.get(PipelineFixtures.MIN_LOOKBACK).timestamp(), result.events().get(0).timestamp());
        }

        @Test
        @DisplayName("P&L of step i is the exposure after i times the move to i+1; the last step realizes nothing")
        void pnlFromNextMove() {
            BacktestResult result = replayer.replay(EURUSD, series, false);
            List<BacktestEvent> events = result.events();

            for (int j = 0; j < events.size() - 1; j++) {
                int i = j + PipelineFixtures.MIN_LOOKBACK;
                double move = series.get(i + 1).last() / series.get(i).last() - 1.0;
                assertEquals(events.get(j).exposureAfter() * move, events.get(j).realizedPnl(), 1e-12);
            }
            assertEquals(0.0, events.get(events.size() - 1).realizedPnl());
        }

        @Test
        @DisplayName("P&L of exposure seeded before the first event is booked on that event")
        void seededExposureBookedOnFirstEvent() {
            DecisionState live = arena.stateFor(EURUSD).decisionState();
            double equity = live.riskBudget().equity();
            live.riskBudget().restore(new RiskBudget.Snapshot(0.3, equity, equity, 0.0));

            BacktestResult result = replayer.replay(EURUSD, series, true);
            List<BacktestEvent> events = result.events();

            double growth = 1.0;
            for (BacktestEvent e : events) {
                growth *= 1.0 + e.realizedPnl();
            }
            assertEquals(1.0 + result.summary().totalReturn(), growth, 1e-9);

            double warmUp = 1.0;
            for (int i = 1; i <= PipelineFixtures.MIN_LOOKBACK; i++) {
                warmUp *= 1.0 + 0.3 * (series.get(i).last() / series.get(i - 1).last() - 1.0);
            }
            int first = PipelineFixtures.MIN_LOOKBACK;
            double firstMove = series.get(first + 1).last() / series.get(first).last() - 1.0;
            double expected = warmUp * (1.0 + events.get(0).exposureAfter() * firstMove) - 1.0;
            assertEquals(expected, events.get(0).realizedPnl(), 1e-9);
        }

        @Test
        @DisplayName("empty input yields an empty result")
        void empty() {
            BacktestResult result = replayer.replay(EURUSD, List.of(), false);

            assertTrue(result.events().isEmpty());
            assertEquals(0, result.summary().stepsReplayed());
            assertEquals(0.0, result.summary().totalReturn());
        }
    }

    @Nested
    @DisplayName("no look-ahead")
    class NoLookAhead {

        @Test
        @DisplayName("changing prices after step k does not change any signal up to k")
        void futureDoesNotLeak() {
            int k = 20;
            List<MarketSnapshot> altered = new ArrayList<>(series.subList(0, k + 1));
            for (int i = k + 1; i < series.size(); i++) {
                altered.add(PipelineFixtures.snapshot(EURUSD, i, 50.0 + i));
            }

            List<BacktestEvent> a = replayer.replay(EURUSD, series, false).events();
            List<BacktestEvent> b = replayer.replay(EURUSD, altered, false).events();

            for (int j = 0; j <= k - PipelineFixtures.MIN_LOOKBACK; j++) {
                assertEquals(a.get(j).signal(), b.get(j).signal(), "signal at event " + j);
            }
        }
    }

    @Nested
    @DisplayName("isolation from live state")
    class Isolation {

        @Test
        @DisplayName("seeding from live copies the state and leaves it untouched")
        void seedIsCopy() {
            DecisionState live = arena.stateFor(EURUSD).decisionState();
            live.riskBudget().applyPnl(-0.05);
            live.reliabilities().update("linear-momentum", Regime.TRENDING, 0.0);
            RiskBudget.Snapshot riskBefore = live.riskBudget().snapshot();
            Map<String, Map<Regime, Double>> reliabilityBefore = live.reliabilities().snapshot();

            BacktestResult seeded = replayer.replay(EURUSD, series, true);
            BacktestResult fresh  = replayer.replay(EURUSD, series, false);

            assertEquals(riskBefore, live.riskBudget().snapshot());
            assertEquals(reliabilityBefore, live.reliabilities().snapshot());
            assertTrue(live.regimeDetector().window().isEmpty());
            assertNotEquals(fresh.events().get(0).equityAfter(), seeded.events().get(0).equityAfter());
        }

        @Test
        @DisplayName("seeding without live state falls back to fresh state")
        void seedWithoutLive() {
            assertEquals(replayer.replay(EURUSD, series, false), replayer.replay(EURUSD, series, true));
        }
    }

    @Nested
    @DisplayName("input validation and multi-instrument runs")
    class Inputs {

        @Test
        @DisplayName("duplicate timestamps are rejected")
        void duplicates() {
            List<MarketSnapshot> dup = new ArrayList<>(series);
            dup.add(series.get(3));

            assertThrows(IllegalArgumentException.class, () -> replayer.replay(EURUSD, dup, false));
        }

        @Test
        @DisplayName("snapshots of another instrument are rejected")
        void foreignInstrument() {
            List<MarketSnapshot> mixed = new ArrayList<>(series);
            mixed.add(PipelineFixtures.snapshot("GBPUSD", 100, 1.25));

            assertThrows(IllegalArgumentException.class, () -> replayer.replay(EURUSD, mixed, false));
        }

        @Test
        @DisplayName("several instruments replay independently, keyed in instrument order")
        void replayAll() {
            Map<String, List<MarketSnapshot>> data = Map.of(
                "USDJPY", PipelineFixtures.series("USDJPY", 30),
                EURUSD, series);

            Map<String, BacktestResult> results = replayer.replayAll(data, false, true).block(Duration.ofSeconds(30));

            assertEquals(List.of(EURUSD, "USDJPY"), new ArrayList<>(results.keySet()));
            assertEquals(replayer.replay(EURUSD, series, false), results.get(EURUSD));
            assertEquals("USDJPY", results.get("USDJPY").instrument());
        }
    }
}
