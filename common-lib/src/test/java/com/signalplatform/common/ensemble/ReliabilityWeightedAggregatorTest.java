package com.signalplatform.common.ensemble;

import com.signalplatform.common.model.BlendedSignal;
import com.signalplatform.common.model.Direction;
import com.signalplatform.common.model.ModelPrediction;
import com.signalplatform.common.model.PredictorResult;
import com.signalplatform.common.model.Regime;
import com.signalplatform.common.model.RegimeState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReliabilityWeightedAggregatorTest {

    private static final Instant TS = Instant.parse("2024-05-06T14:00:00Z");
    private static final RegimeState TRENDING = new RegimeState(Regime.TRENDING, 0.9, TS);

    private final EnsembleSettings settings = EnsembleSettings.defaults();
    private final ReliabilityWeightedAggregator aggregator = new ReliabilityWeightedAggregator(settings);
    private ReliabilityBook book;

    @BeforeEach
    void setUp() {
        book = new ReliabilityBook(settings);
    }

    private static PredictorResult vote(String id, Direction direction, double confidence) {
        return PredictorResult.success(id, 1.0, Set.of(),
            new ModelPrediction(id, direction, confidence, TS));
    }

    private static PredictorResult weighted(String id, double baseWeight, Direction direction, double confidence) {
        return PredictorResult.success(id, baseWeight, Set.of(),
            new ModelPrediction(id, direction, confidence, TS));
    }

    private static PredictorResult timedOut(String id) {
        return PredictorResult.failed(id, 1.0, Set.of(), "timed out after 50ms", true);
    }

    /** Moves the (id, TRENDING) reliability to exactly {@code target} via restore. */
    private void setReliability(Map<String, Double> targets) {
        Map<String, Map<Regime, Double>> persisted = new java.util.LinkedHashMap<>();
        targets.forEach((id, score) -> persisted.put(id, Map.of(Regime.TRENDING, score)));
        book.restore(persisted);
    }

    @Nested
    @DisplayName("weighted vote")
    class VoteTests {

        @Test
        @DisplayName("buy/buy/sell 0.8/0.6/0.9, reliability 1.0/0.5/1.0 → BUY at 0.80")
        void reliabilityScenario() {
            setReliability(Map.of("p1", 1.0, "p2", 0.5, "p3", 1.0));
            List<PredictorResult> results = List.of(
                vote("p1", Direction.BUY, 0.8),
                vote("p2", Direction.BUY, 0.6),
                vote("p3", Direction.SELL, 0.9));

            BlendedSignal blended = aggregator.aggregate(results, TRENDING, book);

            // weights 1/2.5, 0.5/2.5, 1/2.5 = 0.4, 0.2, 0.4
            assertEquals(Direction.BUY, blended.direction());
            assertEquals(0.4, blended.weights().get("p1"), 1e-12);
            assertEquals(0.2, blended.weights().get("p2"), 1e-12);
            assertEquals(0.4, blended.weights().get("p3"), 1e-12);
            assertEquals(0.2, blended.weightedScore(), 1e-12);
            assertEquals(0.4 * 0.8 + 0.2 * 0.6 + 0.4 * 0.9, blended.confidence(), 1e-12);
            assertEquals(blended.confidence() * 0.10, blended.positionSizeFraction(), 1e-12);
            assertFalse(blended.degraded());
        }

        @Test
        @DisplayName("exactly balanced vote → HOLD with zero size")
        void tieBreak_hold() {
            BlendedSignal blended = aggregator.aggregate(List.of(
                vote("p1", Direction.BUY, 0.7),
                vote("p2", Direction.SELL, 0.7)), TRENDING, book);
            assertEquals(Direction.HOLD, blended.direction());
            assertEquals(0.0, blended.weightedScore());
            assertEquals(0.0, blended.positionSizeFraction());
            assertEquals(0.7, blended.confidence(), 1e-12);
        }

        @Test
        @DisplayName("all reliabilities zero → equal weights")
        void zeroReliability_equalWeights() {
            setReliability(Map.of("p1", 0.0, "p2", 0.0));
            BlendedSignal blended = aggregator.aggregate(List.of(
                vote("p1", Direction.SELL, 0.6),
                vote("p2", Direction.SELL, 0.4)), TRENDING, book);
            assertEquals(Direction.SELL, blended.direction());
            assertEquals(0.5, blended.weights().get("p1"), 1e-12);
            assertEquals(0.5, blended.confidence(), 1e-12);
        }

        @Test
        @DisplayName("predictor outside its validated regimes is tagged and discounted")
        void outsideRegime_lowConfidence() {
            PredictorResult rangingOnly = PredictorResult.success("ranger", 1.0, Set.of(Regime.RANGING),
                new ModelPrediction("ranger", Direction.BUY, 0.8, TS));
            BlendedSignal blended = aggregator.aggregate(List.of(rangingOnly), TRENDING, book);
            assertEquals(List.of("ranger"), blended.lowConfidence());
            assertEquals(Direction.BUY, blended.direction());
            assertEquals(0.4, blended.confidence(), 1e-12);
        }
    }

    @Nested
    @DisplayName("degraded ensembles")
    class DegradedTests {

        @Test
        @DisplayName("failed predictor excluded from normalization, confidence scaled by response fraction")
        void failedExcludedAndScaled() {
            BlendedSignal blended = aggregator.aggregate(List.of(
                vote("p1", Direction.BUY, 0.9),
                vote("p2", Direction.BUY, 0.6),
                timedOut("p3")), TRENDING, book);
            assertEquals(Direction.BUY, blended.direction());
            assertEquals(2, blended.weights().size());
            assertEquals(0.5, blended.weights().get("p1"), 1e-12);
            assertEquals(0.75 * 2.0 / 3.0, blended.confidence(), 1e-12);
            assertTrue(blended.degraded());
            assertEquals(List.of("p3"), blended.failed());
        }

        @Test
        @DisplayName("every predictor failed → HOLD with zero confidence")
        void allFailed_hold() {
            BlendedSignal blended = aggregator.aggregate(List.of(timedOut("p1"), timedOut("p2")), TRENDING, book);
            assertEquals(Direction.HOLD, blended.direction());
            assertEquals(0.0, blended.confidence());
            assertEquals(0, blended.respondedPredictors());
            assertEquals(2, blended.totalPredictors());
        }

        @Test
        @DisplayName("adding failures never raises confidence above the full ensemble")
        void degradedNeverExceedsFull() {
            Direction[] directions = {Direction.BUY, Direction.SELL, Direction.HOLD};
            double[] confidences = {0.0, 0.35, 0.8, 1.0};
            for (Direction d1 : directions) {
                for (Direction d2 : directions) {
                    for (double c1 : confidences) {
                        for (double c2 : confidences) {
                            List<PredictorResult> full = List.of(vote("a", d1, c1), vote("b", d2, c2));
                            BlendedSignal base = aggregator.aggregate(full, TRENDING, book);
                            for (int failures = 1; failures <= 3; failures++) {
                                List<PredictorResult> degraded = new ArrayList<>(full);
                                for (int f = 0; f < failures; f++) degraded.add(timedOut("f" + f));
                                BlendedSignal worse = aggregator.aggregate(degraded, TRENDING, book);
                                assertEquals(base.direction(), worse.direction());
                                assertTrue(worse.confidence() <= base.confidence(),
                                    () -> "degraded confidence exceeded full ensemble");
                            }
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("unequal base weights: failures scale the responders' blend, never add to it")
        void unequalWeights_degradedNeverExceedsFull() {
            double[] confidences = {0.1, 0.5, 0.9};
            for (double heavyConf : confidences) {
                for (double lightConf : confidences) {
                    List<PredictorResult> full = List.of(
                        weighted("heavy", 3.0, Direction.BUY, heavyConf),
                        weighted("light", 1.0, Direction.SELL, lightConf));
                    BlendedSignal base = aggregator.aggregate(full, TRENDING, book);
                    assertEquals(Direction.BUY, base.direction());
                    assertEquals(0.75 * heavyConf + 0.25 * lightConf, base.confidence(), 1e-12);

                    List<PredictorResult> degraded = new ArrayList<>(full);
                    degraded.add(PredictorResult.failed("big-failed", 5.0, Set.of(), "timed out after 50ms", true));
                    BlendedSignal worse = aggregator.aggregate(degraded, TRENDING, book);
                    assertEquals(base.direction(), worse.direction());
                    assertEquals(base.weights(), worse.weights());
                    assertEquals(base.confidence() * 2.0 / 3.0, worse.confidence(), 1e-12);
                    assertTrue(worse.confidence() <= base.confidence());
                }
            }
        }

        @Test
        @DisplayName("failed heavy-weight predictor: its weight is renormalized onto the responders")
        void heavyWeightFailure_renormalized() {
            BlendedSignal blended = aggregator.aggregate(List.of(
                PredictorResult.failed("heavy", 3.0, Set.of(), "model unavailable", false),
                weighted("light", 1.0, Direction.SELL, 0.8)), TRENDING, book);
            assertEquals(Direction.SELL, blended.direction());
            assertEquals(Map.of("light", 1.0), blended.weights());
            assertEquals(0.8 * 1.0 / 2.0, blended.confidence(), 1e-12);
            assertEquals(List.of("heavy"), blended.failed());
        }

        @Test
        @DisplayName("empty result list → guard fallback HOLD")
        void guard_emptyResults() {
            BlendedSignal blended = AggregationGuard.resolve(List.of(), TRENDING, book, aggregator);
            assertEquals(Direction.HOLD, blended.direction());
            assertEquals(0.0, blended.confidence());
        }
    }
}
