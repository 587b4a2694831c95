package com.signalplatform.analysis.dispatch;

import com.signalplatform.analysis.predictor.Predictor;
import com.signalplatform.analysis.predictor.PredictorDescriptor;
import com.signalplatform.analysis.predictor.PredictorType;
import com.signalplatform.common.exception.PredictorException;
import com.signalplatform.common.model.Direction;
import com.signalplatform.common.model.FeatureVector;
import com.signalplatform.common.model.ModelPrediction;
import com.signalplatform.common.model.PredictorResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class PredictorDispatchServiceTest {

    private static final FeatureVector FEATURES = new FeatureVector("market-v1", "EURUSD",
        Instant.parse("2024-04-01T12:00:00Z"), List.of(0.1, 0.2));

    private final PredictorDispatchService service = new PredictorDispatchService();

    private static Predictor stub(String id, long timeoutMs, Function<FeatureVector, Mono<ModelPrediction>> body) {
        PredictorDescriptor d = new PredictorDescriptor(id, PredictorType.STATISTICAL, "market-v1",
            Set.of(), timeoutMs, 1.0, null);
        return new Predictor() {
            @Override
            public PredictorDescriptor descriptor() {
                return d;
            }

            @Override
            public Mono<ModelPrediction> predict(FeatureVector features) {
                return body.apply(features);
            }
        };
    }

    private static Mono<ModelPrediction> answer(String id, Direction direction, FeatureVector f) {
        return Mono.just(new ModelPrediction(id, direction, 0.7, f.timestamp()));
    }

    @Test
    @DisplayName("slow predictor times out without blocking the others; order follows the registry")
    void timeoutIsolated() {
        List<Predictor> predictors = List.of(
            stub("slow", 50, f -> Mono.never()),
            stub("fast", 500, f -> answer("fast", Direction.BUY, f)),
            stub("late", 500, f -> answer("late", Direction.SELL, f).delayElement(Duration.ofMillis(100))));

        long start = System.nanoTime();
        List<PredictorResult> results = service.dispatchAll(predictors, FEATURES, DispatchMode.CONCURRENT)
            .block(Duration.ofSeconds(5));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals(List.of("slow", "fast", "late"), results.stream().map(PredictorResult::predictorId).toList());
        assertFalse(results.get(0).responded());
        assertTrue(results.get(0).timedOut());
        assertTrue(results.get(1).responded());
        assertEquals(Direction.SELL, results.get(2).prediction().direction());
        assertTrue(elapsedMs < 2_000, "dispatch waited on a hung predictor");
    }

    @Test
    @DisplayName("errors, thrown exceptions and empty results become failed entries")
    void failuresAbsorbed() {
        List<Predictor> predictors = List.of(
            stub("error", 500, f -> Mono.error(new PredictorException("error", "model file missing"))),
            stub("throws", 500, f -> { throw new IllegalStateException("boom"); }),
            stub("empty", 500, f -> Mono.empty()),
            stub("ok", 500, f -> answer("ok", Direction.HOLD, f)));

        for (DispatchMode mode : DispatchMode.values()) {
            List<PredictorResult> results = service.dispatchAll(predictors, FEATURES, mode)
                .block(Duration.ofSeconds(5));
            assertEquals(4, results.size());
            assertTrue(results.get(0).failure().contains("model file missing"));
            assertFalse(results.get(0).timedOut());
            assertEquals("boom", results.get(1).failure());
            assertFalse(results.get(2).responded());
            assertTrue(results.get(3).responded());
        }
    }

    @Test
    @DisplayName("sequential mode runs on the caller thread in registry order")
    void sequentialOnCallerThread() {
        String caller = Thread.currentThread().getName();
        List<String> threads = new java.util.ArrayList<>();
        List<Predictor> predictors = List.of(
            stub("a", 1, f -> Mono.fromCallable(() -> {
                threads.add(Thread.currentThread().getName());
                return new ModelPrediction("a", Direction.BUY, 0.5, f.timestamp());
            })),
            stub("b", 1, f -> Mono.fromCallable(() -> {
                threads.add(Thread.currentThread().getName());
                return new ModelPrediction("b", Direction.SELL, 0.5, f.timestamp());
            })));

        List<PredictorResult> results = service.dispatchAll(predictors, FEATURES, DispatchMode.SEQUENTIAL)
            .block(Duration.ofSeconds(5));

        assertEquals(List.of(caller, caller), threads);
        assertTrue(results.stream().allMatch(PredictorResult::responded));
    }
}
