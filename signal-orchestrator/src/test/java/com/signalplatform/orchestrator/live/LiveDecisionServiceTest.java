package com.signalplatform.orchestrator.live;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.analysis.predictor.Predictor;
import com.signalplatform.common.exception.InsufficientHistoryException;
import com.signalplatform.common.exception.MissedTickException;
import com.signalplatform.common.model.Direction;
import com.signalplatform.common.model.MarketSnapshot;
import com.signalplatform.common.model.ModelPrediction;
import com.signalplatform.common.model.TradeSignal;
import com.signalplatform.orchestrator.config.SignalPlatformProperties;
import com.signalplatform.orchestrator.logger.DecisionFlowLogger;
import com.signalplatform.orchestrator.state.InstrumentState;
import com.signalplatform.orchestrator.state.InstrumentStateArena;
import com.signalplatform.orchestrator.support.PipelineFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LiveDecisionServiceTest {

    private static final String EURUSD = "EURUSD";
    private static final Duration WAIT = Duration.ofSeconds(10);

    private final ObjectMapper mapper = PipelineFixtures.objectMapper();

    private LiveDecisionService service(SignalPlatformProperties properties, InstrumentStateArena arena,
                                        List<Predictor> predictors) {
        return new LiveDecisionService(PipelineFixtures.arbiter(properties), arena,
            PipelineFixtures.fixedCatalog(properties, mapper, predictors), new DecisionFlowLogger(), properties);
    }

    @Test
    @DisplayName("cycles of one instrument never overlap and complete in tick order")
    void serializedPerInstrument() {
        SignalPlatformProperties properties = PipelineFixtures.properties();
        InstrumentStateArena arena = new InstrumentStateArena(properties);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        Predictor slow = PipelineFixtures.predictor("slow", 1_000, f -> Mono.fromCallable(() -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            Thread.sleep(20);
            inFlight.decrementAndGet();
            return new ModelPrediction("slow", Direction.BUY, 0.5, f.timestamp());
        }));
        LiveDecisionService service = service(properties, arena, List.of(slow));
        List<MarketSnapshot> series = PipelineFixtures.series(EURUSD, 12);

        List<Mono<TradeSignal>> pending = new ArrayList<>();
        pending.add(service.submit(EURUSD, series.subList(0, 6)));
        for (int i = 6; i < series.size(); i++) {
            pending.add(service.submit(EURUSD, List.of(series.get(i))));
        }
        List<TradeSignal> signals = new ArrayList<>();
        for (Mono<TradeSignal> p : pending) {
            signals.add(p.block(WAIT));
        }

        assertEquals(1, maxInFlight.get());
        for (int i = 0; i < signals.size(); i++) {
            assertEquals(series.get(5 + i).timestamp(), signals.get(i).timestamp());
        }
        assertEquals(series.size(), arena.stateFor(EURUSD).history().size());
    }

    @Test
    @DisplayName("a tick without enough history is rejected but still recorded")
    void insufficientHistory() {
        SignalPlatformProperties properties = PipelineFixtures.properties();
        InstrumentStateArena arena = new InstrumentStateArena(properties);
        LiveDecisionService service = service(properties, arena,
            List.of(PipelineFixtures.fixed("p", Direction.BUY, 0.7)));
        List<MarketSnapshot> series = PipelineFixtures.series(EURUSD, 6);

        assertThrows(InsufficientHistoryException.class,
            () -> service.submit(EURUSD, series.subList(0, 3)).block(WAIT));
        assertEquals(3, arena.stateFor(EURUSD).history().size());

        assertThrows(InsufficientHistoryException.class,
            () -> service.submit(EURUSD, List.of(series.get(3))).block(WAIT));
        assertThrows(InsufficientHistoryException.class,
            () -> service.submit(EURUSD, List.of(series.get(4))).block(WAIT));
        TradeSignal signal = service.submit(EURUSD, List.of(series.get(5))).block(WAIT);
        assertEquals(Direction.BUY, signal.direction());
    }

    @Test
    @DisplayName("a cycle past the deadline is a missed tick; the lane moves on to the next tick")
    void missedTick() {
        SignalPlatformProperties properties = PipelineFixtures.properties(Duration.ofMillis(200));
        InstrumentStateArena arena = new InstrumentStateArena(properties);
        AtomicBoolean hang = new AtomicBoolean(true);
        Predictor flaky = PipelineFixtures.predictor("flaky", 10_000, f -> hang.get()
            ? Mono.never()
            : Mono.just(new ModelPrediction("flaky", Direction.SELL, 0.6, f.timestamp())));
        LiveDecisionService service = service(properties, arena, List.of(flaky));
        List<MarketSnapshot> series = PipelineFixtures.series(EURUSD, 8);

        MissedTickException missed = assertThrows(MissedTickException.class,
            () -> service.submit(EURUSD, series.subList(0, 6)).block(WAIT));
        assertEquals(series.get(5).timestamp(), missed.getTickTimestamp());

        hang.set(false);
        TradeSignal next = service.submit(EURUSD, List.of(series.get(6))).block(WAIT);
        assertEquals(Direction.SELL, next.direction());
        assertEquals(series.get(6).timestamp(), next.timestamp());
    }

    @Test
    @DisplayName("a missed tick still enters the regime window, in step with the price history")
    void missedTickAdvancesRegimeWindow() {
        SignalPlatformProperties properties = PipelineFixtures.properties(Duration.ofMillis(200));
        InstrumentStateArena arena = new InstrumentStateArena(properties);
        Predictor stuck = PipelineFixtures.predictor("stuck", 10_000, f -> Mono.never());
        LiveDecisionService service = service(properties, arena, List.of(stuck));
        List<MarketSnapshot> series = PipelineFixtures.series(EURUSD, 7);

        assertThrows(MissedTickException.class,
            () -> service.submit(EURUSD, series.subList(0, 6)).block(WAIT));

        InstrumentState state = arena.stateFor(EURUSD);
        List<MarketSnapshot> window = state.decisionState().regimeDetector().window();
        assertEquals(6, state.history().size());
        assertEquals(series.get(5).timestamp(), window.get(window.size() - 1).timestamp());

        assertThrows(MissedTickException.class,
            () -> service.submit(EURUSD, List.of(series.get(6))).block(WAIT));
        window = state.decisionState().regimeDetector().window();
        assertEquals(series.get(6).timestamp(), window.get(window.size() - 1).timestamp());
    }

    @Test
    @DisplayName("stale ticks and foreign instruments are rejected as bad requests")
    void rejectsBadTicks() {
        SignalPlatformProperties properties = PipelineFixtures.properties();
        InstrumentStateArena arena = new InstrumentStateArena(properties);
        LiveDecisionService service = service(properties, arena,
            List.of(PipelineFixtures.fixed("p", Direction.BUY, 0.7)));
        List<MarketSnapshot> series = PipelineFixtures.series(EURUSD, 7);

        service.submit(EURUSD, series).block(WAIT);

        assertThrows(IllegalArgumentException.class,
            () -> service.submit(EURUSD, List.of(series.get(6))).block(WAIT));
        assertThrows(IllegalArgumentException.class,
            () -> service.submit(EURUSD, List.of(PipelineFixtures.snapshot("GBPUSD", 9, 1.2))).block(WAIT));
        assertThrows(IllegalArgumentException.class, () -> service.submit(EURUSD, List.of()).block(WAIT));
    }

    @Test
    @DisplayName("the next tick settles the previous decision against the realized move")
    void outcomeSettled() {
        SignalPlatformProperties properties = PipelineFixtures.properties();
        InstrumentStateArena arena = new InstrumentStateArena(properties);
        LiveDecisionService service = service(properties, arena,
            List.of(PipelineFixtures.fixed("bull", Direction.BUY, 1.0)));
        List<MarketSnapshot> series = new ArrayList<>(PipelineFixtures.series(EURUSD, 6));

        TradeSignal first = service.submit(EURUSD, series).block(WAIT);
        InstrumentState state = arena.stateFor(EURUSD);
        double exposure = state.decisionState().riskBudget().exposure();
        double before = state.decisionState().riskBudget().equity();

        MarketSnapshot up = PipelineFixtures.snapshot(EURUSD, 6, series.get(5).last() * 1.02);
        service.submit(EURUSD, List.of(up)).block(WAIT);

        assertEquals(0.1, first.positionSizeFraction(), 1e-12);
        assertEquals(before * (1.0 + exposure * 0.02), state.decisionState().riskBudget().equity(), 1e-6);
        assertEquals(1.0, state.decisionState().reliabilities().score("bull", first.regime()), 1e-12);
    }
}
