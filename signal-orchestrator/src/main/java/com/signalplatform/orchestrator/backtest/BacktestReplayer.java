package com.signalplatform.orchestrator.backtest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.analysis.dispatch.DispatchMode;
import com.signalplatform.analysis.predictor.Predictor;
import com.signalplatform.common.exception.InsufficientHistoryException;
import com.signalplatform.common.exception.ReplayDivergenceException;
import com.signalplatform.common.exception.SignalPlatformException;
import com.signalplatform.common.model.BacktestEvent;
import com.signalplatform.common.model.BacktestResult;
import com.signalplatform.common.model.BacktestSummary;
import com.signalplatform.common.model.MarketSnapshot;
import com.signalplatform.common.model.TradeSignal;
import com.signalplatform.common.trace.TraceContextUtil;
import com.signalplatform.orchestrator.catalog.PredictorCatalog;
import com.signalplatform.orchestrator.pipeline.Decision;
import com.signalplatform.orchestrator.pipeline.DecisionState;
import com.signalplatform.orchestrator.pipeline.SignalArbiter;
import com.signalplatform.orchestrator.state.InstrumentState;
import com.signalplatform.orchestrator.state.InstrumentStateArena;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Replays a historical snapshot sequence through {@link SignalArbiter}, the same entry
 * point live ticks use, against replayer-owned copies of the decision state.
 *
 * <p>Replay of one instrument is single-threaded and strictly timestamp-ordered:
 * <ul>
 *   <li>the decision at step {@code i} sees only snapshots {@code 0..i-1} as history;</li>
 *   <li>snapshot {@code i+1} is used only to settle decision {@code i} (realized P&L and
 *       reliability update) before step {@code i+1} is decided;</li>
 *   <li>every settled move is booked on exactly one event, so the product of
 *       {@code 1 + realizedPnl} over the events equals {@code 1 + totalReturn} whenever
 *       there is at least one event;</li>
 *   <li>predictors run sequentially with no wall-clock timeout, and predictors that are
 *       not deterministic are left out.</li>
 * </ul>
 * Live state is never mutated; seeding from live takes a copy.
 *
 * <p>Blocking: call from a thread that may block (e.g. {@code boundedElastic}).
 */
@Service
public class BacktestReplayer {

    private static final Logger log = LoggerFactory.getLogger(BacktestReplayer.class);

    private final SignalArbiter arbiter;
    private final PredictorCatalog catalog;
    private final InstrumentStateArena arena;
    private final ObjectMapper objectMapper;

    public BacktestReplayer(SignalArbiter arbiter, PredictorCatalog catalog,
                            InstrumentStateArena arena, ObjectMapper objectMapper) {
        this.arbiter      = arbiter;
        this.catalog      = catalog;
        this.arena        = arena;
        this.objectMapper = objectMapper;
    }

    public BacktestResult replay(String instrument, List<MarketSnapshot> snapshots, boolean seedFromLive) {
        return replay(instrument, snapshots, startingState(instrument, seedFromLive),
                      catalog.deterministicPredictors());
    }

    /**
     * Runs the replay twice from identical starting state and compares the serialized
     * results byte for byte.
     *
     * @throws ReplayDivergenceException if the two runs differ
     */
    public BacktestResult replayVerified(String instrument, List<MarketSnapshot> snapshots, boolean seedFromLive) {
        DecisionState seed = startingState(instrument, seedFromLive);
        List<Predictor> predictors = catalog.deterministicPredictors();
        BacktestResult first  = replay(instrument, snapshots, seed.copy(), predictors);
        BacktestResult second = replay(instrument, snapshots, seed.copy(), predictors);
        verifyIdentical(first, second);
        log.info("[Backtest] Determinism verified. instrument={} events={}", instrument, first.events().size());
        return first;
    }

    /**
     * Replays several instruments in parallel, each against its own state. Results are
     * keyed and ordered by instrument.
     */
    public Mono<Map<String, BacktestResult>> replayAll(Map<String, List<MarketSnapshot>> data,
                                                       boolean seedFromLive, boolean verify) {
        return Flux.fromIterable(new TreeMap<>(data).entrySet())
            .flatMap(e -> Mono.fromCallable(() -> verify
                    ? replayVerified(e.getKey(), e.getValue(), seedFromLive)
                    : replay(e.getKey(), e.getValue(), seedFromLive))
                .subscribeOn(Schedulers.boundedElastic()))
            .collectMap(BacktestResult::instrument, r -> r, TreeMap::new);
    }

    /**
     * Core replay loop against an explicit starting state, which it mutates.
     *
     * @throws IllegalArgumentException if a snapshot belongs to another instrument or two
     *                                  snapshots share a timestamp
     */
    public BacktestResult replay(String instrument, List<MarketSnapshot> snapshots,
                                 DecisionState state, List<Predictor> predictors) {
        List<MarketSnapshot> ordered = ordered(instrument, snapshots);
        double initialEquity = state.riskBudget().equity();
        log.info("[Backtest] Replay started. instrument={} snapshots={} predictors={}",
                 instrument, ordered.size(), predictors.size());

        List<BacktestEvent> events = new ArrayList<>();
        int skipped = 0;
        Decision previous = null;
        // P&L of exposure held before the first event (seeded state), booked on that event
        double carriedPnl = 0.0;

        for (int i = 0; i < ordered.size(); i++) {
            MarketSnapshot snapshot = ordered.get(i);
            if (i > 0) {
                double pnl = arbiter.settle(state, previous, ordered.get(i - 1), snapshot);
                if (events.isEmpty()) {
                    carriedPnl = compound(carriedPnl, pnl);
                } else {
                    BacktestEvent last = events.get(events.size() - 1);
                    events.set(events.size() - 1, withPnl(last, compound(last.realizedPnl(), pnl),
                                                          state.riskBudget().equity()));
                }
            }

            List<MarketSnapshot> history = ordered.subList(0, i);
            Mono<Decision> cycle = arbiter.cycle(snapshot, history, state, Map.of(), predictors,
                                                 DispatchMode.SEQUENTIAL);
            try {
                previous = TraceContextUtil.withCycle(cycle, instrument + "-replay-" + i, instrument).block();
            } catch (InsufficientHistoryException e) {
                previous = null;
                skipped++;
                continue;
            }
            TradeSignal signal = previous.signal();
            double opening = events.isEmpty() ? carriedPnl : 0.0;
            events.add(new BacktestEvent(snapshot.timestamp(), signal, state.riskBudget().exposure(),
                                         opening, state.riskBudget().equity()));
        }

        BacktestSummary summary = BacktestStatistics.summarize(
            events, ordered.size(), skipped, initialEquity, state.riskBudget().equity());
        log.info("[Backtest] Replay complete. instrument={} decisions={} skipped={} trades={} vetoes={} totalReturn={}",
                 instrument, summary.decisions(), summary.skippedTicks(), summary.totalTrades(),
                 summary.vetoes(), summary.totalReturn());
        return new BacktestResult(instrument, events, summary);
    }

    private DecisionState startingState(String instrument, boolean seedFromLive) {
        if (seedFromLive) {
            InstrumentState live = arena.find(instrument);
            if (live != null) {
                return live.decisionState().copy();
            }
            log.info("[Backtest] No live state to seed from, using fresh state. instrument={}", instrument);
        }
        return arena.freshDecisionState();
    }

    private static List<MarketSnapshot> ordered(String instrument, List<MarketSnapshot> snapshots) {
        List<MarketSnapshot> ordered = new ArrayList<>(snapshots);
        ordered.sort(Comparator.comparing(MarketSnapshot::timestamp));
        for (int i = 0; i < ordered.size(); i++) {
            MarketSnapshot s = ordered.get(i);
            if (!instrument.equals(s.instrument())) {
                throw new IllegalArgumentException(
                    "snapshot for " + s.instrument() + " in replay of " + instrument);
            }
            if (i > 0 && s.timestamp().equals(ordered.get(i - 1).timestamp())) {
                throw new IllegalArgumentException(
                    "duplicate snapshot timestamp " + s.timestamp() + " in replay of " + instrument);
            }
        }
        return ordered;
    }

    /** Chains two equity-fraction returns: {@code (1 + a)(1 + b) − 1}. */
    private static double compound(double a, double b) {
        return (1.0 + a) * (1.0 + b) - 1.0;
    }

    private static BacktestEvent withPnl(BacktestEvent event, double pnl, double equity) {
        return new BacktestEvent(event.timestamp(), event.signal(), event.exposureAfter(), pnl, equity);
    }

    private void verifyIdentical(BacktestResult first, BacktestResult second) {
        byte[] a;
        byte[] b;
        try {
            a = objectMapper.writeValueAsBytes(first);
            b = objectMapper.writeValueAsBytes(second);
        } catch (JsonProcessingException e) {
            throw new SignalPlatformException("cannot serialize backtest result for " + first.instrument(), e);
        }
        if (!Arrays.equals(a, b)) {
            log.error("[Backtest] Replay divergence. instrument={} firstBytes={} secondBytes={}",
                      first.instrument(), a.length, b.length);
            throw new ReplayDivergenceException(first.instrument(),
                "two replays of identical input produced different results");
        }
    }
}
