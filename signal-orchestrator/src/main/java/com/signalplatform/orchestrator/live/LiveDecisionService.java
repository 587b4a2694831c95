package com.signalplatform.orchestrator.live;

import com.signalplatform.analysis.dispatch.DispatchMode;
import com.signalplatform.common.exception.MissedTickException;
import com.signalplatform.common.model.MarketSnapshot;
import com.signalplatform.common.model.TradeSignal;
import com.signalplatform.common.trace.TraceContextUtil;
import com.signalplatform.orchestrator.catalog.PredictorCatalog;
import com.signalplatform.orchestrator.config.SignalPlatformProperties;
import com.signalplatform.orchestrator.logger.DecisionFlowLogger;
import com.signalplatform.orchestrator.pipeline.Decision;
import com.signalplatform.orchestrator.pipeline.DecisionState;
import com.signalplatform.orchestrator.pipeline.SignalArbiter;
import com.signalplatform.orchestrator.state.InstrumentState;
import com.signalplatform.orchestrator.state.InstrumentStateArena;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Live decision cycles, one per incoming tick.
 *
 * <p>Every instrument has a FIFO lane: a unicast sink drained by {@code concatMap}, so two
 * cycles of the same instrument never overlap while different instruments run
 * concurrently. A cycle still running past {@code signal.cycle.deadline} is abandoned and
 * reported as a {@link MissedTickException}; it is never retried, the lane moves on to
 * the next tick.
 *
 * <p>Per cycle, in the lane:
 * <ol>
 *   <li>earlier snapshots carried by the request are observed (outcome settled, history
 *       and regime window advanced) without deciding;</li>
 *   <li>the previous decision is settled against the new tick;</li>
 *   <li>the arbiter decides on the tick with the history accepted before it.</li>
 * </ol>
 */
@Service
public class LiveDecisionService {

    private static final Logger log = LoggerFactory.getLogger(LiveDecisionService.class);

    private record Job(String instrument, List<MarketSnapshot> snapshots, String cycleId,
                       Sinks.One<TradeSignal> result) {}

    private final SignalArbiter arbiter;
    private final InstrumentStateArena arena;
    private final PredictorCatalog catalog;
    private final DecisionFlowLogger flowLogger;
    private final Duration deadline;
    private final ConcurrentHashMap<String, Sinks.Many<Job>> lanes = new ConcurrentHashMap<>();

    public LiveDecisionService(SignalArbiter arbiter,
                               InstrumentStateArena arena,
                               PredictorCatalog catalog,
                               DecisionFlowLogger flowLogger,
                               SignalPlatformProperties properties) {
        this.arbiter    = arbiter;
        this.arena      = arena;
        this.catalog    = catalog;
        this.flowLogger = flowLogger;
        this.deadline   = properties.cycle().deadline();
    }

    /**
     * Queues a cycle for {@code instrument}. The newest snapshot is the tick to decide on;
     * the others are warm-up context.
     *
     * @return the trade signal, or an error: {@code InsufficientHistoryException} (no
     *         decision this tick), {@link MissedTickException}, or
     *         {@link IllegalArgumentException} for a malformed request
     */
    public Mono<TradeSignal> submit(String instrument, List<MarketSnapshot> snapshots) {
        if (snapshots == null || snapshots.isEmpty()) {
            return Mono.error(new IllegalArgumentException("at least one snapshot is required"));
        }
        for (MarketSnapshot s : snapshots) {
            if (!instrument.equals(s.instrument())) {
                return Mono.error(new IllegalArgumentException(
                    "snapshot instrument " + s.instrument() + " does not match request instrument " + instrument));
            }
        }
        List<MarketSnapshot> ordered = new ArrayList<>(snapshots);
        ordered.sort(Comparator.comparing(MarketSnapshot::timestamp));

        Job job = new Job(instrument, ordered, UUID.randomUUID().toString(), Sinks.one());
        Sinks.Many<Job> lane = lanes.computeIfAbsent(instrument, this::openLane);
        Sinks.EmitResult emitted;
        synchronized (lane) {
            emitted = lane.tryEmitNext(job);
        }
        if (emitted.isFailure()) {
            return Mono.error(new IllegalStateException("decision lane for " + instrument + " rejected tick: " + emitted));
        }
        return job.result().asMono();
    }

    private Sinks.Many<Job> openLane(String instrument) {
        Sinks.Many<Job> lane = Sinks.many().unicast().onBackpressureBuffer();
        lane.asFlux()
            .concatMap(this::execute)
            .subscribe();
        log.info("[LiveDecision] Lane opened. instrument={}", instrument);
        return lane;
    }

    /** Completes the job's sink; never errors, so the lane survives failed cycles. */
    private Mono<Void> execute(Job job) {
        return Mono.defer(() -> runCycle(job))
            .doOnNext(signal -> job.result().tryEmitValue(signal))
            .doOnError(e -> job.result().tryEmitError(e))
            .onErrorResume(e -> Mono.empty())
            .then();
    }

    private Mono<TradeSignal> runCycle(Job job) {
        InstrumentState state = arena.stateFor(job.instrument());
        DecisionState decisionState = state.decisionState();
        List<MarketSnapshot> snapshots = job.snapshots();
        MarketSnapshot tick = snapshots.get(snapshots.size() - 1);

        flowLogger.log(DecisionFlowLogger.TICK_RECEIVED, job.cycleId(), job.instrument(),
                       "timestamp=" + tick.timestamp() + " last=" + tick.last());

        for (MarketSnapshot warmUp : snapshots.subList(0, snapshots.size() - 1)) {
            observe(state, warmUp);
        }

        MarketSnapshot previous = state.lastSnapshot();
        if (previous != null && !tick.timestamp().isAfter(previous.timestamp())) {
            return Mono.error(new IllegalArgumentException(
                "tick " + tick.timestamp() + " is not after last accepted " + previous.timestamp()
                + " for " + job.instrument()));
        }
        List<MarketSnapshot> history = state.history();
        if (previous != null) {
            arbiter.settle(decisionState, state.takePending(), previous, tick);
        }
        state.append(tick);

        Mono<TradeSignal> cycle = arbiter.cycle(tick, history, decisionState, arena.openPositions(),
                                                catalog.predictors(), DispatchMode.CONCURRENT)
            .doOnNext(state::setPending)
            .map(Decision::signal)
            .timeout(deadline)
            .onErrorMap(TimeoutException.class, e -> {
                log.warn("[LiveDecision] Missed tick. instrument={} timestamp={} deadline={}",
                         job.instrument(), tick.timestamp(), deadline);
                return new MissedTickException(job.instrument(), tick.timestamp(), deadline);
            });
        return TraceContextUtil.withCycle(cycle, job.cycleId(), job.instrument());
    }

    /** Accepts a snapshot as context only: settles, appends and advances the regime window. */
    private void observe(InstrumentState state, MarketSnapshot snapshot) {
        MarketSnapshot previous = state.lastSnapshot();
        if (previous != null && !snapshot.timestamp().isAfter(previous.timestamp())) {
            return;
        }
        DecisionState decisionState = state.decisionState();
        if (previous != null) {
            arbiter.settle(decisionState, state.takePending(), previous, snapshot);
        }
        state.append(snapshot);
        synchronized (decisionState.riskBudget()) {
            decisionState.regimeDetector().evaluate(snapshot);
        }
    }
}
