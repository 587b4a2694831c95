package com.signalplatform.orchestrator.pipeline;

import com.signalplatform.analysis.dispatch.DispatchMode;
import com.signalplatform.analysis.dispatch.PredictorDispatchService;
import com.signalplatform.analysis.predictor.Predictor;
import com.signalplatform.common.ensemble.AggregationGuard;
import com.signalplatform.common.ensemble.EnsembleAggregator;
import com.signalplatform.common.ensemble.OutcomeResolver;
import com.signalplatform.common.ensemble.ReliabilityBook;
import com.signalplatform.common.exception.InsufficientHistoryException;
import com.signalplatform.common.feature.FeatureBuilder;
import com.signalplatform.common.model.BlendedSignal;
import com.signalplatform.common.model.FeatureVector;
import com.signalplatform.common.model.MarketSnapshot;
import com.signalplatform.common.model.PredictorResult;
import com.signalplatform.common.model.RegimeState;
import com.signalplatform.common.model.RiskAssessment;
import com.signalplatform.common.model.RiskVerdict;
import com.signalplatform.common.model.TradeSignal;
import com.signalplatform.common.regime.RegimeDetector;
import com.signalplatform.common.risk.RiskBudget;
import com.signalplatform.common.risk.RiskGate;
import com.signalplatform.common.trace.TraceContextUtil;
import com.signalplatform.orchestrator.logger.DecisionFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Single entry point of a decision cycle, shared by the live service and the backtest
 * replayer. Runs the stages in strict order for one snapshot of one instrument:
 *
 * <pre>
 *   regime → features → predictors (fan-out, barrier) → ensemble → risk gate → commit
 * </pre>
 *
 * <p>Emits exactly one {@link Decision} per call. The only error it signals is
 * {@link InsufficientHistoryException}, meaning no decision this tick; predictor failures
 * are absorbed into a degraded ensemble.
 *
 * <p>The regime window advances once per snapshot, before dispatch. Blending, the risk
 * verdict and the exposure commit run as one block under the instrument's monitor (see {@link DecisionState}). Predictors never
 * touch the state.
 */
@Service
public class SignalArbiter {

    private static final Logger log = LoggerFactory.getLogger(SignalArbiter.class);

    private final FeatureBuilder featureBuilder;
    private final PredictorDispatchService dispatchService;
    private final EnsembleAggregator aggregator;
    private final OutcomeResolver outcomeResolver;
    private final DecisionFlowLogger flowLogger;

    public SignalArbiter(FeatureBuilder featureBuilder,
                         PredictorDispatchService dispatchService,
                         EnsembleAggregator aggregator,
                         OutcomeResolver outcomeResolver,
                         DecisionFlowLogger flowLogger) {
        this.featureBuilder  = featureBuilder;
        this.dispatchService = dispatchService;
        this.aggregator      = aggregator;
        this.outcomeResolver = outcomeResolver;
        this.flowLogger      = flowLogger;
    }

    public FeatureBuilder featureBuilder() {
        return featureBuilder;
    }

    /**
     * Runs one cycle and returns only the trade signal.
     *
     * @param history       snapshots strictly before {@code snapshot}, oldest first
     * @param openPositions signed exposure per instrument across the portfolio
     */
    public Mono<TradeSignal> decide(MarketSnapshot snapshot, List<MarketSnapshot> history,
                                    RegimeDetector regimeDetector, ReliabilityBook reliabilities,
                                    RiskBudget riskBudget, Map<String, Double> openPositions,
                                    List<Predictor> predictors, DispatchMode mode) {
        return cycle(snapshot, history, new DecisionState(regimeDetector, reliabilities, riskBudget),
                     openPositions, predictors, mode)
            .map(Decision::signal);
    }

    /**
     * Runs one cycle against {@code state}. The cycle id is read from the Reactor Context
     * ({@link TraceContextUtil#withCycle}).
     */
    public Mono<Decision> cycle(MarketSnapshot snapshot, List<MarketSnapshot> history,
                                DecisionState state, Map<String, Double> openPositions,
                                List<Predictor> predictors, DispatchMode mode) {
        return Mono.deferContextual(ctx -> {
            String cycleId    = TraceContextUtil.getCycleId(ctx);
            String instrument = snapshot.instrument();

            // every snapshot enters the regime window, including cycles later cut off by the deadline
            RegimeState regime;
            synchronized (state.riskBudget()) {
                regime = state.regimeDetector().evaluate(snapshot);
            }

            FeatureVector features;
            try {
                features = featureBuilder.build(snapshot, history);
            } catch (InsufficientHistoryException e) {
                log.info("[Arbiter] No decision this tick. instrument={} available={} required={}",
                         instrument, e.getAvailable(), e.getRequired());
                return Mono.error(e);
            }
            flowLogger.log(DecisionFlowLogger.FEATURES_BUILT, cycleId, instrument,
                           "schema=" + features.schemaId() + " width=" + features.size());

            return dispatchService.dispatchAll(predictors, features, mode)
                .doOnEach(flowLogger.stage(DecisionFlowLogger.PREDICTORS_COMPLETED))
                .map(results -> commit(cycleId, snapshot, features, results, regime, state, openPositions));
        });
    }

    /**
     * Settles the move from {@code from} to {@code to}: the previous decision's responders
     * are scored under the regime it was made in, and the exposure held across the move is
     * marked to market on the budget's equity.
     *
     * @param previous decision made at {@code from}, or {@code null} when that tick had none
     * @return realized P&L as a fraction of equity
     */
    public double settle(DecisionState state, Decision previous, MarketSnapshot from, MarketSnapshot to) {
        double move = OutcomeResolver.relativeMove(from.last(), to.last());
        synchronized (state.riskBudget()) {
            if (previous != null) {
                outcomeResolver.resolve(previous.results(), previous.signal().regime(), move,
                                        state.reliabilities());
            }
            double pnl = OutcomeResolver.pnl(state.riskBudget().exposure(), move);
            state.riskBudget().applyPnl(pnl);
            return pnl;
        }
    }

    private Decision commit(String cycleId, MarketSnapshot snapshot, FeatureVector features,
                            List<PredictorResult> results, RegimeState regime, DecisionState state,
                            Map<String, Double> openPositions) {
        String instrument = snapshot.instrument();
        synchronized (state.riskBudget()) {
            flowLogger.log(DecisionFlowLogger.REGIME_EVALUATED, cycleId, instrument,
                           "regime=" + regime.regime() + " confidence=" + regime.confidence());

            BlendedSignal blended = AggregationGuard.resolve(results, regime, state.reliabilities(), aggregator);
            flowLogger.log(DecisionFlowLogger.ENSEMBLE_BLENDED, cycleId, instrument,
                           "direction=" + blended.direction() + " confidence=" + blended.confidence()
                           + " responded=" + blended.respondedPredictors() + "/" + blended.totalPredictors());
            if (blended.degraded()) {
                log.warn("[Arbiter] Degraded ensemble. instrument={} responded={}/{} failed={}",
                         instrument, blended.respondedPredictors(), blended.totalPredictors(), blended.failed());
            }

            RiskAssessment risk = RiskGate.evaluate(blended, state.riskBudget(), openPositions, instrument);
            if (risk.verdict() == RiskVerdict.VETOED) {
                log.warn("[Arbiter] Risk veto. instrument={} blendedDirection={} confidence={} reason={}",
                         instrument, blended.direction(), blended.confidence(), risk.reason());
            }
            flowLogger.log(DecisionFlowLogger.RISK_EVALUATED, cycleId, instrument,
                           "verdict=" + risk.verdict() + " size=" + risk.positionSizeFraction());

            TradeSignal signal = TradeSignal.of(snapshot, regime, blended, risk);
            RiskGate.commit(state.riskBudget(), signal);
            flowLogger.log(DecisionFlowLogger.SIGNAL_EMITTED, cycleId, instrument,
                           "direction=" + signal.direction() + " size=" + signal.positionSizeFraction()
                           + " exposure=" + state.riskBudget().exposure());
            return new Decision(signal, features, results, blended);
        }
    }
}
