package com.signalplatform.orchestrator.logger;

import com.signalplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability component for the decision cycle. Logs each stage of a snapshot's journey
 * through the arbiter without touching pipeline behavior. All methods are pure side-effects.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #TICK_RECEIVED}        : snapshot accepted by the live lane or replayer</li>
 *   <li>{@link #FEATURES_BUILT}       : feature vector built from the history window</li>
 *   <li>{@link #PREDICTORS_COMPLETED} : every predictor call finished</li>
 *   <li>{@link #REGIME_EVALUATED}     : regime detector advanced with this snapshot</li>
 *   <li>{@link #ENSEMBLE_BLENDED}     : aggregator produced the blended signal</li>
 *   <li>{@link #RISK_EVALUATED}       : risk gate verdict applied</li>
 *   <li>{@link #SIGNAL_EMITTED}       : trade signal committed and returned</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads the cycle id from the Reactor Context):
 * <pre>
 *     .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.PREDICTORS_COMPLETED))
 * </pre>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String TICK_RECEIVED        = "TICK_RECEIVED";
    public static final String FEATURES_BUILT       = "FEATURES_BUILT";
    public static final String PREDICTORS_COMPLETED = "PREDICTORS_COMPLETED";
    public static final String REGIME_EVALUATED     = "REGIME_EVALUATED";
    public static final String ENSEMBLE_BLENDED     = "ENSEMBLE_BLENDED";
    public static final String RISK_EVALUATED       = "RISK_EVALUATED";
    public static final String SIGNAL_EMITTED       = "SIGNAL_EMITTED";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage on {@code onNext} only.
     * Bridges Context to MDC for the duration of the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String cycleId    = TraceContextUtil.getCycleId(signal.getContextView());
            String instrument = TraceContextUtil.getInstrument(signal.getContextView());
            log(stageName, cycleId, instrument, null);
        };
    }

    /**
     * Logs a stage when the cycle id is already in hand, optionally with a detail
     * fragment such as {@code "regime=TRENDING confidence=0.71"}.
     */
    public void log(String stageName, String cycleId, String instrument, String detail) {
        TraceContextUtil.withMdc(cycleId, instrument, () -> {
            if (detail == null) {
                log.info("[DecisionFlow] stage={} cycleId={} instrument={}", stageName, cycleId, instrument);
            } else {
                log.info("[DecisionFlow] stage={} cycleId={} instrument={} {}",
                         stageName, cycleId, instrument, detail);
            }
        });
    }
}
