package com.signalplatform.common.ensemble;

import com.signalplatform.common.model.BlendedSignal;
import com.signalplatform.common.model.PredictorResult;
import com.signalplatform.common.model.RegimeState;

import java.util.List;

/**
 * Strategy contract for blending predictor results into one signal.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Read-only</b>: never mutate the reliability book; outcomes are applied by
 *       {@link OutcomeResolver}</li>
 *   <li><b>Pure</b>     : no logging, no reactive types</li>
 *   <li><b>Total</b>    : return a {@link BlendedSignal} for any result list, including
 *       one where every predictor failed</li>
 * </ul>
 */
public interface EnsembleAggregator {

    /**
     * @param results       one entry per registered predictor, failed ones included
     * @param regime        committed regime state for this cycle
     * @param reliabilities reliability book of the instrument (read-only here)
     * @return blended signal, never {@code null}
     */
    BlendedSignal aggregate(List<PredictorResult> results, RegimeState regime,
                            ReliabilityBook reliabilities);
}
