package com.signalplatform.common.ensemble;

import com.signalplatform.common.model.BlendedSignal;
import com.signalplatform.common.model.Direction;
import com.signalplatform.common.model.PredictorResult;
import com.signalplatform.common.model.RegimeState;

import java.util.List;
import java.util.Map;

/**
 * Safety wrapper around {@link EnsembleAggregator} invocations.
 *
 * <p>A cycle with no registered predictors (empty catalog) still has to emit a signal,
 * so a null or empty result list short-circuits to HOLD without calling the aggregator.
 * Pure utility: no state, no logging.
 */
public final class AggregationGuard {

    private static final BlendedSignal FALLBACK =
        new BlendedSignal(Direction.HOLD, 0.0, 0.0, 0.0, 0, 0, Map.of(), List.of(), List.of());

    private AggregationGuard() {}

    public static BlendedSignal resolve(List<PredictorResult> results, RegimeState regime,
                                        ReliabilityBook reliabilities, EnsembleAggregator aggregator) {
        if (results == null || results.isEmpty()) {
            return FALLBACK;
        }
        return aggregator.aggregate(results, regime, reliabilities);
    }
}
