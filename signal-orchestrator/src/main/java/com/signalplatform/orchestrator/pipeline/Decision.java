package com.signalplatform.orchestrator.pipeline;

import com.signalplatform.common.model.BlendedSignal;
import com.signalplatform.common.model.FeatureVector;
import com.signalplatform.common.model.PredictorResult;
import com.signalplatform.common.model.TradeSignal;

import java.util.List;

/**
 * Everything one completed cycle produced. The predictor results are kept so the
 * outcome can be scored against the next price.
 */
public record Decision(
    TradeSignal signal,
    FeatureVector features,
    List<PredictorResult> results,
    BlendedSignal blended
) {
    public Decision {
        results = List.copyOf(results);
    }
}
