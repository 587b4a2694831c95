package com.signalplatform.common.exception;

import java.time.Duration;

/**
 * A predictor exceeded its latency budget. Absorbed by the ensemble as a missing vote.
 */
public class ModelTimeoutException extends PredictorException {

    private final Duration budget;

    public ModelTimeoutException(String predictorId, Duration budget) {
        super(predictorId, "timed out after " + budget.toMillis() + "ms");
        this.budget = budget;
    }

    public Duration getBudget() {
        return budget;
    }
}
