package com.signalplatform.analysis.predictor;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalplatform.common.exception.PredictorException;
import com.signalplatform.common.model.Direction;
import com.signalplatform.common.model.FeatureVector;
import com.signalplatform.common.model.ModelPrediction;
import reactor.core.publisher.Mono;

/**
 * Base for in-process models that map a vector to a score in [−1, +1].
 *
 * <h3>Score → prediction</h3>
 * <pre>
 *   |score| ≤ holdBand → HOLD, confidence = 1 − |score| / holdBand  (0 when holdBand = 0)
 *   score  &gt; holdBand → BUY,  confidence = |score|
 *   score  &lt; −holdBand → SELL, confidence = |score|
 * </pre>
 *
 * <p>Models are immutable after construction, so predictions are deterministic.
 */
public abstract class LocalModelPredictor extends AbstractPredictor {

    private final double holdBand;

    protected LocalModelPredictor(PredictorDescriptor descriptor) {
        super(descriptor);
        this.holdBand = descriptor.params().path("holdBand").asDouble(0.0);
        if (holdBand < 0.0 || holdBand >= 1.0) {
            throw new PredictorException(descriptor.id(), "holdBand must be in [0,1), got " + holdBand);
        }
    }

    /** Raw model output in [−1, +1]. */
    protected abstract double score(FeatureVector features);

    @Override
    protected Mono<ModelPrediction> evaluate(FeatureVector features) {
        return Mono.fromCallable(() -> {
            if (!acceptsWidth(features.size())) {
                throw new PredictorException(descriptor.id(),
                    "cannot score a vector of " + features.size() + " features");
            }
            return toPrediction(features, score(features));
        });
    }

    ModelPrediction toPrediction(FeatureVector features, double rawScore) {
        double score = Math.max(-1.0, Math.min(1.0, rawScore));
        if (Double.isNaN(score)) {
            throw new PredictorException(descriptor.id(), "model produced NaN");
        }
        double magnitude = Math.abs(score);
        if (magnitude <= holdBand) {
            double confidence = holdBand > 0.0 ? 1.0 - magnitude / holdBand : 0.0;
            return new ModelPrediction(descriptor.id(), Direction.HOLD, confidence, features.timestamp());
        }
        return new ModelPrediction(descriptor.id(), Direction.fromScore(score), magnitude, features.timestamp());
    }

    // ── param parsing ───────────────────────────────────────────────────────

    protected double[] doubles(JsonNode node, String field) {
        JsonNode array = node.path(field);
        if (!array.isArray() || array.isEmpty()) {
            throw new PredictorException(descriptor.id(), "params." + field + " must be a non-empty array");
        }
        double[] out = new double[array.size()];
        for (int i = 0; i < out.length; i++) {
            JsonNode v = array.get(i);
            if (!v.isNumber()) {
                throw new PredictorException(descriptor.id(), "params." + field + "[" + i + "] is not a number");
            }
            out[i] = v.asDouble();
        }
        return out;
    }
}
