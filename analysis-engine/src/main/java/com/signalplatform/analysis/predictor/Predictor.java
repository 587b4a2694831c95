package com.signalplatform.analysis.predictor;

import com.signalplatform.common.model.FeatureVector;
import com.signalplatform.common.model.ModelPrediction;
import reactor.core.publisher.Mono;

/**
 * A single model producing a directional call with confidence from a feature vector.
 *
 * <p>Contract:
 * <ul>
 *   <li>A vector whose schema id differs from {@code descriptor().schemaId()} fails with
 *       {@link com.signalplatform.common.exception.SchemaMismatchException}.</li>
 *   <li>The prediction timestamp is the vector's timestamp.</li>
 *   <li>Side-effect free. Latency is bounded by the caller using {@code descriptor().timeout()}.</li>
 * </ul>
 */
public interface Predictor {

    PredictorDescriptor descriptor();

    Mono<ModelPrediction> predict(FeatureVector features);

    default String id() {
        return descriptor().id();
    }

    /**
     * Width of the feature vector the model was built for, or {@code -1} when the
     * predictor accepts any width.
     */
    default int inputWidth() {
        return -1;
    }

    /** Whether a vector of {@code width} features can be scored by this model. */
    default boolean acceptsWidth(int width) {
        return inputWidth() < 0 || inputWidth() == width;
    }

    /**
     * Whether identical inputs always produce identical predictions. Non-deterministic
     * predictors are excluded from backtest replays.
     */
    default boolean deterministic() {
        return true;
    }
}
