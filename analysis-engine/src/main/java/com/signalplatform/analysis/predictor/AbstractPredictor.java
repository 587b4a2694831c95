package com.signalplatform.analysis.predictor;

import com.signalplatform.common.exception.SchemaMismatchException;
import com.signalplatform.common.model.FeatureVector;
import com.signalplatform.common.model.ModelPrediction;
import reactor.core.publisher.Mono;

/**
 * Checks the schema id before any model code runs.
 */
public abstract class AbstractPredictor implements Predictor {

    protected final PredictorDescriptor descriptor;

    protected AbstractPredictor(PredictorDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    @Override
    public PredictorDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public final Mono<ModelPrediction> predict(FeatureVector features) {
        if (!descriptor.schemaId().equals(features.schemaId())) {
            return Mono.error(new SchemaMismatchException(descriptor.id(), descriptor.schemaId(), features.schemaId()));
        }
        return evaluate(features);
    }

    protected abstract Mono<ModelPrediction> evaluate(FeatureVector features);
}
