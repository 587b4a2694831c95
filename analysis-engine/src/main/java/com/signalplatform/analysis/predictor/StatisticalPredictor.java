package com.signalplatform.analysis.predictor;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalplatform.common.model.FeatureVector;

/**
 * Linear model squashed through tanh.
 * <pre>
 *   score = tanh(scale × (bias + Σ weight[i] × x[i]))
 * </pre>
 * Params: {@code weights} (one per feature), {@code bias} (0), {@code scale} (1), {@code holdBand}.
 */
public class StatisticalPredictor extends LocalModelPredictor {

    private final double[] weights;
    private final double bias;
    private final double scale;

    public StatisticalPredictor(PredictorDescriptor descriptor) {
        super(descriptor);
        JsonNode params = descriptor.params();
        this.weights = doubles(params, "weights");
        this.bias    = params.path("bias").asDouble(0.0);
        this.scale   = params.path("scale").asDouble(1.0);
    }

    @Override
    public int inputWidth() {
        return weights.length;
    }

    @Override
    protected double score(FeatureVector features) {
        double z = bias;
        for (int i = 0; i < weights.length; i++) {
            z += weights[i] * features.get(i);
        }
        return Math.tanh(scale * z);
    }
}
