package com.signalplatform.analysis.predictor;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalplatform.common.exception.PredictorException;
import com.signalplatform.common.model.FeatureVector;

import java.util.ArrayList;
import java.util.List;

/**
 * Fully connected feed-forward network, tanh on every layer, single output neuron.
 *
 * <pre>
 *   params.layers = [ {"weights": [[..], ..], "biases": [..]}, ... ]
 *   weights[j][i] connects input i to neuron j
 * </pre>
 */
public class NeuralNetworkPredictor extends LocalModelPredictor {

    private record Layer(double[][] weights, double[] biases) {}

    private final List<Layer> layers;
    private final int inputWidth;

    public NeuralNetworkPredictor(PredictorDescriptor descriptor) {
        super(descriptor);
        JsonNode array = descriptor.params().path("layers");
        if (!array.isArray() || array.isEmpty()) {
            throw new PredictorException(descriptor.id(), "params.layers must be a non-empty array");
        }
        List<Layer> parsed = new ArrayList<>();
        int width = -1;
        for (int l = 0; l < array.size(); l++) {
            JsonNode layerJson = array.get(l);
            double[] biases = doubles(layerJson, "biases");
            JsonNode rows = layerJson.path("weights");
            if (!rows.isArray() || rows.size() != biases.length) {
                throw new PredictorException(descriptor.id(),
                    "layer " + l + ": weights rows must match biases (" + biases.length + ")");
            }
            double[][] weights = new double[rows.size()][];
            for (int j = 0; j < rows.size(); j++) {
                JsonNode row = rows.get(j);
                weights[j] = new double[row.size()];
                for (int i = 0; i < row.size(); i++) weights[j][i] = row.get(i).asDouble();
                if (width < 0) width = row.size();
                int expected = l == 0 ? width : parsed.get(l - 1).biases().length;
                if (weights[j].length != expected) {
                    throw new PredictorException(descriptor.id(),
                        "layer " + l + " row " + j + ": expected " + expected + " inputs, got " + weights[j].length);
                }
            }
            parsed.add(new Layer(weights, biases));
        }
        if (parsed.get(parsed.size() - 1).biases().length != 1) {
            throw new PredictorException(descriptor.id(), "output layer must have exactly one neuron");
        }
        this.layers     = List.copyOf(parsed);
        this.inputWidth = width;
    }

    @Override
    public int inputWidth() {
        return inputWidth;
    }

    @Override
    protected double score(FeatureVector features) {
        double[] activations = new double[inputWidth];
        for (int i = 0; i < inputWidth; i++) activations[i] = features.get(i);

        for (Layer layer : layers) {
            double[] next = new double[layer.biases().length];
            for (int j = 0; j < next.length; j++) {
                double z = layer.biases()[j];
                double[] row = layer.weights()[j];
                for (int i = 0; i < row.length; i++) z += row[i] * activations[i];
                next[j] = Math.tanh(z);
            }
            activations = next;
        }
        return activations[0];
    }
}
