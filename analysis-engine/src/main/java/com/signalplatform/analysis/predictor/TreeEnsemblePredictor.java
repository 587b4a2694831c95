package com.signalplatform.analysis.predictor;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalplatform.common.exception.PredictorException;
import com.signalplatform.common.model.FeatureVector;

import java.util.ArrayList;
import java.util.List;

/**
 * Averaged vote of binary decision trees. Each leaf holds a value in [−1, +1]; the score
 * is the mean leaf value over all trees.
 *
 * <pre>
 *   split: {"feature": 3, "threshold": 0.01, "left": {...}, "right": {...}}   x[3] &lt;= 0.01 goes left
 *   leaf:  {"value": 0.6}
 * </pre>
 */
public class TreeEnsemblePredictor extends LocalModelPredictor {

    private record Node(int feature, double threshold, Node left, Node right, double value) {
        boolean leaf() {
            return left == null;
        }
    }

    private final List<Node> trees;
    private final int maxFeature;

    public TreeEnsemblePredictor(PredictorDescriptor descriptor) {
        super(descriptor);
        JsonNode array = descriptor.params().path("trees");
        if (!array.isArray() || array.isEmpty()) {
            throw new PredictorException(descriptor.id(), "params.trees must be a non-empty array");
        }
        List<Node> parsed = new ArrayList<>(array.size());
        int[] max = {-1};
        for (JsonNode tree : array) {
            parsed.add(parse(tree, max, 0));
        }
        this.trees      = List.copyOf(parsed);
        this.maxFeature = max[0];
    }

    /** Any vector covering the highest split feature is accepted. */
    @Override
    public boolean acceptsWidth(int width) {
        return width > maxFeature;
    }

    @Override
    protected double score(FeatureVector features) {
        double sum = 0.0;
        for (Node tree : trees) {
            Node node = tree;
            while (!node.leaf()) {
                node = features.get(node.feature()) <= node.threshold() ? node.left() : node.right();
            }
            sum += node.value();
        }
        return sum / trees.size();
    }

    private Node parse(JsonNode json, int[] maxFeature, int depth) {
        if (depth > 64) {
            throw new PredictorException(descriptor.id(), "tree deeper than 64 levels");
        }
        if (json.has("value")) {
            double value = json.get("value").asDouble();
            if (value < -1.0 || value > 1.0) {
                throw new PredictorException(descriptor.id(), "leaf value must be in [-1,1], got " + value);
            }
            return new Node(-1, 0.0, null, null, value);
        }
        if (!json.has("feature") || !json.has("left") || !json.has("right")) {
            throw new PredictorException(descriptor.id(), "split node needs feature, left and right");
        }
        int feature = json.get("feature").asInt();
        if (feature < 0) {
            throw new PredictorException(descriptor.id(), "negative feature index " + feature);
        }
        maxFeature[0] = Math.max(maxFeature[0], feature);
        return new Node(feature, json.path("threshold").asDouble(0.0),
                        parse(json.get("left"), maxFeature, depth + 1),
                        parse(json.get("right"), maxFeature, depth + 1), 0.0);
    }
}
