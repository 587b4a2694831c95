package com.signalplatform.common.ensemble;

import com.signalplatform.common.feature.Indicators;
import com.signalplatform.common.model.BlendedSignal;
import com.signalplatform.common.model.Direction;
import com.signalplatform.common.model.PredictorResult;
import com.signalplatform.common.model.RegimeState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Default {@link EnsembleAggregator}: base weight × regime reliability, normalized over
 * responders.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Weights from {@link PredictorScoreCalculator} (failed predictors excluded).</li>
 *   <li>Effective confidence = confidence, × {@code lowConfidenceFactor} when the
 *       predictor is outside its validated regimes.</li>
 *   <li>{@code score = Σ weight × sign(direction)}; direction from the sign of the score,
 *       exactly 0 → HOLD.</li>
 *   <li>{@code confidence = Σ weight × effectiveConfidence × responded / total}.</li>
 *   <li>{@code proposedSize = confidence × maxPositionFraction}, 0 for HOLD.</li>
 * </ol>
 *
 * <p>Stateless and thread-safe.
 */
public class ReliabilityWeightedAggregator implements EnsembleAggregator {

    private final EnsembleSettings settings;

    public ReliabilityWeightedAggregator(EnsembleSettings settings) {
        this.settings = settings;
    }

    @Override
    public BlendedSignal aggregate(List<PredictorResult> results, RegimeState regime,
                                   ReliabilityBook reliabilities) {
        int total = results.size();
        List<String> failed        = new ArrayList<>();
        List<String> lowConfidence = new ArrayList<>();
        for (PredictorResult r : results) {
            if (!r.responded()) failed.add(r.predictorId());
        }
        int responded = total - failed.size();
        if (responded == 0) {
            return new BlendedSignal(Direction.HOLD, 0.0, 0.0, 0.0, 0, total, Map.of(), List.of(), failed);
        }

        Map<String, Double> weights =
            PredictorScoreCalculator.weights(results, regime.regime(), reliabilities);

        double score      = 0.0;
        double confidence = 0.0;
        for (PredictorResult r : results) {
            if (!r.responded()) continue;
            double w    = weights.get(r.predictorId());
            double conf = r.prediction().confidence();
            if (!r.validFor(regime.regime())) {
                conf *= settings.lowConfidenceFactor();
                lowConfidence.add(r.predictorId());
            }
            score      += w * r.prediction().direction().sign();
            confidence += w * conf;
        }

        confidence = Indicators.clamp(confidence * responded / total, 0.0, 1.0);
        Direction direction = Direction.fromScore(score);
        double proposed = direction == Direction.HOLD ? 0.0 : confidence * settings.maxPositionFraction();

        return new BlendedSignal(direction, confidence, score, proposed, responded, total,
                                 weights, lowConfidence, failed);
    }
}
