package com.signalplatform.common.ensemble;

import com.signalplatform.common.model.PredictorResult;
import com.signalplatform.common.model.Regime;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts configured base weights and regime-conditioned reliability into normalized
 * ensemble weights.
 *
 * <pre>
 *   raw(i)    = max(baseWeight(i), 0) × reliability(i, regime)
 *   weight(i) = raw(i) / Σ raw        over predictors that responded
 * </pre>
 *
 * <p>Failed predictors get no entry. If every raw weight is zero the responders share
 * equal weights, so a fully discredited ensemble still produces a vote.
 */
public final class PredictorScoreCalculator {

    private PredictorScoreCalculator() {}

    /**
     * @param results     this cycle's results in registry order (failed ones are skipped)
     * @param regime      committed regime used to look up reliability
     * @param reliability current reliability book
     * @return predictorId → normalized weight, in input order; empty if nobody responded
     */
    public static Map<String, Double> weights(List<PredictorResult> results, Regime regime,
                                              ReliabilityBook reliability) {
        Map<String, Double> raw = new LinkedHashMap<>();
        double total = 0.0;
        for (PredictorResult r : results) {
            if (!r.responded()) continue;
            double w = Math.max(r.baseWeight(), 0.0) * reliability.score(r.predictorId(), regime);
            raw.put(r.predictorId(), w);
            total += w;
        }
        if (raw.isEmpty()) return raw;

        Map<String, Double> normalized = new LinkedHashMap<>();
        if (total <= 0.0) {
            double equal = 1.0 / raw.size();
            raw.keySet().forEach(id -> normalized.put(id, equal));
            return normalized;
        }
        for (Map.Entry<String, Double> e : raw.entrySet()) {
            normalized.put(e.getKey(), e.getValue() / total);
        }
        return normalized;
    }
}
