package com.signalplatform.common.ensemble;

import com.signalplatform.common.model.Regime;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-predictor, per-regime exponentially weighted accuracy scores.
 *
 * <pre>
 *   new = decay × old + (1 − decay) × correctness
 * </pre>
 *
 * <p>Every method is {@code synchronized} so a score is never read while it is being
 * written. Iteration order of {@link #snapshot()} is sorted by predictor id and regime,
 * which keeps serialized checkpoints and replay results stable.
 */
public final class ReliabilityBook {

    private final double initialReliability;
    private final double decay;
    private final Map<String, EnumMap<Regime, Double>> scores = new TreeMap<>();

    public ReliabilityBook(EnsembleSettings settings) {
        this(settings.initialReliability(), settings.decay());
    }

    private ReliabilityBook(double initialReliability, double decay) {
        this.initialReliability = initialReliability;
        this.decay              = decay;
    }

    public synchronized double score(String predictorId, Regime regime) {
        EnumMap<Regime, Double> byRegime = scores.get(predictorId);
        if (byRegime == null) return initialReliability;
        return byRegime.getOrDefault(regime, initialReliability);
    }

    /**
     * Folds one outcome into the score.
     *
     * @param correctness 1.0 if the call matched the realized move, 0.0 otherwise
     * @return the updated score
     */
    public synchronized double update(String predictorId, Regime regime, double correctness) {
        double old     = score(predictorId, regime);
        double updated = decay * old + (1.0 - decay) * correctness;
        scores.computeIfAbsent(predictorId, k -> new EnumMap<>(Regime.class)).put(regime, updated);
        return updated;
    }

    public double decay() {
        return decay;
    }

    public double initialReliability() {
        return initialReliability;
    }

    public synchronized ReliabilityBook copy() {
        ReliabilityBook copy = new ReliabilityBook(initialReliability, decay);
        scores.forEach((id, byRegime) -> copy.scores.put(id, new EnumMap<>(byRegime)));
        return copy;
    }

    /** Detached, ordered view of every stored score. */
    public synchronized Map<String, Map<Regime, Double>> snapshot() {
        Map<String, Map<Regime, Double>> out = new LinkedHashMap<>();
        scores.forEach((id, byRegime) -> out.put(id, new EnumMap<>(byRegime)));
        return out;
    }

    /** Replaces all scores with {@code persisted} (as produced by {@link #snapshot()}). */
    public synchronized void restore(Map<String, Map<Regime, Double>> persisted) {
        scores.clear();
        persisted.forEach((id, byRegime) -> {
            if (byRegime != null && !byRegime.isEmpty()) {
                scores.put(id, new EnumMap<>(byRegime));
            }
        });
    }
}
