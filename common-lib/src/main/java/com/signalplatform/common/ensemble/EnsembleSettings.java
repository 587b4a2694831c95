package com.signalplatform.common.ensemble;

/**
 * Tunables of the ensemble step.
 *
 * @param reliabilityHalfLife  outcomes after which an old reliability observation counts half
 * @param initialReliability   score of a predictor/regime pair with no history yet
 * @param lowConfidenceFactor  confidence multiplier for predictors outside their validated regimes
 * @param maxPositionFraction  position size proposed at confidence 1.0
 * @param flatTolerance        |relative move| at or below which the market counts as flat
 */
public record EnsembleSettings(
    double reliabilityHalfLife,
    double initialReliability,
    double lowConfidenceFactor,
    double maxPositionFraction,
    double flatTolerance
) {
    public EnsembleSettings {
        if (!(reliabilityHalfLife > 0.0)) {
            throw new IllegalArgumentException("reliabilityHalfLife must be > 0, got " + reliabilityHalfLife);
        }
        requireUnit("initialReliability", initialReliability);
        requireUnit("lowConfidenceFactor", lowConfidenceFactor);
        requireUnit("maxPositionFraction", maxPositionFraction);
        if (flatTolerance < 0.0) {
            throw new IllegalArgumentException("flatTolerance must be >= 0, got " + flatTolerance);
        }
    }

    public static EnsembleSettings defaults() {
        return new EnsembleSettings(20.0, 1.0, 0.5, 0.10, 0.0);
    }

    /**
     * Per-outcome decay derived from the half-life.
     * <pre>
     *   decay = 0.5 ^ (1 / halfLife)
     * </pre>
     */
    public double decay() {
        return Math.pow(0.5, 1.0 / reliabilityHalfLife);
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be in [0,1], got " + value);
        }
    }
}
