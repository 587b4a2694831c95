package com.signalplatform.common.regime;

/**
 * Tunables of the regime state machine.
 *
 * @param windowSize               snapshots in the rolling window; detector is undetermined until full
 * @param hysteresis               consecutive matching classifications needed to commit a change
 * @param highVolatilityThreshold  per-step realized volatility above which the market is HIGH_VOLATILITY
 * @param trendSlopeThreshold      |relative slope per step| above which the market is TRENDING
 * @param illiquidSpreadThreshold  mean spread / mid above which the market is ILLIQUID
 * @param minVolume                mean volume below which the market is ILLIQUID (0 disables)
 */
public record RegimeSettings(
    int windowSize,
    int hysteresis,
    double highVolatilityThreshold,
    double trendSlopeThreshold,
    double illiquidSpreadThreshold,
    double minVolume
) {
    public RegimeSettings {
        if (windowSize < 2) {
            throw new IllegalArgumentException("windowSize must be >= 2, got " + windowSize);
        }
        if (hysteresis < 1) {
            throw new IllegalArgumentException("hysteresis must be >= 1, got " + hysteresis);
        }
        if (!(highVolatilityThreshold > 0.0) || !(trendSlopeThreshold > 0.0)
                || !(illiquidSpreadThreshold > 0.0)) {
            throw new IllegalArgumentException("regime thresholds must be positive");
        }
        if (minVolume < 0.0) {
            throw new IllegalArgumentException("minVolume must be >= 0, got " + minVolume);
        }
    }

    public static RegimeSettings defaults() {
        return new RegimeSettings(20, 3, 0.02, 0.001, 0.005, 0.0);
    }
}
