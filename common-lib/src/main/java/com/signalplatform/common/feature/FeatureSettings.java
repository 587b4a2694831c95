package com.signalplatform.common.feature;

/**
 * Tunables of the {@code market-v1} feature set.
 *
 * @param schemaId   schema id stamped on every vector; predictors must declare the same id
 * @param fastWindow short moving-average / momentum window
 * @param slowWindow long moving-average / slope / volatility window
 * @param rsiPeriod  RSI period
 */
public record FeatureSettings(String schemaId, int fastWindow, int slowWindow, int rsiPeriod) {

    public static final String DEFAULT_SCHEMA_ID = "market-v1";

    public FeatureSettings {
        if (schemaId == null || schemaId.isBlank()) schemaId = DEFAULT_SCHEMA_ID;
        if (fastWindow < 2) {
            throw new IllegalArgumentException("fastWindow must be >= 2, got " + fastWindow);
        }
        if (slowWindow <= fastWindow) {
            throw new IllegalArgumentException(
                "slowWindow must exceed fastWindow, got fast=" + fastWindow + " slow=" + slowWindow);
        }
        if (rsiPeriod < 2) {
            throw new IllegalArgumentException("rsiPeriod must be >= 2, got " + rsiPeriod);
        }
    }

    public static FeatureSettings defaults() {
        return new FeatureSettings(DEFAULT_SCHEMA_ID, 5, 20, 14);
    }

    /** Number of history snapshots (excluding the current one) a vector needs. */
    public int minLookback() {
        return Math.max(slowWindow, rsiPeriod);
    }
}
